package com.awsmap.api;

import java.time.Instant;

public record ScanStartResponse(String runId, Instant startedAt) {
}
