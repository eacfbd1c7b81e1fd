package com.awsmap.inventory.model;

import com.awsmap.inventory.collector.CollectorFailure;

public record ScanError(
        String service,
        String region,
        CollectorFailure kind,
        String message
) {
}
