package com.awsmap.api;

import com.awsmap.config.AwsMapProperties;
import com.awsmap.inventory.ScanRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.time.Duration;
import java.util.List;

/**
 * Run configuration as posted by clients. Absent fields fall back to the {@code awsmap.*} defaults.
 */
public record ScanRequestBody(
        List<String> regions,
        List<String> services,
        List<String> tags,
        @Min(1) @Max(200) Integer workers,
        Boolean includeGlobal,
        Boolean timings,
        Duration timeout
) {
    public ScanRequest toScanRequest(AwsMapProperties defaults) {
        return new ScanRequest(
                regions,
                services,
                tags,
                workers != null ? workers : defaults.getWorkers(),
                includeGlobal != null ? includeGlobal : defaults.isIncludeGlobal(),
                timings != null ? timings : defaults.isTimings(),
                timeout);
    }
}
