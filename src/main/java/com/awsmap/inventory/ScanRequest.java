package com.awsmap.inventory;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.List;

/**
 * Configuration of one run.
 *
 * @param regions region filter, empty to scan every enabled region
 * @param services service filter, empty to scan every cataloged service
 * @param tags {@code Key=Value} tag expressions
 * @param workers worker pool width, at least 1
 * @param includeGlobal force global services into a region-filtered scan
 * @param timings attach per-service timings to the metadata
 * @param timeout optional deadline after which no further units are dispatched
 */
public record ScanRequest(
        List<String> regions,
        List<String> services,
        List<String> tags,
        int workers,
        boolean includeGlobal,
        boolean timings,
        @Nullable Duration timeout
) {
    public ScanRequest {
        regions = regions == null ? List.of() : List.copyOf(regions);
        services = services == null ? List.of() : List.copyOf(services);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
