package com.awsmap.inventory.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

public record ScanMetadata(
        String accountId,
        Instant timestamp,
        double scanDurationSeconds,
        int servicesScanned,
        int regionsScanned,
        int unitsPlanned,
        int unitsCompleted,
        int resourceCount,
        Map<String, Set<String>> tagFilter,
        List<String> rejectedServices,
        boolean cancelled,
        List<ServiceTiming> serviceTimings
) {
}
