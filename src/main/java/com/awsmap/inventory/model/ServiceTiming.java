package com.awsmap.inventory.model;

public record ServiceTiming(
        String service,
        double totalSeconds,
        int units,
        int resources
) {
}
