package com.awsmap.inventory.model;

import com.awsmap.inventory.collector.Collector;

/**
 * One planned (service, region) pair. Created at plan time and consumed once by the scheduler.
 */
public record WorkUnit(
        String service,
        String region,
        Collector collector
) {
    public String label() {
        return service + "@" + region;
    }
}
