package com.awsmap.inventory.plan;

import com.awsmap.inventory.model.WorkUnit;

import java.util.List;

/**
 * The static work queue of one run.
 *
 * @param units ordered work units, by service then region
 * @param services effective services, sorted
 * @param effectiveRegions requested regions if any, else the enabled regions
 * @param regionFilterRequested whether the caller restricted the regions
 * @param rejectedServices requested identifiers unknown to the catalog
 */
public record ScanPlan(
        List<WorkUnit> units,
        List<String> services,
        List<String> effectiveRegions,
        boolean regionFilterRequested,
        List<String> rejectedServices
) {
    public ScanPlan {
        units = List.copyOf(units);
        services = List.copyOf(services);
        effectiveRegions = List.copyOf(effectiveRegions);
        rejectedServices = List.copyOf(rejectedServices);
    }

    public boolean inScope(String region) {
        return effectiveRegions.contains(region);
    }
}
