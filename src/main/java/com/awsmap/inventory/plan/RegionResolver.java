package com.awsmap.inventory.plan;

import com.awsmap.inventory.catalog.ServiceCatalog;
import com.awsmap.inventory.collector.Collector;
import com.awsmap.inventory.collector.CollectorRegistry;
import com.awsmap.inventory.model.WorkUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns the run configuration into the ordered list of (service, region) work units.
 */
@Component
@Slf4j
public class RegionResolver {

    private final ServiceCatalog catalog;
    private final CollectorRegistry collectorRegistry;

    public RegionResolver(ServiceCatalog catalog, CollectorRegistry collectorRegistry) {
        this.catalog = catalog;
        this.collectorRegistry = collectorRegistry;
    }

    /**
     * Plans one run.
     *
     * <p>Regional services get one unit per effective region. A global service gets a single unit pinned to
     * its control-plane region, included when no region filter was requested, when the filter names the
     * control-plane region, or when {@code includeGlobal} forces it. Requested service ids unknown to the
     * catalog are rejected one by one and the rest of the plan proceeds.
     *
     * @param enabledRegions regions enabled for the account, used when no regions were requested
     * @param requestedRegions region filter, empty for a full-account scan
     * @param requestedServices service filter, empty for every cataloged service
     * @param includeGlobal force global services into a region-filtered scan
     */
    public ScanPlan plan(@Nullable Collection<String> enabledRegions,
                         @Nullable Collection<String> requestedRegions,
                         @Nullable Collection<String> requestedServices,
                         boolean includeGlobal) {
        List<String> requested = normalize(requestedServices);
        List<String> rejected = new ArrayList<>();
        Set<String> services = new TreeSet<>();
        if (requested.isEmpty()) {
            services.addAll(catalog.allServices());
        } else {
            for (String service : requested) {
                if (catalog.contains(service)) {
                    services.add(service);
                } else {
                    rejected.add(service);
                }
            }
        }
        if (!rejected.isEmpty()) {
            log.warn("Ignoring unknown services: {}. Known services: {}.",
                    String.join(", ", rejected), String.join(", ", catalog.allServices()));
        }

        List<String> regionFilter = normalize(requestedRegions);
        boolean regionFilterRequested = !regionFilter.isEmpty();
        List<String> regions = regionFilterRequested ? regionFilter : normalize(enabledRegions);

        List<WorkUnit> units = new ArrayList<>();
        for (String service : services) {
            Collector collector = collectorRegistry.find(service)
                    .orElseThrow(() -> new IllegalStateException("No collector registered for cataloged service " + service));
            if (catalog.isGlobal(service)) {
                String controlPlane = catalog.controlPlaneRegion(service).orElseThrow();
                if (!regionFilterRequested || regions.contains(controlPlane) || includeGlobal) {
                    units.add(new WorkUnit(service, controlPlane, collector));
                } else {
                    log.debug("Skipping global service {}: control plane {} outside requested regions.", service, controlPlane);
                }
                continue;
            }
            for (String region : regions) {
                units.add(new WorkUnit(service, region, collector));
            }
        }
        log.info("Planned {} work units for {} services across {} regions.", units.size(), services.size(), regions.size());
        return new ScanPlan(units, new ArrayList<>(services), regions, regionFilterRequested, rejected);
    }

    /**
     * Trims, lower-cases and de-duplicates identifiers, splitting comma-separated entries and dropping blank
     * ones. An input of only blank entries normalizes to an empty list.
     */
    public static List<String> normalize(@Nullable Collection<String> values) {
        if (values == null) {
            return List.of();
        }
        LinkedHashSet<String> normalized = new LinkedHashSet<>();
        for (String value : values) {
            if (!StringUtils.hasText(value)) {
                continue;
            }
            // "-s ec2,s3" and "-s ec2 -s s3" are equivalent.
            for (String part : value.split(",")) {
                if (StringUtils.hasText(part)) {
                    normalized.add(part.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return new ArrayList<>(normalized);
    }
}
