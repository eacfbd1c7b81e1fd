package com.awsmap.inventory;

import com.awsmap.config.AwsMapProperties;
import com.awsmap.inventory.aggregate.ExclusionRules;
import com.awsmap.inventory.aggregate.ResultAggregator;
import com.awsmap.inventory.catalog.ServiceCatalog;
import com.awsmap.inventory.catalog.ServiceDescriptor;
import com.awsmap.inventory.execution.ScanCancellation;
import com.awsmap.inventory.execution.ScanProgressListener;
import com.awsmap.inventory.execution.ScanRunContext;
import com.awsmap.inventory.execution.ScanScheduler;
import com.awsmap.inventory.filter.TagFilter;
import com.awsmap.inventory.model.ScanResult;
import com.awsmap.inventory.model.ServiceTiming;
import com.awsmap.inventory.model.WorkOutcome;
import com.awsmap.inventory.plan.RegionResolver;
import com.awsmap.inventory.plan.ScanPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one inventory scan: account identity and enabled regions, plan, bounded execution, aggregation.
 */
@Service
@Slf4j
public class InventoryService {

    private final ServiceCatalog catalog;
    private final RegionResolver regionResolver;
    private final ScanScheduler scanScheduler;
    private final ResultAggregator resultAggregator;
    private final AccountIdentitySource accountIdentitySource;
    private final RegionEnablementSource regionEnablementSource;
    private final AwsMapProperties properties;

    public InventoryService(ServiceCatalog catalog,
                            RegionResolver regionResolver,
                            ScanScheduler scanScheduler,
                            ResultAggregator resultAggregator,
                            AccountIdentitySource accountIdentitySource,
                            RegionEnablementSource regionEnablementSource,
                            AwsMapProperties properties) {
        this.catalog = catalog;
        this.regionResolver = regionResolver;
        this.scanScheduler = scanScheduler;
        this.resultAggregator = resultAggregator;
        this.accountIdentitySource = accountIdentitySource;
        this.regionEnablementSource = regionEnablementSource;
        this.properties = properties;
    }

    public ScanResult scan(ScanRequest request) {
        return scan(request, ScanCancellation.withTimeout(request.timeout()), ScanProgressListener.NONE);
    }

    public ScanResult scan(ScanRequest request, ScanCancellation cancellation, ScanProgressListener listener) {
        if (request.workers() < 1) {
            throw new IllegalArgumentException("Workers must be at least 1, got " + request.workers());
        }
        TagFilter filter = TagFilter.parse(request.tags());
        String accountId = accountIdentitySource.currentAccountId();
        List<String> requestedRegions = RegionResolver.normalize(request.regions());
        List<String> enabledRegions = requestedRegions.isEmpty() ? resolveEnabledRegions() : List.of();

        ScanPlan plan = regionResolver.plan(enabledRegions, requestedRegions, request.services(), request.includeGlobal());
        log.info("Scanning account {}: {} services across {} regions with {} workers.",
                accountId, plan.services().size(), plan.effectiveRegions().size(), request.workers());

        ScanRunContext context = new ScanRunContext(accountId, plan, request.timings(), listener);
        List<WorkOutcome> outcomes = scanScheduler.run(plan.units(), request.workers(), cancellation, context);
        boolean cancelled = outcomes.size() < plan.units().size();
        if (cancelled) {
            log.warn("Scan {} after {} of {} work units; result is partial.",
                    cancellation.timedOut() ? "timed out" : "cancelled", outcomes.size(), plan.units().size());
        }

        ScanResult result = resultAggregator.aggregate(outcomes, filter, ExclusionRules.defaults(), context, cancelled);
        log.info("Done: {} resources in {}s ({} errors).", result.metadata().resourceCount(),
                result.metadata().scanDurationSeconds(), result.errors().size());
        if (request.timings()) {
            logTimings(result.metadata().serviceTimings());
        }
        return result;
    }

    public List<ServiceDescriptor> availableServices() {
        return new ArrayList<>(catalog.descriptors());
    }

    private List<String> resolveEnabledRegions() {
        try {
            List<String> regions = regionEnablementSource.enabledRegions();
            if (regions != null && !regions.isEmpty()) {
                return regions;
            }
            log.warn("No enabled regions reported; using {} fallback regions.", properties.getFallbackRegions().size());
        } catch (RuntimeException ex) {
            log.warn("Could not list enabled regions ({}); using {} fallback regions.",
                    ex.getMessage(), properties.getFallbackRegions().size());
        }
        return properties.getFallbackRegions();
    }

    private void logTimings(List<ServiceTiming> timings) {
        log.info("Service timings (slowest first):");
        for (ServiceTiming timing : timings) {
            log.info("  {}: {}s over {} units, {} resources", timing.service(),
                    String.format("%.2f", timing.totalSeconds()), timing.units(), timing.resources());
        }
    }
}
