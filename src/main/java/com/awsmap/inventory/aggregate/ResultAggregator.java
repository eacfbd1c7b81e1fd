package com.awsmap.inventory.aggregate;

import com.awsmap.inventory.catalog.ServiceCatalog;
import com.awsmap.inventory.execution.ScanRunContext;
import com.awsmap.inventory.filter.TagFilter;
import com.awsmap.inventory.filter.TagFilterEngine;
import com.awsmap.inventory.model.ResourceRecord;
import com.awsmap.inventory.model.ScanError;
import com.awsmap.inventory.model.ScanMetadata;
import com.awsmap.inventory.model.ScanResult;
import com.awsmap.inventory.model.ServiceTiming;
import com.awsmap.inventory.model.WorkOutcome;
import com.awsmap.inventory.plan.ScanPlan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds the unordered outcomes of a run into one deterministic {@link ScanResult}.
 *
 * <p>The output depends only on the set of outcomes, never on completion order. Outcomes are read in unit
 * order (service, then region), so among records sharing an identity key the one from the last unit in
 * that order is kept.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ResultAggregator {

    static final Comparator<ResourceRecord> RECORD_ORDER = Comparator
            .comparing(ResourceRecord::service)
            .thenComparing(ResourceRecord::region)
            .thenComparing(ResourceRecord::type)
            .thenComparing(ResourceRecord::id);

    static final Comparator<WorkOutcome> UNIT_ORDER = Comparator
            .comparing((WorkOutcome outcome) -> outcome.unit().service())
            .thenComparing(outcome -> outcome.unit().region());

    static final Comparator<ScanError> ERROR_ORDER = Comparator
            .comparing(ScanError::service)
            .thenComparing(ScanError::region)
            .thenComparing(error -> error.kind().name())
            .thenComparing(ScanError::message);

    private final ServiceCatalog catalog;
    private final TagFilterEngine tagFilterEngine;

    public ScanResult aggregate(Collection<WorkOutcome> outcomes, TagFilter filter, ExclusionRules exclusionRules,
                                ScanRunContext context, boolean cancelled) {
        ScanPlan plan = context.plan();
        List<ResourceRecord> flattened = flatten(outcomes);

        List<ResourceRecord> kept = new ArrayList<>(flattened.size());
        int excluded = 0;
        int outOfScope = 0;
        int filteredOut = 0;
        for (ResourceRecord record : flattened) {
            if (exclusionRules.excludes(record)) {
                excluded++;
            } else if (outsideRegionFilter(record, plan)) {
                outOfScope++;
            } else if (!tagFilterEngine.matches(record.tags(), filter)) {
                filteredOut++;
            } else {
                kept.add(record);
            }
        }
        if (outOfScope > 0) {
            log.debug("Dropped {} records reported outside the requested regions {}.", outOfScope, plan.effectiveRegions());
        }
        log.debug("Aggregation: {} collected, {} excluded defaults, {} outside tag filter.", flattened.size(), excluded, filteredOut);

        Map<ResourceRecord.RecordKey, ResourceRecord> unique = new LinkedHashMap<>();
        for (ResourceRecord record : kept) {
            // Last one wins.
            unique.remove(record.identityKey());
            unique.put(record.identityKey(), record);
        }
        List<ResourceRecord> records = new ArrayList<>(unique.values());
        records.sort(RECORD_ORDER);

        List<ScanError> errors = new ArrayList<>();
        for (WorkOutcome outcome : outcomes) {
            if (outcome.failed()) {
                errors.add(new ScanError(outcome.unit().service(), outcome.unit().region(),
                        outcome.error().kind(), outcome.error().message()));
            }
        }
        errors.sort(ERROR_ORDER);

        ScanMetadata metadata = new ScanMetadata(
                context.accountId(),
                context.startedAt(),
                seconds(context.elapsed()),
                plan.services().size(),
                plan.effectiveRegions().size(),
                plan.units().size(),
                outcomes.size(),
                records.size(),
                filter == null ? Map.of() : filter.clauses(),
                plan.rejectedServices(),
                cancelled,
                context.timingsRequested() ? timings(outcomes) : List.of());
        return new ScanResult(records, errors, metadata);
    }

    private List<ResourceRecord> flatten(Collection<WorkOutcome> outcomes) {
        List<WorkOutcome> ordered = new ArrayList<>(outcomes);
        ordered.sort(UNIT_ORDER);
        List<ResourceRecord> flattened = new ArrayList<>();
        for (WorkOutcome outcome : ordered) {
            if (outcome.records() == null) {
                throw new IllegalStateException("Outcome for " + outcome.unit().label() + " carries no record list.");
            }
            flattened.addAll(outcome.records());
        }
        return flattened;
    }

    private boolean outsideRegionFilter(ResourceRecord record, ScanPlan plan) {
        return plan.regionFilterRequested()
                && catalog.contains(record.service())
                && catalog.isRegionSelfReporting(record.service())
                && !plan.inScope(record.region());
    }

    /**
     * Per-service totals, slowest first.
     */
    List<ServiceTiming> timings(Collection<WorkOutcome> outcomes) {
        Map<String, long[]> totals = new TreeMap<>();
        for (WorkOutcome outcome : outcomes) {
            long[] total = totals.computeIfAbsent(outcome.unit().service(), service -> new long[3]);
            total[0] += outcome.elapsed().toNanos();
            total[1]++;
            total[2] += outcome.records().size();
        }
        List<ServiceTiming> timings = new ArrayList<>(totals.size());
        totals.forEach((service, total) -> timings.add(
                new ServiceTiming(service, total[0] / 1_000_000_000.0, (int) total[1], (int) total[2])));
        timings.sort(Comparator.comparingDouble(ServiceTiming::totalSeconds).reversed()
                .thenComparing(ServiceTiming::service));
        return timings;
    }

    private static double seconds(Duration duration) {
        return Math.round(duration.toMillis() / 10.0) / 100.0;
    }
}
