package com.awsmap.inventory.execution;

import com.awsmap.inventory.collector.RunScope;
import com.awsmap.inventory.model.WorkOutcome;
import com.awsmap.inventory.model.WorkUnit;
import com.awsmap.inventory.plan.ScanPlan;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Mutable state of a single run: progress counters, timing accumulators and values shared by its collectors.
 * One instance per run, handed explicitly to the scheduler and the aggregator.
 */
@Slf4j
public class ScanRunContext implements RunScope {

    private final String accountId;
    private final ScanPlan plan;
    private final boolean timingsRequested;
    private final ScanProgressListener listener;
    private final Instant startedAt;
    private final long startedNanos;
    private final Map<String, ServiceCounter> counters;
    private final AtomicInteger completedUnits = new AtomicInteger();
    private final Map<String, Object> shared = new ConcurrentHashMap<>();

    public ScanRunContext(String accountId, ScanPlan plan, boolean timingsRequested, ScanProgressListener listener) {
        this.accountId = accountId;
        this.plan = plan;
        this.timingsRequested = timingsRequested;
        this.listener = listener != null ? listener : ScanProgressListener.NONE;
        this.startedAt = Instant.now();
        this.startedNanos = System.nanoTime();
        Map<String, ServiceCounter> byService = new LinkedHashMap<>();
        for (WorkUnit unit : plan.units()) {
            byService.computeIfAbsent(unit.service(), ServiceCounter::new).totalUnits++;
        }
        this.counters = Collections.unmodifiableMap(byService);
    }

    public void record(WorkOutcome outcome) {
        ServiceCounter counter = counters.get(outcome.unit().service());
        if (counter == null) {
            throw new IllegalStateException("Outcome for unplanned unit " + outcome.unit().label());
        }
        ServiceProgress progress = counter.add(outcome);
        completedUnits.incrementAndGet();
        try {
            listener.unitCompleted(outcome, progress);
            if (progress.done()) {
                listener.serviceCompleted(progress);
            }
        } catch (RuntimeException ex) {
            log.warn("Progress listener failed for {}: {}", outcome.unit().label(), ex.getMessage());
        }
    }

    @Override
    public <T> T shared(String key, Class<T> type, Supplier<T> loader) {
        return type.cast(shared.computeIfAbsent(key, k -> loader.get()));
    }

    public List<ServiceProgress> progress() {
        List<ServiceProgress> snapshot = new ArrayList<>(counters.size());
        counters.values().forEach(counter -> snapshot.add(counter.snapshot()));
        return snapshot;
    }

    public int completedUnits() {
        return completedUnits.get();
    }

    public Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    public String accountId() {
        return accountId;
    }

    public ScanPlan plan() {
        return plan;
    }

    public boolean timingsRequested() {
        return timingsRequested;
    }

    public Instant startedAt() {
        return startedAt;
    }

    private static final class ServiceCounter {
        private final String service;
        private int totalUnits;
        private int completed;
        private int failed;
        private int resources;
        private long elapsedNanos;

        private ServiceCounter(String service) {
            this.service = service;
        }

        synchronized ServiceProgress add(WorkOutcome outcome) {
            completed++;
            if (outcome.failed()) {
                failed++;
            } else {
                resources += outcome.records().size();
            }
            elapsedNanos += outcome.elapsed().toNanos();
            return snapshot();
        }

        synchronized ServiceProgress snapshot() {
            return new ServiceProgress(service, totalUnits, completed, failed, resources, elapsedNanos / 1_000_000_000.0);
        }
    }
}
