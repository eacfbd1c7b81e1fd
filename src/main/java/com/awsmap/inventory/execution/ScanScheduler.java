package com.awsmap.inventory.execution;

import com.awsmap.inventory.collector.CollectorException;
import com.awsmap.inventory.collector.CollectorFailure;
import com.awsmap.inventory.collector.RunScope;
import com.awsmap.inventory.model.ResourceRecord;
import com.awsmap.inventory.model.WorkOutcome;
import com.awsmap.inventory.model.WorkUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;

/**
 * Bounded worker pool that drains a run's work queue.
 *
 * <p>Each worker takes units from the shared queue until it is empty or the run is cancelled. A collector
 * failure becomes a failed {@link WorkOutcome} for that unit only; nothing is retried here. Outcomes are
 * returned in completion order.
 */
@Component
@Slf4j
public class ScanScheduler {

    public static final int DEFAULT_CONCURRENCY = 40;

    public List<WorkOutcome> run(List<WorkUnit> units, int concurrency, ScanCancellation cancellation,
                                 ScanRunContext context) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1, got " + concurrency);
        }
        for (WorkUnit unit : units) {
            if (unit.collector() == null) {
                throw new IllegalStateException("Work unit " + unit.label() + " has no collector.");
            }
        }
        if (units.isEmpty()) {
            return List.of();
        }

        Queue<WorkUnit> queue = new ConcurrentLinkedQueue<>(units);
        Queue<WorkOutcome> outcomes = new ConcurrentLinkedQueue<>();
        int width = Math.min(concurrency, units.size());
        log.info("Dispatching {} work units on {} workers.", units.size(), width);

        ExecutorService workers = Executors.newFixedThreadPool(width, new CustomizableThreadFactory("scan-worker-"));
        try {
            List<CompletableFuture<Void>> running = IntStream.range(0, width)
                    .mapToObj(index -> CompletableFuture.runAsync(
                            () -> drain(queue, outcomes, cancellation, context), workers))
                    .toList();
            CompletableFuture.allOf(running.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException ex) {
            throw new IllegalStateException("Scan worker aborted outside a collector call", ex.getCause());
        } finally {
            workers.shutdown();
        }

        if (!queue.isEmpty()) {
            log.info("Run cancelled: {} of {} work units were not dispatched.", queue.size(), units.size());
        }
        return new ArrayList<>(outcomes);
    }

    private void drain(Queue<WorkUnit> queue, Queue<WorkOutcome> outcomes, ScanCancellation cancellation,
                       ScanRunContext context) {
        while (!cancellation.isCancelled()) {
            WorkUnit unit = queue.poll();
            if (unit == null) {
                return;
            }
            WorkOutcome outcome = execute(unit, context);
            outcomes.add(outcome);
            context.record(outcome);
        }
    }

    WorkOutcome execute(WorkUnit unit, RunScope scope) {
        long start = System.nanoTime();
        try {
            List<ResourceRecord> records = unit.collector().collect(unit.region(), scope);
            if (records == null) {
                return WorkOutcome.failure(unit, CollectorFailure.PROVIDER_ERROR,
                        "Collector returned no result list.", since(start));
            }
            WorkOutcome outcome = WorkOutcome.success(unit, records, since(start));
            log.debug("Collected {} resources for {} in {} ms.", records.size(), unit.label(), outcome.elapsed().toMillis());
            return outcome;
        } catch (CollectorException ex) {
            log.warn("Collector failed for {} ({}): {}", unit.label(), ex.failure(), ex.getMessage());
            return WorkOutcome.failure(unit, ex.failure(), describe(ex), since(start));
        } catch (Exception | LinkageError ex) {
            // A missing or broken provider module fails its own unit only.
            log.warn("Collector raised an unexpected error for {}.", unit.label(), ex);
            return WorkOutcome.failure(unit, CollectorFailure.PROVIDER_ERROR, describe(ex), since(start));
        }
    }

    private Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private String describe(Throwable ex) {
        String message = ex.getMessage();
        Throwable cause = ex.getCause();
        while (!StringUtils.hasText(message) && cause != null) {
            message = cause.getMessage();
            cause = cause.getCause();
        }
        return StringUtils.hasText(message) ? message : ex.getClass().getSimpleName();
    }
}
