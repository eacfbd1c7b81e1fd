package com.awsmap.run;

import com.awsmap.inventory.InventoryService;
import com.awsmap.inventory.ScanRequest;
import com.awsmap.inventory.execution.ScanCancellation;
import com.awsmap.inventory.filter.TagFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Asynchronous runs by id. Finished runs are dropped once they have been idle for the retention period.
 */
@Component
@Slf4j
public class ScanRunRegistry {
    static final Duration DEFAULT_RETENTION = Duration.ofMinutes(30);

    private final InventoryService inventoryService;
    private final ExecutorService scanExecutor;
    private final Duration retention;
    private final Map<String, ScanRun> runs = new ConcurrentHashMap<>();

    @Autowired
    public ScanRunRegistry(InventoryService inventoryService,
                           @Qualifier("scanExecutor") ExecutorService scanExecutor) {
        this(inventoryService, scanExecutor, DEFAULT_RETENTION);
    }

    ScanRunRegistry(InventoryService inventoryService, ExecutorService scanExecutor, Duration retention) {
        this.inventoryService = inventoryService;
        this.scanExecutor = scanExecutor;
        this.retention = retention;
    }

    /**
     * Validates the request and starts it in the background.
     *
     * @throws IllegalArgumentException for malformed tag expressions, a non-positive timeout or worker count
     */
    public ScanRun start(ScanRequest request) {
        cleanupExpiredRuns();
        TagFilter.parse(request.tags());
        if (request.workers() < 1) {
            throw new IllegalArgumentException("Workers must be at least 1, got " + request.workers());
        }
        ScanCancellation cancellation = ScanCancellation.withTimeout(request.timeout());
        String runId = UUID.randomUUID().toString();
        ScanRun run = new ScanRun(runId, request, cancellation);
        runs.put(runId, run);
        log.info("Starting scan run {}.", runId);
        CompletableFuture.runAsync(() -> {
            try {
                run.markCompleted(inventoryService.scan(request, cancellation, run));
                log.info("Scan run {} finished as {}.", runId, run.status());
            } catch (Exception ex) {
                log.error("Scan run {} failed.", runId, ex);
                run.markFailed(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
            }
        }, scanExecutor);
        return run;
    }

    public Optional<ScanRun> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    /**
     * @return false if no such run exists
     */
    public boolean cancel(String runId) {
        ScanRun run = runs.get(runId);
        if (run == null) {
            return false;
        }
        if (run.cancel()) {
            log.info("Cancellation requested for scan run {}.", runId);
        }
        return true;
    }

    void cleanupExpiredRuns() {
        Instant cutoff = Instant.now().minus(retention);
        runs.values().removeIf(run -> run.status().finished() && run.lastUpdated().isBefore(cutoff));
    }
}
