package com.awsmap.run;

import com.awsmap.inventory.ScanRequest;
import com.awsmap.inventory.execution.ScanCancellation;
import com.awsmap.inventory.execution.ScanProgressListener;
import com.awsmap.inventory.execution.ServiceProgress;
import com.awsmap.inventory.model.ScanResult;
import com.awsmap.inventory.model.WorkOutcome;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One asynchronous run tracked by {@link ScanRunRegistry}. Receives live progress from the worker threads.
 */
public class ScanRun implements ScanProgressListener {
    private final String runId;
    private final ScanRequest request;
    private final ScanCancellation cancellation;
    private final Instant startedAt = Instant.now();
    private final Map<String, ServiceProgress> progress = new ConcurrentHashMap<>();
    private final AtomicInteger completedUnits = new AtomicInteger();
    private volatile ScanRunStatus status = ScanRunStatus.RUNNING;
    private volatile ScanResult result;
    private volatile String failureMessage;
    private volatile Instant lastUpdated = Instant.now();

    ScanRun(String runId, ScanRequest request, ScanCancellation cancellation) {
        this.runId = runId;
        this.request = request;
        this.cancellation = cancellation;
    }

    @Override
    public void unitCompleted(WorkOutcome outcome, ServiceProgress serviceProgress) {
        // Snapshots of one service can arrive out of order.
        progress.merge(serviceProgress.service(), serviceProgress,
                (current, next) -> next.completedUnits() >= current.completedUnits() ? next : current);
        completedUnits.incrementAndGet();
        lastUpdated = Instant.now();
    }

    public String runId() {
        return runId;
    }

    public ScanRequest request() {
        return request;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public ScanRunStatus status() {
        return status;
    }

    public ScanResult result() {
        return result;
    }

    public String failureMessage() {
        return failureMessage;
    }

    public int completedUnits() {
        return completedUnits.get();
    }

    public List<ServiceProgress> progress() {
        List<ServiceProgress> snapshot = new ArrayList<>(progress.values());
        snapshot.sort(Comparator.comparing(ServiceProgress::service));
        return snapshot;
    }

    public boolean cancelRequested() {
        return cancellation.isCancelled();
    }

    Instant lastUpdated() {
        return lastUpdated;
    }

    ScanCancellation cancellation() {
        return cancellation;
    }

    synchronized void markCompleted(ScanResult scanResult) {
        result = scanResult;
        status = scanResult.metadata().cancelled() ? ScanRunStatus.CANCELLED : ScanRunStatus.COMPLETED;
        lastUpdated = Instant.now();
    }

    synchronized void markFailed(String message) {
        failureMessage = message;
        status = ScanRunStatus.FAILED;
        lastUpdated = Instant.now();
    }

    boolean cancel() {
        boolean flipped = cancellation.cancel();
        lastUpdated = Instant.now();
        return flipped;
    }
}
