package com.awsmap.inventory.execution;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal for one run. Workers check it before taking the next unit; a collector call
 * already in flight always runs to completion.
 */
public final class ScanCancellation {

    public static final Duration MAX_TIMEOUT = Duration.ofDays(7);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final long deadlineNanos;
    private final boolean hasDeadline;

    private ScanCancellation(@Nullable Duration timeout) {
        this.hasDeadline = timeout != null;
        this.deadlineNanos = timeout != null ? System.nanoTime() + timeout.toNanos() : 0L;
    }

    public static ScanCancellation create() {
        return new ScanCancellation(null);
    }

    public static ScanCancellation withTimeout(@Nullable Duration timeout) {
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("Scan timeout must be positive: " + timeout);
        }
        if (timeout != null && timeout.compareTo(MAX_TIMEOUT) > 0) {
            throw new IllegalArgumentException("Scan timeout must not exceed " + MAX_TIMEOUT + ": " + timeout);
        }
        return new ScanCancellation(timeout);
    }

    /**
     * @return true if this call flipped the signal
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get() || timedOut();
    }

    public boolean timedOut() {
        return hasDeadline && System.nanoTime() - deadlineNanos >= 0;
    }
}
