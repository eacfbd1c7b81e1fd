package com.awsmap.inventory.execution;

import com.awsmap.inventory.model.WorkOutcome;

/**
 * Live progress callbacks. Called from worker threads, so implementations must be thread safe.
 */
public interface ScanProgressListener {

    ScanProgressListener NONE = new ScanProgressListener() {
    };

    default void unitCompleted(WorkOutcome outcome, ServiceProgress progress) {
    }

    default void serviceCompleted(ServiceProgress progress) {
    }
}
