package com.awsmap.api;

import com.awsmap.run.ScanRunStatus;

public class RunNotFinishedException extends RuntimeException {

    public RunNotFinishedException(String runId, ScanRunStatus status) {
        super("Scan run " + runId + " has no result to export (status " + status + ").");
    }
}
