package com.awsmap.run;

public enum ScanRunStatus {
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean finished() {
        return this != RUNNING;
    }
}
