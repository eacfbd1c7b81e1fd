package com.awsmap.api;

public class UnknownRunException extends RuntimeException {

    public UnknownRunException(String runId) {
        super("Scan run not found: " + runId);
    }
}
