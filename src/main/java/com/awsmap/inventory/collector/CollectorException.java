package com.awsmap.inventory.collector;

public class CollectorException extends Exception {

    private final CollectorFailure failure;

    public CollectorException(CollectorFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public CollectorException(CollectorFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public CollectorFailure failure() {
        return failure;
    }
}
