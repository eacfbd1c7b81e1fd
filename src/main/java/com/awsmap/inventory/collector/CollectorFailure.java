package com.awsmap.inventory.collector;

public enum CollectorFailure {
    THROTTLED("Request throttled"),
    ACCESS_DENIED("Access denied"),
    UNSUPPORTED_REGION("Service not available in region"),
    TRANSIENT("Transient network failure"),
    PROVIDER_ERROR("Provider error");

    private final String label;

    CollectorFailure(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
