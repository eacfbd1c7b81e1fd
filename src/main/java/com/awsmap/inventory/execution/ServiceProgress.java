package com.awsmap.inventory.execution;

public record ServiceProgress(
        String service,
        int totalUnits,
        int completedUnits,
        int failedUnits,
        int resources,
        double elapsedSeconds
) {
    public boolean done() {
        return completedUnits >= totalUnits;
    }
}
