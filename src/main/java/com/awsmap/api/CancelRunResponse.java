package com.awsmap.api;

public record CancelRunResponse(
        String runId,
        String status,
        String message
) {
    public static CancelRunResponse requested(String runId) {
        return new CancelRunResponse(runId, "cancel-requested",
                "No further work units will be dispatched; in-flight calls finish first.");
    }

    public static CancelRunResponse alreadyFinished(String runId) {
        return new CancelRunResponse(runId, "finished", "Run already finished.");
    }
}
