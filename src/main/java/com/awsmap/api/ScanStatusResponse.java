package com.awsmap.api;

import com.awsmap.inventory.execution.ServiceProgress;
import com.awsmap.inventory.model.ScanResult;
import com.awsmap.run.ScanRun;
import com.awsmap.run.ScanRunStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScanStatusResponse(
        String runId,
        ScanRunStatus status,
        Instant startedAt,
        boolean cancelRequested,
        int completedUnits,
        List<ServiceProgress> progress,
        String failureMessage,
        ScanResult result
) {
    public static ScanStatusResponse from(ScanRun run) {
        return new ScanStatusResponse(
                run.runId(),
                run.status(),
                run.startedAt(),
                run.cancelRequested(),
                run.completedUnits(),
                run.progress(),
                run.failureMessage(),
                run.result());
    }
}
