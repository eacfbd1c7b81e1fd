package com.awsmap.inventory.model;

import com.awsmap.inventory.collector.CollectorFailure;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.List;

public record WorkOutcome(
        WorkUnit unit,
        List<ResourceRecord> records,
        @Nullable UnitError error,
        Duration elapsed
) {
    public static WorkOutcome success(WorkUnit unit, List<ResourceRecord> records, Duration elapsed) {
        return new WorkOutcome(unit, List.copyOf(records), null, elapsed);
    }

    public static WorkOutcome failure(WorkUnit unit, CollectorFailure kind, String message, Duration elapsed) {
        return new WorkOutcome(unit, List.of(), new UnitError(kind, message), elapsed);
    }

    public boolean failed() {
        return error != null;
    }

    public record UnitError(CollectorFailure kind, String message) {
    }
}
