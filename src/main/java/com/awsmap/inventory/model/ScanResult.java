package com.awsmap.inventory.model;

import java.util.List;

public record ScanResult(
        List<ResourceRecord> records,
        List<ScanError> errors,
        ScanMetadata metadata
) {
    public ScanResult {
        records = List.copyOf(records);
        errors = List.copyOf(errors);
    }

    public boolean partial() {
        return !errors.isEmpty() || metadata.cancelled();
    }
}
