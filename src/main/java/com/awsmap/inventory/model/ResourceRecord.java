package com.awsmap.inventory.model;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ResourceRecord(
        String service,
        String type,
        String id,
        @Nullable String arn,
        @Nullable String name,
        String region,
        Map<String, Object> details,
        Map<String, String> tags
) {
    public ResourceRecord {
        requireText(service, "service");
        requireText(type, "type");
        requireText(id, "id");
        requireText(region, "region");
        // details may hold null values, so no Map.copyOf here.
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    public RecordKey identityKey() {
        return new RecordKey(service, type, id, region);
    }

    private static void requireText(String value, String field) {
        if (!StringUtils.hasText(value)) {
            throw new IllegalArgumentException("Resource record " + field + " must not be blank.");
        }
    }

    public record RecordKey(String service, String type, String id, String region) {
    }
}
