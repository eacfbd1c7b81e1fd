package com.awsmap.inventory.aggregate;

import com.awsmap.inventory.model.ResourceRecord;

import java.util.function.Predicate;

/**
 * Drops an AWS-managed default resource of one (service, type). The matcher is tried against the record's
 * name and id.
 */
public record ExclusionRule(
        String service,
        String type,
        String description,
        Predicate<String> matcher
) {

    public static ExclusionRule named(String service, String type, String name) {
        return new ExclusionRule(service, type, type + " '" + name + "'", name::equals);
    }

    public static ExclusionRule prefixed(String service, String type, String prefix) {
        return new ExclusionRule(service, type, type + " '" + prefix + "*'", value -> value.startsWith(prefix));
    }

    public boolean excludes(ResourceRecord record) {
        if (!service.equals(record.service()) || !type.equals(record.type())) {
            return false;
        }
        return (record.name() != null && matcher.test(record.name())) || matcher.test(record.id());
    }
}
