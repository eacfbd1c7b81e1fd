package com.awsmap.aws.collectors;

import com.awsmap.aws.AwsClientFactory;
import com.awsmap.aws.AwsErrors;
import com.awsmap.inventory.collector.CollectorException;
import com.awsmap.inventory.collector.RunScope;
import com.awsmap.inventory.collector.ServiceCollector;
import com.awsmap.inventory.model.ResourceRecord;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Base for SDK-backed collectors. Failures of the primary listing calls fail the unit; failures of
 * per-resource enrichment calls only leave the affected detail empty.
 */
@Slf4j
public abstract class AbstractAwsCollector implements ServiceCollector {

    protected final AwsClientFactory clients;
    private final String service;

    protected AbstractAwsCollector(AwsClientFactory clients, String service) {
        this.clients = clients;
        this.service = service;
    }

    @Override
    public String service() {
        return service;
    }

    @Override
    public final List<ResourceRecord> collect(String region) throws CollectorException {
        return collect(region, RunScope.NONE);
    }

    @Override
    public final List<ResourceRecord> collect(String region, RunScope scope) throws CollectorException {
        try {
            return collectRecords(region, scope);
        } catch (SdkException ex) {
            throw AwsErrors.translate(service, region, ex);
        }
    }

    protected abstract List<ResourceRecord> collectRecords(String region);

    /**
     * Override to share provider calls across the units of a run through {@code scope}.
     */
    protected List<ResourceRecord> collectRecords(String region, RunScope scope) {
        return collectRecords(region);
    }

    protected ResourceRecord record(String type, String id, String arn, String name, String region,
                                    Map<String, Object> details, Map<String, String> tags) {
        return new ResourceRecord(service, type, id, arn, name, region, details, tags);
    }

    /**
     * Runs an enrichment call, returning null if the provider refuses it.
     */
    protected <T> T optional(String what, Supplier<T> call) {
        try {
            return call.get();
        } catch (SdkException ex) {
            log.debug("{}: could not read {}: {}", service, what, ex.getMessage());
            return null;
        }
    }

    protected static <T> Map<String, String> tagMap(Collection<T> tags, Function<T, String> key,
                                                   Function<T, String> value) {
        Map<String, String> result = new LinkedHashMap<>();
        if (tags != null) {
            tags.forEach(tag -> result.put(key.apply(tag), value.apply(tag) == null ? "" : value.apply(tag)));
        }
        return result;
    }

    /**
     * Insertion-ordered details map; values may be null.
     */
    protected static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            details.put((String) keyValues[i], plain(keyValues[i + 1]));
        }
        return details;
    }

    // Enums and timestamps are reported as their string form.
    private static Object plain(Object value) {
        if (value == null || value instanceof Number || value instanceof Boolean
                || value instanceof Collection<?> || value instanceof Map<?, ?>) {
            return value;
        }
        return value.toString();
    }

    protected static String lastSegment(String arnOrPath) {
        return arnOrPath.substring(arnOrPath.lastIndexOf('/') + 1);
    }
}
