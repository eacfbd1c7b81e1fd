package com.awsmap.inventory.collector;

import com.awsmap.inventory.model.ResourceRecord;

import java.util.List;

/**
 * Read-only enumeration of one service's resources in one region.
 *
 * <p>Implementations must be idempotent and side-effect free on the target account. An empty list is a
 * successful "nothing found" result; provider failures are reported as {@link CollectorException}.
 * Retries for throttling, if any, happen inside the implementation.
 */
@FunctionalInterface
public interface Collector {

    List<ResourceRecord> collect(String region) throws CollectorException;

    /**
     * Collects within a run. Implementations that share work across the units of a run keep it in
     * {@code scope}, never in their own fields.
     */
    default List<ResourceRecord> collect(String region, RunScope scope) throws CollectorException {
        return collect(region);
    }
}
