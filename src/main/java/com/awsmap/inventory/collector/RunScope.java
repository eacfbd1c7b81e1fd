package com.awsmap.inventory.collector;

import java.util.function.Supplier;

/**
 * Values shared by the work units of one run and discarded with it.
 */
public interface RunScope {

    /**
     * A scope that shares nothing: every lookup runs its loader.
     */
    RunScope NONE = new RunScope() {
        @Override
        public <T> T shared(String key, Class<T> type, Supplier<T> loader) {
            return loader.get();
        }
    };

    /**
     * Returns the value stored under {@code key} for this run, loading it on first use. Concurrent callers
     * for the same key wait for a single load. A loader that throws stores nothing.
     */
    <T> T shared(String key, Class<T> type, Supplier<T> loader);
}
