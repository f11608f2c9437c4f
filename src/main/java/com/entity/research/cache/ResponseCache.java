package com.entity.research.cache;

import java.time.Duration;

/**
 * Memoizes idempotent fetch results. Shared across strategies and jobs.
 * Concurrent lookups of the same key are serialized: only one of them fetches.
 */
public interface ResponseCache {

    /**
     * A fetch operation that may be interrupted while waiting on the network or a permit.
     */
    @FunctionalInterface
    interface Fetcher<T> {
        T fetch() throws InterruptedException;
    }

    /**
     * Returns the cached value for the key, or runs {@code fetcher} and caches its result
     * for {@code ttl}. Failures are not cached. Non-idempotent keys always fetch.
     *
     * @param ttl time-to-live, or null for the configured default
     */
    <T> T getOrFetch(CacheKey key, Fetcher<T> fetcher, Duration ttl) throws InterruptedException;

    void invalidate(CacheKey key);

    /**
     * Drops every entry fetched from the given target.
     */
    void invalidateTarget(String target);

    void invalidateAll();

    CacheStats getStats();
}
