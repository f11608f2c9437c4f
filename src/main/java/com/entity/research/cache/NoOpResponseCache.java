package com.entity.research.cache;

import java.time.Duration;

/**
 * Cache that always fetches.
 */
public class NoOpResponseCache implements ResponseCache {

    @Override
    public <T> T getOrFetch(CacheKey key, Fetcher<T> fetcher, Duration ttl) throws InterruptedException {
        return fetcher.fetch();
    }

    @Override
    public void invalidate(CacheKey key) {
    }

    @Override
    public void invalidateTarget(String target) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
