package com.entity.research.cache;

import java.time.Duration;

/**
 * Configuration for the response cache.
 *
 * @param maxSize    maximum number of entries before least-recently-used eviction
 * @param defaultTtl time-to-live used when a caller passes no TTL
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, Duration defaultTtl, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be > 0");
        }
    }

    /**
     * 10,000 entries, one hour TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, Duration.ofHours(1), true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, Duration.ofSeconds(1), false);
    }
}
