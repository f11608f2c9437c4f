package com.entity.research.cache;

/**
 * Response cache counters.
 *
 * @param hitCount      lookups served from the cache
 * @param missCount     lookups that had to fetch
 * @param evictionCount entries removed by size or expiry
 * @param size          current number of entries
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
