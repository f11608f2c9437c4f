package com.entity.research.cache;

import com.entity.research.metrics.MetricsService;
import com.entity.research.metrics.NoOpMetricsService;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Caffeine-backed response cache with a per-entry TTL and size-bounded eviction.
 *
 * <p>The first caller for a key installs an incomplete future and fetches on its own
 * thread, outside any map lock; later callers for the same key wait on that future.
 * Failed and null results complete the future without leaving an entry behind.</p>
 */
public class CaffeineResponseCache implements ResponseCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResponseCache.class);

    private final AsyncCache<CacheKey, CachedResponse> cache;
    private final CacheConfig config;
    private final MetricsService metrics;

    public CaffeineResponseCache(CacheConfig config) {
        this(config, Ticker.systemTicker(), NoOpMetricsService.INSTANCE);
    }

    public CaffeineResponseCache(CacheConfig config, Ticker ticker, MetricsService metrics) {
        this.config = config;
        this.metrics = metrics;
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfter(new PerEntryExpiry())
                .ticker(ticker)
                .recordStats()
                .buildAsync();
        log.info("CaffeineResponseCache initialized: maxSize={}, defaultTtl={}s",
                config.maxSize(), config.defaultTtl().toSeconds());
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T getOrFetch(CacheKey key, Fetcher<T> fetcher, Duration ttl) throws InterruptedException {
        if (!config.enabled() || !key.idempotent()) {
            return fetcher.fetch();
        }
        Duration effectiveTtl = ttl != null && !ttl.isNegative() && !ttl.isZero() ? ttl : config.defaultTtl();

        while (true) {
            CompletableFuture<CachedResponse> pending = new CompletableFuture<>();
            CompletableFuture<CachedResponse> current = cache.get(key, (k, executor) -> pending);
            if (current == pending) {
                metrics.recordCacheMiss();
                log.debug("cache.miss target={} operation={}", key.target(), key.operation());
                return (T) load(fetcher, effectiveTtl, pending);
            }

            try {
                CachedResponse response = current.get();
                metrics.recordCacheHit();
                log.debug("cache.hit target={} operation={}", key.target(), key.operation());
                return response == null ? null : (T) response.value();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof InterruptedException) {
                    // The loading caller was interrupted; load again ourselves
                    cache.asMap().remove(key, current);
                    continue;
                }
                if (cause instanceof RuntimeException re) {
                    throw re;
                }
                if (cause instanceof Error err) {
                    throw err;
                }
                throw new CompletionException(cause);
            }
        }
    }

    private static Object load(Fetcher<?> fetcher, Duration ttl, CompletableFuture<CachedResponse> pending)
            throws InterruptedException {
        try {
            Object value = fetcher.fetch();
            pending.complete(value == null ? null : new CachedResponse(value, ttl));
            return value;
        } catch (InterruptedException | RuntimeException | Error e) {
            pending.completeExceptionally(e);
            throw e;
        }
    }

    @Override
    public void invalidate(CacheKey key) {
        cache.synchronous().invalidate(key);
    }

    @Override
    public void invalidateTarget(String target) {
        String canonical = target.trim().toLowerCase(Locale.ROOT);
        cache.asMap().keySet().removeIf(k -> k.target().equals(canonical));
        log.debug("Invalidated cache entries for target {}", canonical);
    }

    @Override
    public void invalidateAll() {
        cache.synchronous().invalidateAll();
        log.debug("Invalidated all cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.synchronous().stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.synchronous().estimatedSize()
        );
    }

    /**
     * Cleans up expired entries; Caffeine otherwise does this lazily.
     */
    public void cleanUp() {
        cache.synchronous().cleanUp();
    }

    record CachedResponse(Object value, Duration ttl) {}

    private static final class PerEntryExpiry implements Expiry<CacheKey, CachedResponse> {
        @Override
        public long expireAfterCreate(CacheKey key, CachedResponse value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(CacheKey key, CachedResponse value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(CacheKey key, CachedResponse value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
