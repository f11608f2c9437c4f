package com.entity.research.ratelimit;

import com.entity.research.core.TimeSource;
import com.entity.research.metrics.MetricsService;
import com.entity.research.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * Per-target concurrency and pacing. One instance is shared by every job so that
 * strategies hitting the same external system are throttled together.
 *
 * <p>{@link #acquire(String)} blocks until fewer than {@code maxConcurrent} permits are
 * outstanding for the key and at least {@code 1 / requestsPerSecond} has elapsed since
 * the previous grant for that key. State per key is created on first use. Pacing is
 * serialized per key; different keys never wait on each other.</p>
 */
public class KeyedRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(KeyedRateLimiter.class);

    private final RateLimitConfig config;
    private final TimeSource timeSource;
    private final MetricsService metrics;
    private final Map<String, KeyState> states = new ConcurrentHashMap<>();

    public KeyedRateLimiter(RateLimitConfig config) {
        this(config, TimeSource.system(), NoOpMetricsService.INSTANCE);
    }

    public KeyedRateLimiter(RateLimitConfig config, TimeSource timeSource, MetricsService metrics) {
        this.config = config;
        this.timeSource = timeSource;
        this.metrics = metrics;
    }

    /**
     * Waits for a permit on the given target. Use with try-with-resources.
     *
     * @throws InterruptedException if the caller is interrupted while waiting; no permit is held then
     */
    public Permit acquire(String targetKey) throws InterruptedException {
        String key = RateLimitConfig.canonical(targetKey);
        KeyState state = states.computeIfAbsent(key, k -> new KeyState(config.limitFor(k)));
        long start = timeSource.nanoTime();

        state.slots.acquire();
        long grantedAt;
        try {
            grantedAt = state.pace(timeSource);
        } catch (InterruptedException | RuntimeException e) {
            state.slots.release();
            throw e;
        }

        long waited = grantedAt - start;
        if (waited > 0) {
            log.debug("ratelimit.waited target={} waitedMs={}", key, waited / 1_000_000);
        }
        metrics.recordRateLimitWait(key, Duration.ofNanos(Math.max(0, waited)));
        return new Permit(key, grantedAt, state.slots);
    }

    /**
     * Permits currently available for the key, or the configured maximum if the key is unused.
     */
    public int availablePermits(String targetKey) {
        String key = RateLimitConfig.canonical(targetKey);
        KeyState state = states.get(key);
        return state != null ? state.slots.availablePermits() : config.limitFor(key).maxConcurrent();
    }

    public RateLimitConfig getConfig() {
        return config;
    }

    private static final class KeyState {
        private final Semaphore slots;
        private final long intervalNanos;
        private boolean granted;
        private long nextAllowedNanos;

        private KeyState(TargetLimit limit) {
            this.slots = new Semaphore(limit.maxConcurrent(), true);
            this.intervalNanos = limit.minInterval().toNanos();
        }

        private synchronized long pace(TimeSource timeSource) throws InterruptedException {
            long now = timeSource.nanoTime();
            if (granted && now < nextAllowedNanos) {
                timeSource.sleep(Duration.ofNanos(nextAllowedNanos - now));
                now = Math.max(timeSource.nanoTime(), nextAllowedNanos);
            }
            granted = true;
            nextAllowedNanos = now + intervalNanos;
            return now;
        }
    }
}
