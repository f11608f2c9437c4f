package com.entity.research.ratelimit;

import com.entity.research.core.FakeTimeSource;
import com.entity.research.metrics.MetricsService;
import com.entity.research.metrics.NoOpMetricsService;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class KeyedRateLimiterTest {

    @Test
    void boundsConcurrencyAndPacesGrantsUnderContention() throws Exception {
        FakeTimeSource time = new FakeTimeSource();
        RateLimitConfig config = RateLimitConfig.builder()
                .override("sec-edgar", new TargetLimit(3, 10.0))
                .build();
        KeyedRateLimiter limiter = new KeyedRateLimiter(config, time, NoOpMetricsService.INSTANCE);

        int threads = 50;
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger highWater = new AtomicInteger();
        List<Long> grants = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    try (Permit permit = limiter.acquire("sec-edgar")) {
                        grants.add(permit.getGrantedAtNanos());
                        int now = inFlight.incrementAndGet();
                        highWater.accumulateAndGet(now, Math::max);
                        Thread.sleep(1);
                        inFlight.decrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertTrue(highWater.get() <= 3, "max concurrent was " + highWater.get());
        assertEquals(threads, grants.size());
        List<Long> sorted = new ArrayList<>(grants);
        Collections.sort(sorted);
        long interval = Duration.ofMillis(100).toNanos();
        for (int i = 1; i < sorted.size(); i++) {
            assertTrue(sorted.get(i) - sorted.get(i - 1) >= interval,
                    "grants " + (i - 1) + " and " + i + " are closer than 100ms");
        }
        assertEquals(3, limiter.availablePermits("sec-edgar"));
    }

    @Test
    void keysAreIndependent() throws InterruptedException {
        FakeTimeSource time = new FakeTimeSource();
        KeyedRateLimiter limiter = new KeyedRateLimiter(
                RateLimitConfig.builder().defaultLimit(1, 1.0).build(), time, NoOpMetricsService.INSTANCE);

        try (Permit a = limiter.acquire("target-a"); Permit b = limiter.acquire("target-b")) {
            assertEquals(0L, a.getGrantedAtNanos());
            assertEquals(0L, b.getGrantedAtNanos());
            assertEquals(0, limiter.availablePermits("target-a"));
        }
        assertTrue(time.getSleeps().isEmpty());
        assertEquals(1, limiter.availablePermits("target-a"));
    }

    @Test
    void secondGrantWaitsForMinimumInterval() throws InterruptedException {
        FakeTimeSource time = new FakeTimeSource();
        MetricsService metrics = mock(MetricsService.class);
        KeyedRateLimiter limiter = new KeyedRateLimiter(
                RateLimitConfig.builder().defaultLimit(2, 2.0).build(), time, metrics);

        limiter.acquire("news-search").close();
        Permit second = limiter.acquire("News-Search");
        second.close();

        assertEquals(Duration.ofMillis(500).toNanos(), second.getGrantedAtNanos());
        assertEquals(List.of(Duration.ofMillis(500)), time.getSleeps());
        assertEquals("news-search", second.getTargetKey());
        verify(metrics, times(2)).recordRateLimitWait(eq("news-search"), any(Duration.class));
    }

    @Test
    void permitCloseIsIdempotent() throws InterruptedException {
        KeyedRateLimiter limiter = new KeyedRateLimiter(RateLimitConfig.defaults(), new FakeTimeSource(),
                NoOpMetricsService.INSTANCE);

        Permit permit = limiter.acquire("web");
        permit.close();
        permit.close();

        assertEquals(limiter.getConfig().limitFor("web").maxConcurrent(), limiter.availablePermits("web"));
    }

    @Test
    void knownTargetsCarryConservativeLimits() {
        RateLimitConfig config = RateLimitConfig.builder().withKnownTargets().build();

        assertEquals(new TargetLimit(2, 0.1), config.limitFor("sec-edgar"));
        assertEquals(config.getDefaultLimit(), config.limitFor("unknown-target"));
    }

    @Test
    void targetLimitValidation() {
        assertThrows(IllegalArgumentException.class, () -> new TargetLimit(0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new TargetLimit(1, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new TargetLimit(1, Double.POSITIVE_INFINITY));
        assertEquals(Duration.ofMillis(250), new TargetLimit(1, 4.0).minInterval());
    }
}
