package com.entity.research.retry;

import com.entity.research.core.FakeTimeSource;
import com.entity.research.metrics.MetricsService;
import com.entity.research.metrics.NoOpMetricsService;
import com.entity.research.ratelimit.KeyedRateLimiter;
import com.entity.research.ratelimit.RateLimitConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RetryExecutorTest {

    private static final String TARGET = "sec-edgar";

    private FakeTimeSource time;
    private KeyedRateLimiter limiter;
    private RetryExecutor executor;

    @BeforeEach
    void setUp() {
        time = new FakeTimeSource();
        limiter = new KeyedRateLimiter(RateLimitConfig.builder().defaultLimit(3, 1000.0).build(),
                time, NoOpMetricsService.INSTANCE);
        executor = executorWith(null, NoOpMetricsService.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    private RetryExecutor executorWith(TargetCircuitBreakers breakers, MetricsService metrics) {
        return RetryExecutor.builder(limiter)
                .policy(new RetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(60), 0.25, null))
                .circuitBreakers(breakers)
                .timeSource(time)
                .metrics(metrics)
                .random(() -> 0.5)
                .build();
    }

    @Test
    void returnsFirstSuccessWithoutSleeping() throws InterruptedException {
        assertEquals("ok", executor.execute(TARGET, () -> "ok"));
        assertTrue(time.getSleeps().isEmpty());
    }

    @Test
    @DisplayName("Transient failures are attempted exactly maxAttempts times with exponential backoff")
    void transientFailureExhaustsAttempts() {
        AtomicInteger calls = new AtomicInteger();

        RetryExhaustedException e = assertThrows(RetryExhaustedException.class,
                () -> executor.execute(TARGET, () -> {
                    calls.incrementAndGet();
                    throw new IOException("connection reset");
                }));

        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), time.getSleeps());
        assertEquals(3, e.getAttempts().size());
        assertEquals(TARGET, e.getTargetKey());
        assertEquals(FailureKind.TRANSIENT, e.getKind());
        assertInstanceOf(IOException.class, e.getCause());
        assertEquals(Duration.ZERO, e.getAttempts().get(2).nextDelay());
    }

    @Test
    void recoversAfterTransientFailure() throws InterruptedException {
        MetricsService metrics = mock(MetricsService.class);
        RetryExecutor withMetrics = executorWith(null, metrics);
        AtomicInteger calls = new AtomicInteger();

        String result = withMetrics.execute(TARGET, () -> {
            if (calls.incrementAndGet() == 1) {
                throw new TransientNetworkException("503 from upstream");
            }
            return "filing-index";
        });

        assertEquals("filing-index", result);
        assertEquals(2, calls.get());
        verify(metrics).incrementRetry(FailureKind.TRANSIENT.name());
        withMetrics.close();
    }

    @Test
    void permanentFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        PermanentClientException e = assertThrows(PermanentClientException.class,
                () -> executor.execute(TARGET, () -> {
                    calls.incrementAndGet();
                    throw new IllegalArgumentException("404 not found");
                }));

        assertEquals(1, calls.get());
        assertEquals(FailureKind.PERMANENT, e.getKind());
        assertTrue(time.getSleeps().isEmpty());
    }

    @Test
    void retryAfterHintOverridesBackoff() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();

        executor.execute(TARGET, () -> {
            if (calls.incrementAndGet() == 1) {
                throw new RateLimitedException("429 Too Many Requests", Duration.ofSeconds(5));
            }
            return "ok";
        });

        assertEquals(List.of(Duration.ofSeconds(5)), time.getSleeps());
    }

    @Test
    void explicitBudgetOverridesPolicy() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(RetryExhaustedException.class, () -> executor.execute(TARGET, () -> {
            calls.incrementAndGet();
            throw new IOException("timeout");
        }, 4, Duration.ofMillis(100)));

        assertEquals(4, calls.get());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400)),
                time.getSleeps());
    }

    @Test
    void permitIsReleasedBeforeBackoffSleep() {
        assertThrows(RetryExhaustedException.class, () -> executor.execute(TARGET, () -> {
            throw new IOException("reset");
        }));

        assertEquals(3, limiter.availablePermits(TARGET));
    }

    @Test
    void requestTimeoutIsTransient() {
        RetryExecutor timed = RetryExecutor.builder(limiter)
                .policy(new RetryPolicy(1, Duration.ZERO, 2.0, Duration.ofSeconds(1), 0.0, Duration.ofMillis(50)))
                .timeSource(time)
                .build();
        try {
            RetryExhaustedException e = assertThrows(RetryExhaustedException.class,
                    () -> timed.execute(TARGET, () -> {
                        Thread.sleep(5_000);
                        return "late";
                    }));
            assertEquals(FailureKind.TRANSIENT, e.getKind());
        } finally {
            timed.close();
        }
    }

    @Nested
    class CircuitBreaking {

        private TargetCircuitBreakers breakers;
        private RetryExecutor guarded;

        private void guardWith(int failureThreshold) {
            breakers = new TargetCircuitBreakers(failureThreshold, Duration.ofSeconds(10));
            guarded = executorWith(breakers, NoOpMetricsService.INSTANCE);
        }

        @AfterEach
        void closeGuarded() {
            if (guarded != null) {
                guarded.close();
            }
        }

        private void exhaustOnce() {
            assertThrows(RetryExhaustedException.class, () -> guarded.execute(TARGET, () -> {
                throw new IOException("down");
            }, 1, Duration.ZERO));
        }

        @Test
        void opensAfterConsecutiveFailedOperationsAndRefusesWithoutCallingTarget() throws InterruptedException {
            guardWith(2);
            exhaustOnce();
            assertEquals(CircuitBreaker.State.CLOSED, breakers.getState(TARGET));
            exhaustOnce();
            assertEquals(CircuitBreaker.State.OPEN, breakers.getState(TARGET));

            AtomicInteger calls = new AtomicInteger();
            assertThrows(CircuitOpenException.class, () -> guarded.execute(TARGET, () -> {
                calls.incrementAndGet();
                return "never";
            }));
            assertEquals(0, calls.get());

            breakers.forTarget(TARGET).transitionToHalfOpenState();
            assertEquals("up", guarded.execute(TARGET, () -> "up"));
            assertEquals(CircuitBreaker.State.CLOSED, breakers.getState(TARGET));
        }

        @Test
        @DisplayName("The half-open trial keeps its own retries and closes the circuit when one succeeds")
        void halfOpenTrialRetriesThroughTransientFailure() throws InterruptedException {
            guardWith(1);
            exhaustOnce();
            breakers.forTarget(TARGET).transitionToHalfOpenState();

            AtomicInteger calls = new AtomicInteger();
            String result = guarded.execute(TARGET, () -> {
                if (calls.incrementAndGet() == 1) {
                    throw new IOException("connection reset");
                }
                return "recovered";
            });

            assertEquals("recovered", result);
            assertEquals(2, calls.get());
            assertEquals(CircuitBreaker.State.CLOSED, breakers.getState(TARGET));
        }

        @Test
        void failedTrialReopensInsteadOfStayingHalfOpen() {
            guardWith(1);
            exhaustOnce();
            breakers.forTarget(TARGET).transitionToHalfOpenState();

            exhaustOnce();

            assertEquals(CircuitBreaker.State.OPEN, breakers.getState(TARGET));
            assertThrows(CircuitOpenException.class, () -> guarded.execute(TARGET, () -> "never"));
        }

        @Test
        void interruptedTrialReleasesItsPermission() throws InterruptedException {
            guardWith(1);
            exhaustOnce();
            breakers.forTarget(TARGET).transitionToHalfOpenState();

            assertThrows(InterruptedException.class, () -> guarded.execute(TARGET, () -> {
                throw new InterruptedException("job cancelled");
            }));

            assertEquals(CircuitBreaker.State.HALF_OPEN, breakers.getState(TARGET));
            assertEquals("ok", guarded.execute(TARGET, () -> "ok"));
            assertEquals(CircuitBreaker.State.CLOSED, breakers.getState(TARGET));
        }

        @Test
        void permanentFailureDoesNotCountAgainstTarget() {
            guardWith(1);

            assertThrows(PermanentClientException.class, () -> guarded.execute(TARGET, () -> {
                throw new PermanentClientException("400 bad query");
            }));

            assertEquals(CircuitBreaker.State.CLOSED, breakers.getState(TARGET));
        }

        @Test
        void rejectsNonPositiveThreshold() {
            assertThrows(IllegalArgumentException.class, () -> new TargetCircuitBreakers(0, Duration.ofSeconds(1)));
        }
    }
}
