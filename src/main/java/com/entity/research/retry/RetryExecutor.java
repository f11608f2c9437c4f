package com.entity.research.retry;

import com.entity.research.core.TimeSource;
import com.entity.research.metrics.MetricsService;
import com.entity.research.metrics.NoOpMetricsService;
import com.entity.research.ratelimit.KeyedRateLimiter;
import com.entity.research.ratelimit.Permit;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.DoubleSupplier;

/**
 * Runs a single network operation against a target with classified retries.
 *
 * <p>The operation as a whole passes the target's circuit breaker once and its outcome
 * is recorded there once. Every attempt takes a fresh rate limiter permit which is
 * released before any backoff sleep. Permanent failures
 * are rethrown immediately. Retryable failures are retried until the attempt budget is
 * spent, after which a {@link RetryExhaustedException} carrying the attempt history is
 * thrown.</p>
 */
public class RetryExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final KeyedRateLimiter rateLimiter;
    private final RetryPolicy policy;
    private final TargetCircuitBreakers circuitBreakers;
    private final TimeSource timeSource;
    private final MetricsService metrics;
    private final DoubleSupplier random;
    private final ExecutorService timeoutExecutor;

    private RetryExecutor(Builder builder) {
        this.rateLimiter = builder.rateLimiter;
        this.policy = builder.policy;
        this.circuitBreakers = builder.circuitBreakers;
        this.timeSource = builder.timeSource;
        this.metrics = builder.metrics;
        this.random = builder.random;
        this.timeoutExecutor = policy.requestTimeout() != null
                ? Executors.newCachedThreadPool(r -> {
                    Thread t = new Thread(r, "research-request");
                    t.setDaemon(true);
                    return t;
                })
                : null;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    public KeyedRateLimiter getRateLimiter() {
        return rateLimiter;
    }

    /**
     * Executes with the configured attempt budget and base delay.
     */
    public <T> T execute(String targetKey, Callable<T> operation) throws InterruptedException {
        return execute(targetKey, operation, policy.maxAttempts(), policy.baseDelay());
    }

    /**
     * Executes with an explicit attempt budget and base delay.
     *
     * @throws CollectionException  the permanent failure, or {@link RetryExhaustedException}
     * @throws InterruptedException if interrupted while waiting; not retried
     */
    public <T> T execute(String targetKey, Callable<T> operation, int maxAttempts, Duration baseDelay)
            throws InterruptedException {
        RetryPolicy effective = policy.withAttempts(maxAttempts, baseDelay);
        if (circuitBreakers == null) {
            return runAttempts(targetKey, operation, effective);
        }

        CircuitBreaker breaker = circuitBreakers.forTarget(targetKey);
        if (!breaker.tryAcquirePermission()) {
            log.warn("retry.circuitOpen target={}", targetKey);
            throw new CircuitOpenException(targetKey);
        }
        long start = timeSource.nanoTime();
        boolean recorded = false;
        try {
            T result = runAttempts(targetKey, operation, effective);
            breaker.onSuccess(timeSource.nanoTime() - start, TimeUnit.NANOSECONDS);
            recorded = true;
            return result;
        } catch (RetryExhaustedException e) {
            breaker.onError(timeSource.nanoTime() - start, TimeUnit.NANOSECONDS, e);
            recorded = true;
            throw e;
        } catch (CollectionException e) {
            // The target answered; it is the request that is wrong
            breaker.onSuccess(timeSource.nanoTime() - start, TimeUnit.NANOSECONDS);
            recorded = true;
            throw e;
        } finally {
            if (!recorded) {
                breaker.releasePermission();
            }
        }
    }

    private <T> T runAttempts(String targetKey, Callable<T> operation, RetryPolicy effective)
            throws InterruptedException {
        List<AttemptFailure> failures = new ArrayList<>();
        Exception lastError = null;

        for (int attempt = 1; attempt <= effective.maxAttempts(); attempt++) {
            Duration delay = Duration.ZERO;
            try (Permit permit = rateLimiter.acquire(targetKey)) {
                T result = invoke(operation);
                if (attempt > 1) {
                    log.info("retry.succeeded target={} attempt={}", targetKey, attempt);
                }
                return result;
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                lastError = e;
                FailureKind kind = FailureClassifier.classify(e);
                if (kind == FailureKind.PERMANENT) {
                    log.warn("retry.permanent target={} attempt={} error={}", targetKey, attempt, e.getMessage());
                    throw e instanceof CollectionException ce ? ce : new PermanentClientException(e.getMessage(), e);
                }
                delay = attempt < effective.maxAttempts() ? delayFor(effective, kind, e, attempt) : Duration.ZERO;
                failures.add(new AttemptFailure(attempt, kind, e.getClass().getSimpleName(), e.getMessage(), delay));
                metrics.incrementRetry(kind.name());
                log.warn("retry.failed target={} attempt={}/{} kind={} nextDelayMs={} error={}",
                        targetKey, attempt, effective.maxAttempts(), kind, delay.toMillis(), e.getMessage());
            }

            if (attempt < effective.maxAttempts()) {
                timeSource.sleep(delay);
            }
        }
        throw new RetryExhaustedException(targetKey, failures, lastError);
    }

    Duration delayFor(RetryPolicy effective, FailureKind kind, Exception error, int failedAttempt) {
        if (kind == FailureKind.RATE_LIMITED && error instanceof RateLimitedException rle
                && rle.getRetryAfter().isPresent()) {
            return rle.getRetryAfter().get();
        }
        Duration base = effective.backoff(failedAttempt);
        double factor = 1.0 + effective.jitter() * (2.0 * random.getAsDouble() - 1.0);
        return Duration.ofNanos(Math.max(0L, Math.round(base.toNanos() * factor)));
    }

    private <T> T invoke(Callable<T> operation) throws Exception {
        if (timeoutExecutor == null) {
            return operation.call();
        }
        Future<T> future = timeoutExecutor.submit(operation);
        try {
            return future.get(policy.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientNetworkException("Request timed out after " + policy.requestTimeout().toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }

    @Override
    public void close() {
        if (timeoutExecutor != null) {
            timeoutExecutor.shutdownNow();
        }
    }

    public static Builder builder(KeyedRateLimiter rateLimiter) {
        return new Builder(rateLimiter);
    }

    public static class Builder {
        private final KeyedRateLimiter rateLimiter;
        private RetryPolicy policy = RetryPolicy.defaults();
        private TargetCircuitBreakers circuitBreakers;
        private TimeSource timeSource = TimeSource.system();
        private MetricsService metrics = NoOpMetricsService.INSTANCE;
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

        private Builder(KeyedRateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
        }

        public Builder policy(RetryPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder circuitBreakers(TargetCircuitBreakers circuitBreakers) {
            this.circuitBreakers = circuitBreakers;
            return this;
        }

        public Builder timeSource(TimeSource timeSource) {
            this.timeSource = timeSource;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Source of uniform values in [0, 1) used for jitter.
         */
        public Builder random(DoubleSupplier random) {
            this.random = random;
            return this;
        }

        public RetryExecutor build() {
            if (rateLimiter == null) {
                throw new IllegalStateException("A rate limiter is required");
            }
            return new RetryExecutor(this);
        }
    }
}
