package com.entity.research.strategy;

import com.entity.research.cache.CacheKey;
import com.entity.research.cache.ResponseCache;
import com.entity.research.core.model.CandidateRecord;
import com.entity.research.core.model.EntityProfile;
import com.entity.research.core.model.SourceType;
import com.entity.research.ratelimit.KeyedRateLimiter;
import com.entity.research.retry.CollectionException;
import com.entity.research.retry.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base class for source adapters. Subclasses implement {@link #collect} and fetch
 * through the supplied {@link Session}, which applies caching, retries and request
 * counting. The outcome is derived from what was collected:
 * no request errors is SUCCESS, errors with records is PARTIAL, errors without
 * records is FAILED.
 */
public abstract class AbstractStrategy implements Strategy {
    private static final Logger log = LoggerFactory.getLogger(AbstractStrategy.class);

    private final StrategyKind kind;
    private final SourceType sourceType;
    private final String targetKey;
    private final Duration cacheTtl;

    protected AbstractStrategy(StrategyKind kind, SourceType sourceType, String targetKey, Duration cacheTtl) {
        this.kind = Objects.requireNonNull(kind, "kind is required");
        this.sourceType = Objects.requireNonNull(sourceType, "sourceType is required");
        this.targetKey = Objects.requireNonNull(targetKey, "targetKey is required");
        this.cacheTtl = cacheTtl;
    }

    @Override
    public StrategyKind kind() {
        return kind;
    }

    @Override
    public SourceType sourceType() {
        return sourceType;
    }

    @Override
    public String targetKey() {
        return targetKey;
    }

    @Override
    public final StrategyResult execute(EntityProfile profile, KeyedRateLimiter rateLimiter,
                                        RetryExecutor retryExecutor, ResponseCache cache)
            throws InterruptedException {
        Session session = new Session(retryExecutor, cache);
        List<CandidateRecord> records;
        try {
            records = collect(profile, session);
        } catch (CollectionException e) {
            log.warn("strategy.failed strategy={} error={}", id(), e.getMessage());
            return StrategyResult.failed(session.requestsMade(), e.getMessage());
        }
        if (session.errors.isEmpty()) {
            return StrategyResult.success(records, session.requestsMade());
        }
        String error = String.join("; ", session.errors);
        return records.isEmpty()
                ? StrategyResult.failed(session.requestsMade(), error)
                : StrategyResult.partial(records, session.requestsMade(), error);
    }

    /**
     * Produces this strategy's records for the profile, in output order.
     */
    protected abstract List<CandidateRecord> collect(EntityProfile profile, Session session)
            throws InterruptedException;

    /**
     * Record builder pre-filled with this strategy's id and source type.
     */
    protected CandidateRecord.Builder record(EntityProfile profile) {
        return CandidateRecord.builder()
                .entityType(profile.entityType())
                .sourceType(sourceType)
                .strategyId(id());
    }

    /**
     * Per-execution access to the shared fetch services.
     */
    protected final class Session {
        private final RetryExecutor retryExecutor;
        private final ResponseCache cache;
        private final AtomicInteger requests = new AtomicInteger();
        private final List<String> errors = new ArrayList<>();

        private Session(RetryExecutor retryExecutor, ResponseCache cache) {
            this.retryExecutor = retryExecutor;
            this.cache = cache;
        }

        /**
         * Cached, retried read. Failures propagate and fail the whole strategy.
         */
        public <T> T fetch(String operation, Map<String, ?> params, Callable<T> request)
                throws InterruptedException {
            CacheKey key = CacheKey.of(targetKey, operation, params);
            return cache.getOrFetch(key, () -> retryExecutor.execute(targetKey, counted(request)), cacheTtl);
        }

        /**
         * Like {@link #fetch} but records a failure and returns empty, leaving the
         * strategy free to continue with other requests.
         */
        public <T> Optional<T> tryFetch(String operation, Map<String, ?> params, Callable<T> request)
                throws InterruptedException {
            try {
                return Optional.ofNullable(fetch(operation, params, request));
            } catch (CollectionException e) {
                errors.add(operation + ": " + e.getMessage());
                return Optional.empty();
            }
        }

        public int requestsMade() {
            return requests.get();
        }

        private <T> Callable<T> counted(Callable<T> request) {
            return () -> {
                requests.incrementAndGet();
                return request.call();
            };
        }
    }
}
