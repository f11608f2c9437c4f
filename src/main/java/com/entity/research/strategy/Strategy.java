package com.entity.research.strategy;

import com.entity.research.cache.ResponseCache;
import com.entity.research.core.model.EntityProfile;
import com.entity.research.core.model.SourceType;
import com.entity.research.ratelimit.KeyedRateLimiter;
import com.entity.research.retry.RetryExecutor;

/**
 * One pluggable way of collecting facts about an entity from one external source.
 *
 * <p>Implementations route every network call through the given retry executor
 * (which takes rate limiter permits) and, for reads, through the response cache.
 * They receive these services from the caller and never create their own.</p>
 */
public interface Strategy {

    StrategyKind kind();

    default String id() {
        return kind().getId();
    }

    /**
     * Source type stamped on every record this strategy produces.
     */
    SourceType sourceType();

    /**
     * Rate limiting key of the external system this strategy talks to.
     */
    String targetKey();

    /**
     * Collects records for the profile. Failures of individual requests may be reported
     * as a PARTIAL or FAILED result instead of being thrown.
     *
     * @throws InterruptedException if the calling thread is interrupted
     */
    StrategyResult execute(EntityProfile profile, KeyedRateLimiter rateLimiter, RetryExecutor retryExecutor,
                           ResponseCache cache) throws InterruptedException;
}
