package com.entity.research.orchestrator;

import com.entity.research.cache.CacheConfig;
import com.entity.research.core.model.SourceType;
import com.entity.research.merge.SourcePriority;
import com.entity.research.ratelimit.RateLimitConfig;
import com.entity.research.ratelimit.TargetLimit;
import com.entity.research.retry.RetryPolicy;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables for research jobs: throttling, retries, stop predicates, matching and caching.
 */
public class ResearchOptions {

    private static final int DEFAULT_MAX_CONCURRENT_PER_TARGET = 3;
    private static final double DEFAULT_REQUESTS_PER_SECOND_PER_TARGET = 1.0;
    private static final int DEFAULT_MAX_ATTEMPTS = 3;
    private static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    private static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);
    private static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_MAX_STRATEGIES_PER_JOB = 5;
    private static final Duration DEFAULT_MAX_JOB_DURATION = Duration.ofSeconds(600);
    private static final Duration DEFAULT_STRATEGY_TIMEOUT = Duration.ofSeconds(120);
    private static final int DEFAULT_MAX_PARALLEL_STRATEGIES = 3;
    private static final double DEFAULT_FUZZY_MATCH_THRESHOLD = 0.85;
    private static final int DEFAULT_COVERAGE_THRESHOLD = 80;
    private static final int DEFAULT_MIN_SOURCE_TYPES = 2;
    private static final int DEFAULT_NO_DATA_STRATEGY_FLOOR = 4;
    private static final int DEFAULT_CACHE_MAX_SIZE = 10_000;
    private static final Duration DEFAULT_CACHE_TTL = Duration.ofHours(1);
    private static final int DEFAULT_CIRCUIT_FAILURE_THRESHOLD = 5;
    private static final Duration DEFAULT_CIRCUIT_RESET_TIMEOUT = Duration.ofSeconds(60);

    static final int MAX_PARALLEL_STRATEGIES_LIMIT = 8;

    private final int maxConcurrentPerTarget;
    private final double requestsPerSecondPerTarget;
    private final Map<String, TargetLimit> targetLimits;
    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double backoffMultiplier;
    private final Duration requestTimeout;
    private final int maxStrategiesPerJob;
    private final Duration maxJobDuration;
    private final Duration strategyTimeout;
    private final int maxParallelStrategies;
    private final double fuzzyMatchThreshold;
    private final List<SourceType> sourcePriorityOrder;
    private final int coverageThreshold;
    private final int minSourceTypes;
    private final int noDataStrategyFloor;
    private final int cacheMaxSize;
    private final Duration cacheTtl;
    private final boolean cacheEnabled;
    private final int circuitFailureThreshold;
    private final Duration circuitResetTimeout;

    private ResearchOptions(Builder builder) {
        this.maxConcurrentPerTarget = builder.maxConcurrentPerTarget;
        this.requestsPerSecondPerTarget = builder.requestsPerSecondPerTarget;
        this.targetLimits = Map.copyOf(builder.targetLimits);
        this.maxAttempts = builder.maxAttempts;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.requestTimeout = builder.requestTimeout;
        this.maxStrategiesPerJob = builder.maxStrategiesPerJob;
        this.maxJobDuration = builder.maxJobDuration;
        this.strategyTimeout = builder.strategyTimeout;
        this.maxParallelStrategies = builder.maxParallelStrategies;
        this.fuzzyMatchThreshold = builder.fuzzyMatchThreshold;
        this.sourcePriorityOrder = List.copyOf(builder.sourcePriorityOrder);
        this.coverageThreshold = builder.coverageThreshold;
        this.minSourceTypes = builder.minSourceTypes;
        this.noDataStrategyFloor = builder.noDataStrategyFloor;
        this.cacheMaxSize = builder.cacheMaxSize;
        this.cacheTtl = builder.cacheTtl;
        this.cacheEnabled = builder.cacheEnabled;
        this.circuitFailureThreshold = builder.circuitFailureThreshold;
        this.circuitResetTimeout = builder.circuitResetTimeout;
    }

    public int getMaxConcurrentPerTarget() {
        return maxConcurrentPerTarget;
    }

    public double getRequestsPerSecondPerTarget() {
        return requestsPerSecondPerTarget;
    }

    public Map<String, TargetLimit> getTargetLimits() {
        return targetLimits;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public int getMaxStrategiesPerJob() {
        return maxStrategiesPerJob;
    }

    public Duration getMaxJobDuration() {
        return maxJobDuration;
    }

    public Duration getStrategyTimeout() {
        return strategyTimeout;
    }

    public int getMaxParallelStrategies() {
        return maxParallelStrategies;
    }

    public double getFuzzyMatchThreshold() {
        return fuzzyMatchThreshold;
    }

    public List<SourceType> getSourcePriorityOrder() {
        return sourcePriorityOrder;
    }

    public int getCoverageThreshold() {
        return coverageThreshold;
    }

    public int getMinSourceTypes() {
        return minSourceTypes;
    }

    public int getNoDataStrategyFloor() {
        return noDataStrategyFloor;
    }

    public int getCacheMaxSize() {
        return cacheMaxSize;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public int getCircuitFailureThreshold() {
        return circuitFailureThreshold;
    }

    public Duration getCircuitResetTimeout() {
        return circuitResetTimeout;
    }

    public SourcePriority sourcePriority() {
        return SourcePriority.of(sourcePriorityOrder);
    }

    /**
     * Rate limits: the per-target default, the built-in limits for known public sources,
     * and any explicit per-target overrides, the latter winning.
     */
    public RateLimitConfig rateLimitConfig() {
        RateLimitConfig.Builder builder = RateLimitConfig.builder()
                .defaultLimit(maxConcurrentPerTarget, requestsPerSecondPerTarget);
        targetLimits.forEach(builder::override);
        return builder.withKnownTargets().build();
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(maxAttempts, baseDelay, backoffMultiplier, maxDelay, RetryPolicy.DEFAULT_JITTER,
                requestTimeout);
    }

    public CacheConfig cacheConfig() {
        return new CacheConfig(cacheMaxSize, cacheTtl, cacheEnabled);
    }

    public static ResearchOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxConcurrentPerTarget = DEFAULT_MAX_CONCURRENT_PER_TARGET;
        private double requestsPerSecondPerTarget = DEFAULT_REQUESTS_PER_SECOND_PER_TARGET;
        private final Map<String, TargetLimit> targetLimits = new LinkedHashMap<>();
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private double backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private int maxStrategiesPerJob = DEFAULT_MAX_STRATEGIES_PER_JOB;
        private Duration maxJobDuration = DEFAULT_MAX_JOB_DURATION;
        private Duration strategyTimeout = DEFAULT_STRATEGY_TIMEOUT;
        private int maxParallelStrategies = DEFAULT_MAX_PARALLEL_STRATEGIES;
        private double fuzzyMatchThreshold = DEFAULT_FUZZY_MATCH_THRESHOLD;
        private List<SourceType> sourcePriorityOrder = Arrays.asList(SourceType.values());
        private int coverageThreshold = DEFAULT_COVERAGE_THRESHOLD;
        private int minSourceTypes = DEFAULT_MIN_SOURCE_TYPES;
        private int noDataStrategyFloor = DEFAULT_NO_DATA_STRATEGY_FLOOR;
        private int cacheMaxSize = DEFAULT_CACHE_MAX_SIZE;
        private Duration cacheTtl = DEFAULT_CACHE_TTL;
        private boolean cacheEnabled = true;
        private int circuitFailureThreshold = DEFAULT_CIRCUIT_FAILURE_THRESHOLD;
        private Duration circuitResetTimeout = DEFAULT_CIRCUIT_RESET_TIMEOUT;

        public Builder maxConcurrentPerTarget(int maxConcurrentPerTarget) {
            positive("maxConcurrentPerTarget", maxConcurrentPerTarget);
            this.maxConcurrentPerTarget = maxConcurrentPerTarget;
            return this;
        }

        public Builder requestsPerSecondPerTarget(double requestsPerSecondPerTarget) {
            if (!(requestsPerSecondPerTarget > 0.0)) {
                throw new IllegalArgumentException("requestsPerSecondPerTarget must be positive");
            }
            this.requestsPerSecondPerTarget = requestsPerSecondPerTarget;
            return this;
        }

        public Builder targetLimit(String targetKey, TargetLimit limit) {
            this.targetLimits.put(targetKey, limit);
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            positive("maxAttempts", maxAttempts);
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = nonNegative("baseDelay", baseDelay);
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = nonNegative("maxDelay", maxDelay);
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            if (backoffMultiplier < 1.0) {
                throw new IllegalArgumentException("backoffMultiplier must be at least 1.0");
            }
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        /**
         * Per-request timeout; zero disables it.
         */
        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = nonNegative("requestTimeout", requestTimeout);
            return this;
        }

        public Builder maxStrategiesPerJob(int maxStrategiesPerJob) {
            positive("maxStrategiesPerJob", maxStrategiesPerJob);
            this.maxStrategiesPerJob = maxStrategiesPerJob;
            return this;
        }

        public Builder maxJobDuration(Duration maxJobDuration) {
            this.maxJobDuration = nonNegative("maxJobDuration", maxJobDuration);
            return this;
        }

        public Builder strategyTimeout(Duration strategyTimeout) {
            this.strategyTimeout = nonNegative("strategyTimeout", strategyTimeout);
            return this;
        }

        public Builder maxParallelStrategies(int maxParallelStrategies) {
            if (maxParallelStrategies < 1 || maxParallelStrategies > MAX_PARALLEL_STRATEGIES_LIMIT) {
                throw new IllegalArgumentException(
                        "maxParallelStrategies must be between 1 and " + MAX_PARALLEL_STRATEGIES_LIMIT);
            }
            this.maxParallelStrategies = maxParallelStrategies;
            return this;
        }

        public Builder fuzzyMatchThreshold(double fuzzyMatchThreshold) {
            if (fuzzyMatchThreshold <= 0.0 || fuzzyMatchThreshold > 1.0) {
                throw new IllegalArgumentException("fuzzyMatchThreshold must be in (0.0, 1.0]");
            }
            this.fuzzyMatchThreshold = fuzzyMatchThreshold;
            return this;
        }

        public Builder sourcePriorityOrder(List<SourceType> sourcePriorityOrder) {
            SourcePriority.of(sourcePriorityOrder);
            this.sourcePriorityOrder = List.copyOf(sourcePriorityOrder);
            return this;
        }

        public Builder coverageThreshold(int coverageThreshold) {
            if (coverageThreshold < 0 || coverageThreshold > 100) {
                throw new IllegalArgumentException("coverageThreshold must be between 0 and 100");
            }
            this.coverageThreshold = coverageThreshold;
            return this;
        }

        public Builder minSourceTypes(int minSourceTypes) {
            positive("minSourceTypes", minSourceTypes);
            this.minSourceTypes = minSourceTypes;
            return this;
        }

        public Builder noDataStrategyFloor(int noDataStrategyFloor) {
            positive("noDataStrategyFloor", noDataStrategyFloor);
            this.noDataStrategyFloor = noDataStrategyFloor;
            return this;
        }

        public Builder cacheMaxSize(int cacheMaxSize) {
            positive("cacheMaxSize", cacheMaxSize);
            this.cacheMaxSize = cacheMaxSize;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            if (cacheTtl == null || cacheTtl.isZero() || cacheTtl.isNegative()) {
                throw new IllegalArgumentException("cacheTtl must be positive");
            }
            this.cacheTtl = cacheTtl;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder circuitFailureThreshold(int circuitFailureThreshold) {
            positive("circuitFailureThreshold", circuitFailureThreshold);
            this.circuitFailureThreshold = circuitFailureThreshold;
            return this;
        }

        public Builder circuitResetTimeout(Duration circuitResetTimeout) {
            if (circuitResetTimeout == null || circuitResetTimeout.toMillis() < 1) {
                throw new IllegalArgumentException("circuitResetTimeout must be at least 1ms");
            }
            this.circuitResetTimeout = circuitResetTimeout;
            return this;
        }

        public ResearchOptions build() {
            if (maxDelay.compareTo(baseDelay) < 0) {
                throw new IllegalArgumentException("maxDelay must not be shorter than baseDelay");
            }
            return new ResearchOptions(this);
        }

        private static void positive(String name, int value) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }

        private static Duration nonNegative(String name, Duration value) {
            if (value == null || value.isNegative()) {
                throw new IllegalArgumentException(name + " must not be negative");
            }
            return value;
        }
    }

    @Override
    public String toString() {
        return "ResearchOptions{" +
                "maxConcurrentPerTarget=" + maxConcurrentPerTarget +
                ", requestsPerSecondPerTarget=" + requestsPerSecondPerTarget +
                ", maxAttempts=" + maxAttempts +
                ", baseDelay=" + baseDelay +
                ", maxStrategiesPerJob=" + maxStrategiesPerJob +
                ", maxJobDuration=" + maxJobDuration +
                ", maxParallelStrategies=" + maxParallelStrategies +
                ", fuzzyMatchThreshold=" + fuzzyMatchThreshold +
                ", sourcePriorityOrder=" + sourcePriorityOrder +
                '}';
    }
}
