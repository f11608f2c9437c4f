package com.entity.research.ratelimit;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Default limit plus per-target overrides. Target keys are matched case-insensitively.
 */
public final class RateLimitConfig {

    /**
     * Conservative limits for public sources the built-in strategies talk to.
     */
    public static final Map<String, TargetLimit> KNOWN_TARGETS = Map.of(
            "sec-edgar", new TargetLimit(2, 0.1),
            "news-search", new TargetLimit(3, 0.5),
            "company-registry", new TargetLimit(2, 0.5),
            "web", new TargetLimit(3, 1.0)
    );

    private final TargetLimit defaultLimit;
    private final Map<String, TargetLimit> overrides;

    private RateLimitConfig(Builder builder) {
        this.defaultLimit = builder.defaultLimit;
        this.overrides = Map.copyOf(builder.overrides);
    }

    public static RateLimitConfig defaults() {
        return builder().build();
    }

    public TargetLimit getDefaultLimit() {
        return defaultLimit;
    }

    public Map<String, TargetLimit> getOverrides() {
        return overrides;
    }

    public TargetLimit limitFor(String targetKey) {
        return overrides.getOrDefault(canonical(targetKey), defaultLimit);
    }

    static String canonical(String targetKey) {
        return targetKey.trim().toLowerCase(Locale.ROOT);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private TargetLimit defaultLimit = new TargetLimit(3, 1.0);
        private final Map<String, TargetLimit> overrides = new HashMap<>();

        public Builder defaultLimit(TargetLimit defaultLimit) {
            this.defaultLimit = Objects.requireNonNull(defaultLimit, "defaultLimit is required");
            return this;
        }

        public Builder defaultLimit(int maxConcurrent, double requestsPerSecond) {
            return defaultLimit(new TargetLimit(maxConcurrent, requestsPerSecond));
        }

        public Builder override(String targetKey, TargetLimit limit) {
            Objects.requireNonNull(targetKey, "targetKey is required");
            overrides.put(canonical(targetKey), Objects.requireNonNull(limit, "limit is required"));
            return this;
        }

        /**
         * Adds {@link #KNOWN_TARGETS} without replacing overrides already set.
         */
        public Builder withKnownTargets() {
            KNOWN_TARGETS.forEach(overrides::putIfAbsent);
            return this;
        }

        public RateLimitConfig build() {
            return new RateLimitConfig(this);
        }
    }
}
