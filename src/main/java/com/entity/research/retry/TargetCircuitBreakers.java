package com.entity.research.retry;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * One Resilience4j circuit breaker per target key.
 *
 * <p>The count-based window is as long as the failure threshold and trips at a 100%
 * failure rate, so the circuit opens after {@code failureThreshold} consecutive failed
 * operations. It stays open for {@code resetTimeout}, then lets a single trial
 * operation through: success closes it, failure opens it again.</p>
 */
public class TargetCircuitBreakers {
    private static final Logger log = LoggerFactory.getLogger(TargetCircuitBreakers.class);

    private final CircuitBreakerRegistry registry;

    public TargetCircuitBreakers(int failureThreshold, Duration resetTimeout) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(resetTimeout)
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();
        this.registry = CircuitBreakerRegistry.of(config);
        registry.getEventPublisher().onEntryAdded(added -> added.getAddedEntry().getEventPublisher()
                .onStateTransition(event -> log.info("circuit.transition target={} transition={}",
                        event.getCircuitBreakerName(), event.getStateTransition())));
    }

    public CircuitBreaker forTarget(String targetKey) {
        return registry.circuitBreaker(targetKey);
    }

    public CircuitBreaker.State getState(String targetKey) {
        return forTarget(targetKey).getState();
    }
}
