package com.entity.research.orchestrator;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of evaluating the stop predicates: either continue, or stop for a reason.
 *
 * @param condition the triggering condition in words, written to the reasoning log
 */
public record StopDecision(StopReason reason, String condition) {

    public StopDecision {
        Objects.requireNonNull(condition, "condition is required");
    }

    public static StopDecision proceed(String condition) {
        return new StopDecision(null, condition);
    }

    public static StopDecision stop(StopReason reason, String condition) {
        return new StopDecision(Objects.requireNonNull(reason, "reason is required"), condition);
    }

    public boolean shouldStop() {
        return reason != null;
    }

    public Optional<StopReason> stopReason() {
        return Optional.ofNullable(reason);
    }

    public String outcome() {
        return shouldStop() ? reason.getLabel() : "Continue";
    }
}
