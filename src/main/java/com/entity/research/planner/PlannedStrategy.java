package com.entity.research.planner;

import com.entity.research.strategy.StrategyKind;

import java.util.Objects;

/**
 * One entry of a research plan.
 *
 * @param kind               strategy to run
 * @param priority           0 (lowest) to 10 (highest)
 * @param expectedConfidence how much the planner expects from it, 0.0 to 1.0
 * @param rationale          why it was proposed
 */
public record PlannedStrategy(StrategyKind kind, int priority, double expectedConfidence, String rationale) {

    public PlannedStrategy {
        Objects.requireNonNull(kind, "kind is required");
        if (priority < 0 || priority > 10) {
            throw new IllegalArgumentException("priority must be between 0 and 10");
        }
        if (expectedConfidence < 0.0 || expectedConfidence > 1.0) {
            throw new IllegalArgumentException("expectedConfidence must be between 0.0 and 1.0");
        }
        rationale = rationale != null ? rationale : "";
    }

    public String strategyId() {
        return kind.getId();
    }
}
