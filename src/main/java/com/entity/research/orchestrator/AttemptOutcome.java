package com.entity.research.orchestrator;

import com.entity.research.planner.PlannedStrategy;
import com.entity.research.strategy.Strategy;
import com.entity.research.strategy.StrategyResult;

import java.time.Duration;

/**
 * A finished attempt as seen by the orchestrator thread.
 *
 * @param errorType simple class name of the exception that failed the attempt, or null
 */
record AttemptOutcome(PlannedStrategy planned, Strategy strategy, StrategyResult result, Duration duration,
                      String errorType) {

    boolean failed() {
        return result.isFailed();
    }
}
