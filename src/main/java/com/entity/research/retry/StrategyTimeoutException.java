package com.entity.research.retry;

import java.time.Duration;

/**
 * A strategy attempt ran past its time budget. Fails only that attempt.
 */
public class StrategyTimeoutException extends CollectionException {

    public StrategyTimeoutException(String strategyId, Duration timeout) {
        super(FailureKind.PERMANENT, "Strategy " + strategyId + " exceeded timeout of " + timeout.toSeconds() + "s");
    }
}
