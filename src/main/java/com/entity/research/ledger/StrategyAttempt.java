package com.entity.research.ledger;

import com.entity.research.core.model.SourceType;
import com.entity.research.strategy.StrategyStatus;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One dispatch of a strategy within a job. Open while {@code status} is null.
 *
 * @param recordIds ids of the candidate records the attempt produced, in output order
 */
public record StrategyAttempt(
        String jobId,
        String strategyId,
        int priority,
        SourceType sourceType,
        StrategyStatus status,
        int requestsMade,
        List<String> recordIds,
        String error,
        Instant startedAt,
        Instant finishedAt
) {
    public StrategyAttempt {
        Objects.requireNonNull(jobId, "jobId is required");
        Objects.requireNonNull(strategyId, "strategyId is required");
        Objects.requireNonNull(startedAt, "startedAt is required");
        recordIds = recordIds != null ? List.copyOf(recordIds) : List.of();
    }

    static StrategyAttempt open(String jobId, String strategyId, int priority, SourceType sourceType,
                                Instant startedAt) {
        return new StrategyAttempt(jobId, strategyId, priority, sourceType, null, 0, List.of(), null,
                startedAt, null);
    }

    StrategyAttempt close(StrategyStatus outcome, int requests, List<String> ids, String errorMessage,
                          Instant finished) {
        return new StrategyAttempt(jobId, strategyId, priority, sourceType, outcome, requests, ids,
                errorMessage, startedAt, finished);
    }

    public boolean isOpen() {
        return status == null;
    }

    public boolean isSucceeded() {
        return status != null && status != StrategyStatus.FAILED;
    }

    public int recordCount() {
        return recordIds.size();
    }
}
