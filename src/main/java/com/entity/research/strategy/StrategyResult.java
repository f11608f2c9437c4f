package com.entity.research.strategy;

import com.entity.research.core.model.CandidateRecord;

import java.util.List;
import java.util.Objects;

/**
 * What a strategy hands back to the orchestrator.
 *
 * @param status       overall outcome
 * @param records      candidate records in the strategy's own output order
 * @param requestsMade network requests issued, retries included, cache hits excluded
 * @param error        failure description for PARTIAL and FAILED outcomes
 */
public record StrategyResult(StrategyStatus status, List<CandidateRecord> records, int requestsMade, String error) {

    public StrategyResult {
        Objects.requireNonNull(status, "status is required");
        records = records != null ? List.copyOf(records) : List.of();
        if (requestsMade < 0) {
            throw new IllegalArgumentException("requestsMade must not be negative");
        }
    }

    public static StrategyResult success(List<CandidateRecord> records, int requestsMade) {
        return new StrategyResult(StrategyStatus.SUCCESS, records, requestsMade, null);
    }

    public static StrategyResult partial(List<CandidateRecord> records, int requestsMade, String error) {
        return new StrategyResult(StrategyStatus.PARTIAL, records, requestsMade, error);
    }

    public static StrategyResult failed(int requestsMade, String error) {
        return new StrategyResult(StrategyStatus.FAILED, List.of(), requestsMade, error);
    }

    public boolean isFailed() {
        return status == StrategyStatus.FAILED;
    }
}
