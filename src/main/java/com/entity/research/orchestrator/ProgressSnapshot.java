package com.entity.research.orchestrator;

import java.time.Duration;

/**
 * What the stop predicates look at after an attempt completes.
 *
 * @param strategiesTried      attempts completed so far, failed ones included
 * @param distinctSourceTypes  source types of completed, non-failed attempts
 * @param coverage             completeness of the target's merged entity, 0 to 100
 * @param totalRecords         candidate records collected so far
 * @param elapsed              time since the job started running
 */
public record ProgressSnapshot(
        int strategiesTried,
        int distinctSourceTypes,
        int coverage,
        int totalRecords,
        Duration elapsed
) {
    public ProgressSnapshot {
        if (strategiesTried < 0 || distinctSourceTypes < 0 || totalRecords < 0) {
            throw new IllegalArgumentException("Counts must not be negative");
        }
        if (coverage < 0 || coverage > 100) {
            throw new IllegalArgumentException("coverage must be between 0 and 100");
        }
        elapsed = elapsed != null ? elapsed : Duration.ZERO;
    }
}
