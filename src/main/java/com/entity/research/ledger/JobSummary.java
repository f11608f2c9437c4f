package com.entity.research.ledger;

import java.time.Duration;

/**
 * Totals written when a job is finalized.
 */
public record JobSummary(
        int strategiesTried,
        int strategiesSucceeded,
        int entitiesFound,
        int newEntities,
        int updatedEntities,
        int recordsCollected,
        int totalRequests,
        Duration wallTime,
        String stopReason
) {
    public JobSummary {
        wallTime = wallTime != null ? wallTime : Duration.ZERO;
        stopReason = stopReason != null ? stopReason : "";
    }
}
