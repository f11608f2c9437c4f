package com.entity.research.ledger;

import java.time.Instant;
import java.util.Objects;

/**
 * An error recorded against a job.
 *
 * @param strategyId failing strategy, or null for job-level errors
 */
public record JobError(Instant timestamp, String strategyId, String errorType, String message) {

    public JobError {
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(errorType, "errorType is required");
        message = message != null ? message : "";
    }
}
