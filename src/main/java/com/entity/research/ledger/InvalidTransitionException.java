package com.entity.research.ledger;

/**
 * A ledger update that would break job integrity, such as leaving a terminal status
 * or closing a strategy that was never planned. Fatal to the calling operation only.
 */
public class InvalidTransitionException extends RuntimeException {

    private final String jobId;

    public InvalidTransitionException(String jobId, String message) {
        super("Job " + jobId + ": " + message);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
