package com.entity.research.ledger;

import java.util.EnumSet;
import java.util.Set;

/**
 * Job lifecycle. Transitions only move forward:
 * PENDING to RUNNING or FAILED, RUNNING to any terminal status.
 */
public enum JobStatus {
    PENDING("pending"),
    RUNNING("running"),
    SUCCESS("success"),
    PARTIAL_SUCCESS("partial_success"),
    FAILED("failed");

    private final String code;

    JobStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == PARTIAL_SUCCESS || this == FAILED;
    }

    public boolean canTransitionTo(JobStatus next) {
        return allowedNext().contains(next);
    }

    private Set<JobStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING, FAILED);
            case RUNNING -> EnumSet.of(SUCCESS, PARTIAL_SUCCESS, FAILED);
            default -> EnumSet.noneOf(JobStatus.class);
        };
    }
}
