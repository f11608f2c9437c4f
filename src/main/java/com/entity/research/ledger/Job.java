package com.entity.research.ledger;

import com.entity.research.core.model.EntityProfile;
import com.entity.research.planner.PlannedStrategy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a research job. The {@link JobLedger} produces a new snapshot
 * for every change.
 */
public final class Job {
    private final String id;
    private final EntityProfile profile;
    private final JobStatus status;
    private final boolean strategyOverride;
    private final List<PlannedStrategy> plannedStrategies;
    private final List<String> completedStrategies;
    private final List<StrategyAttempt> attempts;
    private final List<ReasoningEntry> reasoningLog;
    private final List<JobError> errors;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final JobSummary summary;
    private final boolean cancelRequested;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.profile = Objects.requireNonNull(builder.profile, "profile is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.strategyOverride = builder.strategyOverride;
        this.plannedStrategies = List.copyOf(builder.plannedStrategies);
        this.completedStrategies = List.copyOf(builder.completedStrategies);
        this.attempts = List.copyOf(builder.attempts);
        this.reasoningLog = List.copyOf(builder.reasoningLog);
        this.errors = List.copyOf(builder.errors);
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt is required");
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
        this.summary = builder.summary;
        this.cancelRequested = builder.cancelRequested;
    }

    public String getId() {
        return id;
    }

    public EntityProfile getProfile() {
        return profile;
    }

    public String getTargetIdentity() {
        return profile.targetIdentity();
    }

    public JobStatus getStatus() {
        return status;
    }

    public boolean isStrategyOverride() {
        return strategyOverride;
    }

    public List<PlannedStrategy> getPlannedStrategies() {
        return plannedStrategies;
    }

    public List<String> getCompletedStrategies() {
        return completedStrategies;
    }

    public List<StrategyAttempt> getAttempts() {
        return attempts;
    }

    public List<ReasoningEntry> getReasoningLog() {
        return reasoningLog;
    }

    public List<JobError> getErrors() {
        return errors;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> getFinishedAt() {
        return Optional.ofNullable(finishedAt);
    }

    public Optional<JobSummary> getSummary() {
        return Optional.ofNullable(summary);
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isPlanned(String strategyId) {
        return plannedStrategies.stream().anyMatch(p -> p.strategyId().equals(strategyId));
    }

    public Optional<StrategyAttempt> findAttempt(String strategyId) {
        return attempts.stream().filter(a -> a.strategyId().equals(strategyId)).findFirst();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.id = id;
        b.profile = profile;
        b.status = status;
        b.strategyOverride = strategyOverride;
        b.plannedStrategies = new ArrayList<>(plannedStrategies);
        b.completedStrategies = new ArrayList<>(completedStrategies);
        b.attempts = new ArrayList<>(attempts);
        b.reasoningLog = new ArrayList<>(reasoningLog);
        b.errors = new ArrayList<>(errors);
        b.createdAt = createdAt;
        b.startedAt = startedAt;
        b.finishedAt = finishedAt;
        b.summary = summary;
        b.cancelRequested = cancelRequested;
        return b;
    }

    @Override
    public String toString() {
        return "Job{" +
                "id='" + id + '\'' +
                ", target='" + profile.targetIdentity() + '\'' +
                ", status=" + status +
                ", planned=" + plannedStrategies.size() +
                ", completed=" + completedStrategies.size() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private EntityProfile profile;
        private JobStatus status = JobStatus.PENDING;
        private boolean strategyOverride;
        private List<PlannedStrategy> plannedStrategies = new ArrayList<>();
        private List<String> completedStrategies = new ArrayList<>();
        private List<StrategyAttempt> attempts = new ArrayList<>();
        private List<ReasoningEntry> reasoningLog = new ArrayList<>();
        private List<JobError> errors = new ArrayList<>();
        private Instant createdAt;
        private Instant startedAt;
        private Instant finishedAt;
        private JobSummary summary;
        private boolean cancelRequested;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder profile(EntityProfile profile) {
            this.profile = profile;
            return this;
        }

        Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder strategyOverride(boolean strategyOverride) {
            this.strategyOverride = strategyOverride;
            return this;
        }

        Builder plannedStrategies(List<PlannedStrategy> plannedStrategies) {
            this.plannedStrategies = new ArrayList<>(plannedStrategies);
            return this;
        }

        Builder addCompleted(String strategyId) {
            this.completedStrategies.add(strategyId);
            return this;
        }

        Builder putAttempt(StrategyAttempt attempt) {
            // Attempts stay in dispatch order when closed
            for (int i = 0; i < attempts.size(); i++) {
                if (attempts.get(i).strategyId().equals(attempt.strategyId())) {
                    attempts.set(i, attempt);
                    return this;
                }
            }
            this.attempts.add(attempt);
            return this;
        }

        Builder addReasoning(ReasoningEntry entry) {
            this.reasoningLog.add(entry);
            return this;
        }

        Builder addError(JobError error) {
            this.errors.add(error);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        Builder summary(JobSummary summary) {
            this.summary = summary;
            return this;
        }

        Builder cancelRequested(boolean cancelRequested) {
            this.cancelRequested = cancelRequested;
            return this;
        }

        int nextSequence() {
            return reasoningLog.size() + 1;
        }

        public Job build() {
            return new Job(this);
        }
    }
}
