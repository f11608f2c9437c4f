package com.entity.research.export;

import com.entity.research.core.model.MergedEntity;
import com.entity.research.ledger.Job;
import com.entity.research.ledger.JobError;
import com.entity.research.ledger.JobSummary;
import com.entity.research.ledger.ReasoningEntry;
import com.entity.research.ledger.StrategyAttempt;
import com.entity.research.planner.PlannedStrategy;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Flat, serializable view of a finished (or running) job and the merged entities it touched.
 *
 * @param entities stored entities containing at least one record collected by the job
 */
public record JobReport(
        String jobId,
        String targetIdentity,
        String entityType,
        String status,
        boolean strategyOverride,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        List<PlannedStrategy> plan,
        List<StrategyAttempt> attempts,
        List<ReasoningEntry> reasoning,
        List<JobError> errors,
        JobSummary summary,
        List<MergedEntity> entities
) {
    public JobReport {
        Objects.requireNonNull(jobId, "jobId is required");
        plan = plan != null ? List.copyOf(plan) : List.of();
        attempts = attempts != null ? List.copyOf(attempts) : List.of();
        reasoning = reasoning != null ? List.copyOf(reasoning) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
        entities = entities != null ? List.copyOf(entities) : List.of();
    }

    public static JobReport of(Job job, Collection<MergedEntity> storedEntities) {
        List<String> recordIds = job.getAttempts().stream()
                .flatMap(a -> a.recordIds().stream())
                .toList();
        List<MergedEntity> touched = storedEntities.stream()
                .filter(e -> recordIds.stream().anyMatch(e::hasRecord))
                .sorted(Comparator.comparing(MergedEntity::normalizedKey))
                .toList();
        return new JobReport(
                job.getId(),
                job.getTargetIdentity(),
                job.getProfile().entityType().name(),
                job.getStatus().getCode(),
                job.isStrategyOverride(),
                job.getCreatedAt(),
                job.getStartedAt().orElse(null),
                job.getFinishedAt().orElse(null),
                job.getPlannedStrategies(),
                job.getAttempts(),
                job.getReasoningLog(),
                job.getErrors(),
                job.getSummary().orElse(null),
                touched);
    }
}
