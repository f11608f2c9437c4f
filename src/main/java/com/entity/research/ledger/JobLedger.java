package com.entity.research.ledger;

import com.entity.research.core.TimeSource;
import com.entity.research.core.model.CandidateRecord;
import com.entity.research.core.model.EntityProfile;
import com.entity.research.core.model.SourceType;
import com.entity.research.planner.PlannedStrategy;
import com.entity.research.strategy.StrategyResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Owns job lifecycle, attempt history and the reasoning log.
 *
 * <p>All updates to one active job are serialized through a per-job lock, so concurrent
 * transition attempts see each other's effects. The lock is dropped once the job is
 * terminal. Terminal jobs accept no further
 * updates; trying raises {@link InvalidTransitionException}.</p>
 */
public class JobLedger {
    private static final Logger log = LoggerFactory.getLogger(JobLedger.class);

    private final JobRepository repository;
    private final TimeSource timeSource;
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public JobLedger(JobRepository repository, TimeSource timeSource) {
        this.repository = repository;
        this.timeSource = timeSource;
    }

    public Job create(EntityProfile profile, boolean strategyOverride) {
        Job job = Job.builder()
                .id(UUID.randomUUID().toString())
                .profile(profile)
                .strategyOverride(strategyOverride)
                .createdAt(timeSource.now())
                .build();
        repository.save(job);
        log.info("job.created jobId={} target={} type={}", job.getId(), profile.targetIdentity(),
                profile.entityType());
        return job;
    }

    public Optional<Job> get(String jobId) {
        return repository.findById(jobId);
    }

    public Job require(String jobId) {
        return get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * Moves a job to a non-terminal or terminal status. Use {@link #finalizeJob} to attach a summary.
     */
    public Job transition(String jobId, JobStatus next) {
        return update(jobId, job -> {
            if (!job.getStatus().canTransitionTo(next)) {
                throw new InvalidTransitionException(jobId,
                        "cannot transition from " + job.getStatus().getCode() + " to " + next.getCode());
            }
            Job.Builder b = job.toBuilder().status(next);
            if (next == JobStatus.RUNNING) {
                b.startedAt(timeSource.now());
            }
            if (next.isTerminal()) {
                b.finishedAt(timeSource.now());
            }
            log.info("job.transition jobId={} from={} to={}", jobId, job.getStatus(), next);
            return b.build();
        });
    }

    public Job recordPlan(String jobId, List<PlannedStrategy> plan) {
        return update(jobId, job -> {
            requireActive(job);
            return job.toBuilder().plannedStrategies(plan).build();
        });
    }

    public StrategyAttempt openAttempt(String jobId, PlannedStrategy planned, SourceType sourceType) {
        StrategyAttempt[] opened = new StrategyAttempt[1];
        update(jobId, job -> {
            requireActive(job);
            if (!job.isPlanned(planned.strategyId())) {
                throw new InvalidTransitionException(jobId, "strategy " + planned.strategyId() + " was not planned");
            }
            if (job.findAttempt(planned.strategyId()).isPresent()) {
                throw new InvalidTransitionException(jobId, "strategy " + planned.strategyId() + " already dispatched");
            }
            opened[0] = StrategyAttempt.open(jobId, planned.strategyId(), planned.priority(), sourceType,
                    timeSource.now());
            return job.toBuilder().putAttempt(opened[0]).build();
        });
        return opened[0];
    }

    /**
     * Closes an open attempt with the strategy's result and appends its records.
     * The strategy becomes completed.
     */
    public StrategyAttempt closeAttempt(String jobId, String strategyId, StrategyResult result) {
        StrategyAttempt[] closed = new StrategyAttempt[1];
        update(jobId, job -> {
            requireActive(job);
            StrategyAttempt attempt = job.findAttempt(strategyId)
                    .orElseThrow(() -> new InvalidTransitionException(jobId,
                            "strategy " + strategyId + " has no open attempt"));
            if (!attempt.isOpen()) {
                throw new InvalidTransitionException(jobId, "attempt for " + strategyId + " is already closed");
            }
            List<CandidateRecord> records = result.records();
            repository.appendCandidates(jobId, strategyId, records);
            closed[0] = attempt.close(result.status(), result.requestsMade(),
                    records.stream().map(CandidateRecord::id).toList(), result.error(), timeSource.now());
            return job.toBuilder().putAttempt(closed[0]).addCompleted(strategyId).build();
        });
        return closed[0];
    }

    public ReasoningEntry appendReasoning(String jobId, DecisionKind kind, Map<String, Object> inputs,
                                          String outcome) {
        ReasoningEntry[] appended = new ReasoningEntry[1];
        update(jobId, job -> {
            requireActive(job);
            Job.Builder b = job.toBuilder();
            appended[0] = new ReasoningEntry(b.nextSequence(), timeSource.now(), kind, inputs, outcome);
            return b.addReasoning(appended[0]).build();
        });
        log.debug("job.reasoning jobId={} kind={} outcome={}", jobId, kind, outcome);
        return appended[0];
    }

    public Job recordError(String jobId, String strategyId, String errorType, String message) {
        return update(jobId, job -> {
            requireActive(job);
            return job.toBuilder().addError(new JobError(timeSource.now(), strategyId, errorType, message)).build();
        });
    }

    /**
     * Moves the job to a terminal status, attaching the summary and a final reasoning entry.
     */
    public Job finalizeJob(String jobId, JobStatus terminal, JobSummary summary) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Finalize requires a terminal status, got " + terminal);
        }
        return update(jobId, job -> {
            if (!job.getStatus().canTransitionTo(terminal)) {
                throw new InvalidTransitionException(jobId,
                        "cannot finalize from " + job.getStatus().getCode() + " to " + terminal.getCode());
            }
            Job.Builder b = job.toBuilder();
            b.addReasoning(new ReasoningEntry(b.nextSequence(), timeSource.now(), DecisionKind.FINALIZE,
                    Map.of("stopReason", summary.stopReason(),
                            "strategiesTried", summary.strategiesTried(),
                            "entitiesFound", summary.entitiesFound()),
                    "Job finalized as " + terminal.getCode()));
            log.info("job.finalized jobId={} status={} tried={} entities={} requests={}", jobId,
                    terminal.getCode(), summary.strategiesTried(), summary.entitiesFound(), summary.totalRequests());
            return b.status(terminal).summary(summary).finishedAt(timeSource.now()).build();
        });
    }

    /**
     * Flags the job for cancellation. Honored by the orchestrator between dispatches.
     *
     * @return false if the job already finished
     */
    public boolean requestCancel(String jobId) {
        boolean[] accepted = new boolean[1];
        update(jobId, job -> {
            if (job.isTerminal()) {
                return job;
            }
            accepted[0] = true;
            return job.toBuilder().cancelRequested(true).build();
        });
        if (accepted[0]) {
            log.info("job.cancelRequested jobId={}", jobId);
        }
        return accepted[0];
    }

    public List<CandidateRecord> candidates(String jobId) {
        return repository.findCandidates(jobId);
    }

    public List<CandidateRecord> candidates(String jobId, String strategyId) {
        return repository.findCandidates(jobId, strategyId);
    }

    private Job update(String jobId, UnaryOperator<Job> change) {
        ReentrantLock lock = locks.computeIfAbsent(jobId, k -> new ReentrantLock());
        lock.lock();
        boolean release = true;
        try {
            Job current = require(jobId);
            release = current.isTerminal();
            Job updated = change.apply(current);
            if (updated != current) {
                repository.save(updated);
            }
            release = updated.isTerminal();
            return updated;
        } finally {
            // Unknown and terminal jobs accept no updates, so they keep no lock
            if (release) {
                locks.remove(jobId, lock);
            }
            lock.unlock();
        }
    }

    int lockCount() {
        return locks.size();
    }

    private static void requireActive(Job job) {
        if (job.isTerminal()) {
            throw new InvalidTransitionException(job.getId(),
                    "job is " + job.getStatus().getCode() + " and accepts no further updates");
        }
    }
}
