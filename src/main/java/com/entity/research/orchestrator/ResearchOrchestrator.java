package com.entity.research.orchestrator;

import com.entity.research.cache.ResponseCache;
import com.entity.research.core.TimeSource;
import com.entity.research.core.model.CandidateRecord;
import com.entity.research.core.model.EntityProfile;
import com.entity.research.core.model.MatchResult;
import com.entity.research.core.model.MergedEntity;
import com.entity.research.core.model.SourceType;
import com.entity.research.ledger.DecisionKind;
import com.entity.research.ledger.InvalidTransitionException;
import com.entity.research.ledger.Job;
import com.entity.research.ledger.JobLedger;
import com.entity.research.ledger.JobStatus;
import com.entity.research.ledger.JobSummary;
import com.entity.research.logging.LogContext;
import com.entity.research.matching.EntityMatcher;
import com.entity.research.matching.KnownEntity;
import com.entity.research.merge.SynthesisSession;
import com.entity.research.merge.Synthesizer;
import com.entity.research.metrics.MetricsService;
import com.entity.research.planner.PlannedStrategy;
import com.entity.research.planner.StrategyPlanner;
import com.entity.research.ratelimit.KeyedRateLimiter;
import com.entity.research.retry.RetryExecutor;
import com.entity.research.retry.StrategyTimeoutException;
import com.entity.research.store.MergedEntityStore;
import com.entity.research.store.UpsertResult;
import com.entity.research.strategy.Strategy;
import com.entity.research.strategy.StrategyKind;
import com.entity.research.strategy.StrategyRegistry;
import com.entity.research.strategy.StrategyResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one job through plan, execute, synthesize and the stop/continue decision.
 *
 * <p>Up to {@code maxParallelStrategies} attempts run at once. After every completed
 * attempt the job's records are re-synthesized in plan order and the stop predicates
 * are evaluated; each decision and its triggering condition goes to the reasoning log.
 * Once a stop decision is taken no new attempt is dispatched, and attempts already
 * running are allowed to finish. Cancellation is checked between dispatches.</p>
 *
 * <p>Failures inside a strategy are recorded against its attempt and never abort the job.</p>
 */
public class ResearchOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResearchOrchestrator.class);

    private final StrategyRegistry registry;
    private final StrategyPlanner planner;
    private final JobLedger ledger;
    private final EntityMatcher matcher;
    private final Synthesizer synthesizer;
    private final MergedEntityStore store;
    private final KeyedRateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;
    private final ResponseCache cache;
    private final ResearchOptions options;
    private final TimeSource timeSource;
    private final MetricsService metrics;
    private final ExecutorService strategyExecutor;

    private ResearchOrchestrator(Builder builder) {
        this.registry = builder.registry;
        this.planner = builder.planner;
        this.ledger = builder.ledger;
        this.matcher = builder.matcher;
        this.synthesizer = builder.synthesizer;
        this.store = builder.store;
        this.rateLimiter = builder.rateLimiter;
        this.retryExecutor = builder.retryExecutor;
        this.cache = builder.cache;
        this.options = builder.options;
        this.timeSource = builder.timeSource;
        this.metrics = builder.metrics;
        AtomicInteger counter = new AtomicInteger();
        this.strategyExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "research-strategy-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Runs a pending job to completion and returns its final snapshot.
     *
     * @param override strategies to run instead of the planner's proposal, or null
     * @throws InvalidTransitionException if the ledger rejects an update; the job is then failed if possible
     */
    public Job run(String jobId, List<StrategyKind> override) {
        Job job = ledger.require(jobId);
        EntityProfile profile = job.getProfile();
        long startNanos = timeSource.nanoTime();

        try (LogContext ignored = LogContext.forJob(jobId, profile.targetIdentity())) {
            log.info("job.starting jobId={} target={} override={}", jobId, profile.targetIdentity(), override);
            try {
                return execute(job, override, startNanos);
            } catch (InvalidTransitionException e) {
                log.error("job.integrityViolation jobId={} error={}", jobId, e.getMessage());
                failAfterViolation(jobId, e, startNanos);
                throw e;
            }
        }
    }

    private Job execute(Job job, List<StrategyKind> override, long startNanos) {
        String jobId = job.getId();
        EntityProfile profile = job.getProfile();
        OrchestratorState state = OrchestratorState.PLANNED;

        List<PlannedStrategy> plan;
        try {
            plan = override != null && !override.isEmpty() ? planner.planOverride(override) : planner.plan(profile);
        } catch (IllegalArgumentException e) {
            ledger.recordError(jobId, null, e.getClass().getSimpleName(), e.getMessage());
            ledger.appendReasoning(jobId, DecisionKind.PLAN, Map.of("override", String.valueOf(override)),
                    "Planning failed: " + e.getMessage());
            return finish(jobId, JobStatus.FAILED, StopReason.NO_APPLICABLE_STRATEGIES, null, Map.of(), startNanos);
        }

        ledger.recordPlan(jobId, plan);
        Map<String, Object> planInputs = new LinkedHashMap<>();
        planInputs.put("strategies", plan.stream()
                .map(p -> p.strategyId() + " (priority " + p.priority() + "): " + p.rationale()).toList());
        planInputs.put("override", override != null && !override.isEmpty());
        ledger.appendReasoning(jobId, DecisionKind.PLAN, planInputs,
                (override != null && !override.isEmpty() ? "User specified plan of " : "Planned ")
                        + plan.size() + " strategies");

        if (plan.isEmpty()) {
            return finish(jobId, JobStatus.FAILED, StopReason.NO_APPLICABLE_STRATEGIES, null, Map.of(), startNanos);
        }
        if (ledger.require(jobId).isCancelRequested()) {
            ledger.appendReasoning(jobId, DecisionKind.CANCEL, Map.of(), "Cancelled before execution");
            return finish(jobId, JobStatus.FAILED, StopReason.CANCELLED, null, Map.of(), startNanos);
        }

        ledger.transition(jobId, JobStatus.RUNNING);
        long runStart = timeSource.nanoTime();
        state = transition(jobId, state, OrchestratorState.EXECUTING);

        CompletionService<AttemptOutcome> completions = new ExecutorCompletionService<>(strategyExecutor);
        Deque<PlannedStrategy> pending = new ArrayDeque<>(plan);
        Map<String, AttemptOutcome> completed = new LinkedHashMap<>();
        Set<String> loggedAmbiguities = new HashSet<>();
        SynthesisSession session = null;
        StopDecision stop = null;
        int inFlight = 0;

        while (true) {
            if (stop == null && ledger.require(jobId).isCancelRequested()) {
                stop = StopDecision.stop(StopReason.CANCELLED, "cancellation requested");
                ledger.appendReasoning(jobId, DecisionKind.CANCEL, Map.of("inFlight", inFlight),
                        "Cancelled; no further strategies will be dispatched");
                state = transition(jobId, state, OrchestratorState.STOPPING);
            }
            while (stop == null && inFlight < options.getMaxParallelStrategies() && !pending.isEmpty()
                    && completed.size() + inFlight < options.getMaxStrategiesPerJob()) {
                PlannedStrategy next = pending.poll();
                dispatch(jobId, profile, next, completions);
                inFlight++;
            }
            if (inFlight == 0) {
                break;
            }

            AttemptOutcome outcome;
            try {
                outcome = completions.take().get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("job.interrupted jobId={} inFlight={}", jobId, inFlight);
                if (stop == null) {
                    stop = StopDecision.stop(StopReason.CANCELLED, "orchestrator thread interrupted");
                    ledger.appendReasoning(jobId, DecisionKind.CANCEL, Map.of("inFlight", inFlight),
                            "Interrupted; abandoning remaining work");
                }
                break;
            } catch (ExecutionException e) {
                // runAttempt converts every failure into an outcome
                throw new IllegalStateException("Attempt task failed unexpectedly", e.getCause());
            }
            inFlight--;

            record(jobId, outcome);
            completed.put(outcome.planned().strategyId(), outcome);

            session = synthesize(jobId, plan, completed);
            logAmbiguities(jobId, session, loggedAmbiguities);

            if (stop != null) {
                continue;
            }
            ProgressSnapshot progress = progress(profile, session, completed, runStart);
            Map<String, Object> inputs = inputs(progress);
            StopDecision decision = StopPredicates.evaluate(progress, options);
            if (decision.shouldStop()) {
                stop = decision;
                state = transition(jobId, state, OrchestratorState.STOPPING);
                ledger.appendReasoning(jobId, DecisionKind.STOP, inputs,
                        decision.outcome() + " (" + decision.condition() + ")");
            } else if (pending.isEmpty() && inFlight == 0) {
                stop = StopDecision.stop(StopReason.PLAN_EXHAUSTED, "all planned strategies attempted");
                state = transition(jobId, state, OrchestratorState.STOPPING);
                ledger.appendReasoning(jobId, DecisionKind.STOP, inputs,
                        stop.outcome() + " (" + stop.condition() + ")");
            } else {
                state = transition(jobId, state, OrchestratorState.CONTINUING);
                ledger.appendReasoning(jobId, DecisionKind.CONTINUE, inputs, "Continue (" + decision.condition() + ")");
                state = transition(jobId, state, OrchestratorState.EXECUTING);
            }
        }

        if (stop == null) {
            stop = StopDecision.stop(StopReason.PLAN_EXHAUSTED, "all planned strategies attempted");
        }
        StopReason reason = stop.stopReason().orElse(StopReason.PLAN_EXHAUSTED);
        int totalRecords = session != null ? session.recordCount() : 0;
        boolean anyFailed = completed.values().stream().anyMatch(AttemptOutcome::failed);
        JobStatus status = resolveStatus(reason, totalRecords, anyFailed);
        transition(jobId, state, OrchestratorState.FINALIZED);
        return finish(jobId, status, reason, session, completed, startNanos);
    }

    private void dispatch(String jobId, EntityProfile profile, PlannedStrategy planned,
                          CompletionService<AttemptOutcome> completions) {
        Strategy strategy = registry.require(planned.kind());
        ledger.openAttempt(jobId, planned, strategy.sourceType());
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("strategy", planned.strategyId());
        inputs.put("priority", planned.priority());
        inputs.put("expectedConfidence", planned.expectedConfidence());
        inputs.put("targetKey", strategy.targetKey());
        ledger.appendReasoning(jobId, DecisionKind.DISPATCH, inputs,
                "Dispatching " + planned.strategyId() + ": " + planned.rationale());
        completions.submit(() -> runAttempt(jobId, profile, planned, strategy));
    }

    /**
     * Runs on a strategy thread. Never throws; failures become FAILED results.
     */
    private AttemptOutcome runAttempt(String jobId, EntityProfile profile, PlannedStrategy planned,
                                      Strategy strategy) {
        try (LogContext ignored = LogContext.forAttempt(jobId, planned.strategyId())) {
            long start = timeSource.nanoTime();
            StrategyResult result;
            String errorType = null;
            Future<StrategyResult> future = strategyExecutor.submit(() ->
                    strategy.execute(profile, rateLimiter, retryExecutor, cache));
            try {
                result = awaitResult(future);
            } catch (TimeoutException e) {
                future.cancel(true);
                StrategyTimeoutException timeout =
                        new StrategyTimeoutException(planned.strategyId(), options.getStrategyTimeout());
                errorType = timeout.getClass().getSimpleName();
                result = StrategyResult.failed(0, timeout.getMessage());
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                errorType = e.getClass().getSimpleName();
                result = StrategyResult.failed(0, "Interrupted");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                errorType = cause.getClass().getSimpleName();
                result = StrategyResult.failed(0, cause.getMessage());
                log.warn("attempt.error strategy={} error={}", planned.strategyId(), cause.toString());
            }
            if (result == null) {
                result = StrategyResult.failed(0, "Strategy returned no result");
            } else if (result.isFailed() && errorType == null) {
                errorType = "StrategyFailure";
            }
            Duration duration = Duration.ofNanos(timeSource.nanoTime() - start);
            log.info("attempt.finished strategy={} status={} records={} requests={} durationMs={}",
                    planned.strategyId(), result.status(), result.records().size(), result.requestsMade(),
                    duration.toMillis());
            return new AttemptOutcome(planned, strategy, keyed(result), duration, errorType);
        }
    }

    private StrategyResult awaitResult(Future<StrategyResult> future)
            throws InterruptedException, ExecutionException, TimeoutException {
        Duration timeout = options.getStrategyTimeout();
        if (timeout.isZero()) {
            return future.get();
        }
        return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private StrategyResult keyed(StrategyResult result) {
        if (result.records().stream().allMatch(r -> r.normalizedKey() != null)) {
            return result;
        }
        List<CandidateRecord> records = result.records().stream()
                .map(r -> r.normalizedKey() != null ? r : r.withNormalizedKey(matcher.keyFor(r)))
                .toList();
        return new StrategyResult(result.status(), records, result.requestsMade(), result.error());
    }

    private void record(String jobId, AttemptOutcome outcome) {
        String strategyId = outcome.planned().strategyId();
        StrategyResult result = outcome.result();
        ledger.closeAttempt(jobId, strategyId, result);
        metrics.recordStrategyAttempt(strategyId, result.status().name(), outcome.duration());

        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("strategy", strategyId);
        inputs.put("status", result.status().name());
        inputs.put("records", result.records().size());
        inputs.put("requestsMade", result.requestsMade());
        inputs.put("durationMs", outcome.duration().toMillis());
        if (result.error() != null) {
            inputs.put("error", result.error());
            ledger.recordError(jobId, strategyId,
                    outcome.errorType() != null ? outcome.errorType() : "StrategyFailure", result.error());
        }
        if (outcome.failed()) {
            ledger.appendReasoning(jobId, DecisionKind.ATTEMPT_FAILED, inputs,
                    strategyId + " failed: " + result.error());
        } else {
            ledger.appendReasoning(jobId, DecisionKind.ATTEMPT_COMPLETED, inputs,
                    strategyId + " returned " + result.records().size() + " records");
        }
    }

    /**
     * Rebuilds the job's entities from every completed attempt, in plan order, so that the
     * result does not depend on which attempt finished first.
     */
    private SynthesisSession synthesize(String jobId, List<PlannedStrategy> plan,
                                        Map<String, AttemptOutcome> completed) {
        SynthesisSession session = new SynthesisSession(matcher, synthesizer);
        for (PlannedStrategy planned : plan) {
            if (completed.containsKey(planned.strategyId())) {
                session.addAll(ledger.candidates(jobId, planned.strategyId()));
            }
        }
        ledger.appendReasoning(jobId, DecisionKind.SYNTHESIZE,
                Map.of("records", session.recordCount(), "entities", session.entities().size()),
                "Merged " + session.recordCount() + " records into " + session.entities().size() + " entities");
        return session;
    }

    private void logAmbiguities(String jobId, SynthesisSession session, Set<String> alreadyLogged) {
        for (Map.Entry<String, MatchResult> entry : session.ambiguousMatches().entrySet()) {
            if (alreadyLogged.add(entry.getKey())) {
                MatchResult match = entry.getValue();
                metrics.incrementAmbiguousMatch();
                ledger.appendReasoning(jobId, DecisionKind.MATCH_AMBIGUOUS,
                        Map.of("recordId", entry.getKey(), "candidates", match.consideredKeys(),
                                "chosen", match.normalizedKey()),
                        match.reasoning());
            }
        }
    }

    private ProgressSnapshot progress(EntityProfile profile, SynthesisSession session,
                                      Map<String, AttemptOutcome> completed, long runStart) {
        Set<SourceType> sourceTypes = EnumSet.noneOf(SourceType.class);
        completed.values().stream()
                .filter(o -> !o.failed())
                .forEach(o -> sourceTypes.add(o.strategy().sourceType()));
        int coverage = session.findTarget(profile.targetIdentity())
                .map(MergedEntity::completenessScore)
                .orElseGet(() -> session.entities().stream()
                        .mapToInt(MergedEntity::completenessScore).max().orElse(0));
        return new ProgressSnapshot(completed.size(), sourceTypes.size(), coverage, session.recordCount(),
                Duration.ofNanos(timeSource.nanoTime() - runStart));
    }

    private static Map<String, Object> inputs(ProgressSnapshot progress) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("strategiesTried", progress.strategiesTried());
        inputs.put("distinctSourceTypes", progress.distinctSourceTypes());
        inputs.put("coverage", progress.coverage());
        inputs.put("totalRecords", progress.totalRecords());
        inputs.put("elapsedSeconds", progress.elapsed().toSeconds());
        return inputs;
    }

    /**
     * Final status for a stop reason.
     */
    static JobStatus resolveStatus(StopReason reason, int totalRecords, boolean anyAttemptFailed) {
        return switch (reason) {
            case SUFFICIENT_COVERAGE -> JobStatus.SUCCESS;
            case BUDGET_EXHAUSTED, TIME_EXCEEDED -> totalRecords > 0 ? JobStatus.PARTIAL_SUCCESS : JobStatus.FAILED;
            case PLAN_EXHAUSTED -> totalRecords == 0 ? JobStatus.FAILED
                    : anyAttemptFailed ? JobStatus.PARTIAL_SUCCESS : JobStatus.SUCCESS;
            case NO_DATA_FOUND, CANCELLED, NO_APPLICABLE_STRATEGIES -> JobStatus.FAILED;
        };
    }

    private Job finish(String jobId, JobStatus status, StopReason reason, SynthesisSession session,
                       Map<String, AttemptOutcome> completed, long startNanos) {
        int created = 0;
        int updated = 0;
        int entities = 0;
        int records = 0;
        if (session != null) {
            for (MergedEntity entity : session.entities()) {
                UpsertResult result = persist(entity);
                if (result.created()) {
                    created++;
                } else {
                    updated++;
                }
            }
            entities = session.entities().size();
            records = session.recordCount();
        }
        int succeeded = (int) completed.values().stream().filter(o -> !o.failed()).count();
        int requests = completed.values().stream().mapToInt(o -> o.result().requestsMade()).sum();
        Duration wallTime = Duration.ofNanos(timeSource.nanoTime() - startNanos);
        String stopReason = reason == StopReason.CANCELLED ? "cancelled" : reason.name().toLowerCase(Locale.ROOT);

        JobSummary summary = new JobSummary(completed.size(), succeeded, entities, created, updated, records,
                requests, wallTime, stopReason);
        Job finalized = ledger.finalizeJob(jobId, status, summary);
        metrics.recordJobFinalized(status.getCode(), wallTime);
        return finalized;
    }

    /**
     * Stores a job's entity, folding it into a previously stored entity it matches.
     */
    private UpsertResult persist(MergedEntity entity) {
        List<KnownEntity> known = store.findAll().stream().map(KnownEntity::of).toList();
        MatchResult match = matcher.matchEntity(entity, known);
        return store.upsert(match.normalizedKey(), entity, synthesizer::combine);
    }

    private OrchestratorState transition(String jobId, OrchestratorState from, OrchestratorState to) {
        if (from != to) {
            log.debug("orchestrator.state jobId={} from={} to={}", jobId, from, to);
        }
        return to;
    }

    private void failAfterViolation(String jobId, InvalidTransitionException cause, long startNanos) {
        Job current = ledger.get(jobId).orElse(null);
        if (current == null || current.isTerminal()) {
            return;
        }
        try {
            ledger.recordError(jobId, null, cause.getClass().getSimpleName(), cause.getMessage());
            JobSummary summary = new JobSummary(current.getCompletedStrategies().size(), 0, 0, 0, 0, 0, 0,
                    Duration.ofNanos(timeSource.nanoTime() - startNanos), "integrity_violation");
            ledger.finalizeJob(jobId, JobStatus.FAILED, summary);
        } catch (InvalidTransitionException e) {
            cause.addSuppressed(e);
        }
    }

    @Override
    public void close() {
        strategyExecutor.shutdownNow();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private StrategyRegistry registry;
        private StrategyPlanner planner;
        private JobLedger ledger;
        private EntityMatcher matcher;
        private Synthesizer synthesizer;
        private MergedEntityStore store;
        private KeyedRateLimiter rateLimiter;
        private RetryExecutor retryExecutor;
        private ResponseCache cache;
        private ResearchOptions options = ResearchOptions.defaults();
        private TimeSource timeSource = TimeSource.system();
        private MetricsService metrics;

        public Builder registry(StrategyRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder planner(StrategyPlanner planner) {
            this.planner = planner;
            return this;
        }

        public Builder ledger(JobLedger ledger) {
            this.ledger = ledger;
            return this;
        }

        public Builder matcher(EntityMatcher matcher) {
            this.matcher = matcher;
            return this;
        }

        public Builder synthesizer(Synthesizer synthesizer) {
            this.synthesizer = synthesizer;
            return this;
        }

        public Builder store(MergedEntityStore store) {
            this.store = store;
            return this;
        }

        public Builder rateLimiter(KeyedRateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder retryExecutor(RetryExecutor retryExecutor) {
            this.retryExecutor = retryExecutor;
            return this;
        }

        public Builder cache(ResponseCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder options(ResearchOptions options) {
            this.options = options;
            return this;
        }

        public Builder timeSource(TimeSource timeSource) {
            this.timeSource = timeSource;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public ResearchOrchestrator build() {
            if (registry == null || planner == null || ledger == null || matcher == null
                    || synthesizer == null || store == null || rateLimiter == null
                    || retryExecutor == null || cache == null || metrics == null) {
                throw new IllegalStateException("All collaborators must be set before building the orchestrator");
            }
            return new ResearchOrchestrator(this);
        }
    }
}
