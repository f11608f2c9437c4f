package com.entity.research.api;

import com.entity.research.cache.CacheStats;
import com.entity.research.cache.CaffeineResponseCache;
import com.entity.research.cache.NoOpResponseCache;
import com.entity.research.cache.ResponseCache;
import com.entity.research.core.TimeSource;
import com.entity.research.core.model.EntityProfile;
import com.entity.research.core.model.EntityType;
import com.entity.research.core.model.MatchResult;
import com.entity.research.core.model.MergedEntity;
import com.entity.research.export.JobReport;
import com.entity.research.ledger.InMemoryJobRepository;
import com.entity.research.ledger.InvalidTransitionException;
import com.entity.research.ledger.Job;
import com.entity.research.ledger.JobLedger;
import com.entity.research.ledger.JobRepository;
import com.entity.research.matching.EntityMatcher;
import com.entity.research.matching.KnownEntity;
import com.entity.research.merge.ScoringPolicy;
import com.entity.research.merge.Synthesizer;
import com.entity.research.metrics.MetricsService;
import com.entity.research.metrics.MicrometerMetricsService;
import com.entity.research.metrics.NoOpMetricsService;
import com.entity.research.orchestrator.ResearchOptions;
import com.entity.research.orchestrator.ResearchOrchestrator;
import com.entity.research.planner.StrategyPlanner;
import com.entity.research.ratelimit.KeyedRateLimiter;
import com.entity.research.retry.RetryExecutor;
import com.entity.research.retry.TargetCircuitBreakers;
import com.entity.research.rules.DefaultNormalizationRules;
import com.entity.research.rules.NormalizationEngine;
import com.entity.research.similarity.NameSimilarityScorer;
import com.entity.research.similarity.SimilarityAlgorithm;
import com.entity.research.store.InMemoryMergedEntityStore;
import com.entity.research.store.MergedEntityStore;
import com.entity.research.strategy.Strategy;
import com.entity.research.strategy.StrategyKind;
import com.entity.research.strategy.StrategyRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point for entity research.
 * Starts research jobs, exposes their ledger records and looks up the merged entities
 * accumulated across jobs.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * ResearchService service = ResearchService.builder()
 *     .strategy(new Sec13fStrategy(edgarClient))
 *     .strategy(new WebsiteStrategy(httpClient))
 *     .options(ResearchOptions.builder().maxStrategiesPerJob(4).build())
 *     .build();
 *
 * String jobId = service.startJob("Acme Capital LLC", EntityType.INVESTOR);
 * ...
 * Job job = service.getJob(jobId).orElseThrow();
 * service.getMergedEntity("Acme Capital").ifPresent(entity -&gt; ...);
 * </pre>
 *
 * <p>The rate limiter, retry executor and response cache built here are shared by every
 * job this service runs, so concurrent jobs hitting the same target are throttled together.</p>
 */
public class ResearchService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResearchService.class);

    private final JobLedger ledger;
    private final ResearchOrchestrator orchestrator;
    private final EntityMatcher matcher;
    private final MergedEntityStore store;
    private final ResponseCache cache;
    private final RetryExecutor retryExecutor;
    private final StrategyRegistry registry;
    private final ResearchOptions options;
    private final ExecutorService jobExecutor;

    private ResearchService(Builder builder) {
        this.options = builder.options;
        this.registry = builder.registry;
        TimeSource timeSource = builder.timeSource;

        MetricsService metrics;
        if (builder.metricsService != null) {
            metrics = builder.metricsService;
        } else if (builder.meterRegistry != null) {
            metrics = new MicrometerMetricsService(builder.meterRegistry);
        } else {
            metrics = NoOpMetricsService.INSTANCE;
        }

        NormalizationEngine normalizationEngine = builder.normalizationEngine != null
                ? builder.normalizationEngine : DefaultNormalizationRules.createDefaultEngine();
        SimilarityAlgorithm similarity = builder.similarity != null
                ? builder.similarity : new NameSimilarityScorer();
        this.matcher = new EntityMatcher(normalizationEngine, similarity, options.getFuzzyMatchThreshold());

        ScoringPolicy scoring = builder.scoringPolicy != null ? builder.scoringPolicy : ScoringPolicy.defaults();
        Synthesizer synthesizer = new Synthesizer(options.sourcePriority(), scoring);

        JobRepository jobRepository = builder.jobRepository != null
                ? builder.jobRepository : new InMemoryJobRepository();
        this.ledger = new JobLedger(jobRepository, timeSource);
        this.store = builder.entityStore != null ? builder.entityStore : new InMemoryMergedEntityStore();

        // Shared, process-wide collaborators
        KeyedRateLimiter rateLimiter = new KeyedRateLimiter(options.rateLimitConfig(), timeSource, metrics);
        TargetCircuitBreakers circuitBreakers = new TargetCircuitBreakers(
                options.getCircuitFailureThreshold(), options.getCircuitResetTimeout());
        this.retryExecutor = RetryExecutor.builder(rateLimiter)
                .policy(options.retryPolicy())
                .circuitBreakers(circuitBreakers)
                .timeSource(timeSource)
                .metrics(metrics)
                .build();
        if (builder.cache != null) {
            this.cache = builder.cache;
        } else if (options.isCacheEnabled()) {
            this.cache = new CaffeineResponseCache(options.cacheConfig(), timeSource::nanoTime, metrics);
        } else {
            this.cache = new NoOpResponseCache();
        }

        this.orchestrator = ResearchOrchestrator.builder()
                .registry(registry)
                .planner(StrategyPlanner.withDefaultRules(registry))
                .ledger(ledger)
                .matcher(matcher)
                .synthesizer(synthesizer)
                .store(store)
                .rateLimiter(rateLimiter)
                .retryExecutor(retryExecutor)
                .cache(cache)
                .options(options)
                .timeSource(timeSource)
                .metrics(metrics)
                .build();

        AtomicInteger counter = new AtomicInteger();
        this.jobExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "research-job-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        log.info("ResearchService initialized: strategies={} options={}", registry.kinds(), options);
    }

    /**
     * Creates a job for the target and runs it in the background.
     *
     * @return the new job's id; poll {@link #getJob(String)} for progress
     */
    public String startJob(String targetIdentity, EntityType entityType) {
        return startJob(EntityProfile.of(targetIdentity, entityType), null);
    }

    /**
     * Creates a job that runs exactly the given strategies, in the given order.
     */
    public String startJob(String targetIdentity, EntityType entityType, List<StrategyKind> strategyOverride) {
        return startJob(EntityProfile.of(targetIdentity, entityType), strategyOverride);
    }

    public String startJob(EntityProfile profile, List<StrategyKind> strategyOverride) {
        Job job = ledger.create(profile, hasOverride(strategyOverride));
        String jobId = job.getId();
        List<StrategyKind> override = copyOf(strategyOverride);
        jobExecutor.execute(() -> runInBackground(jobId, override));
        log.info("job.submitted jobId={} target={}", jobId, profile.targetIdentity());
        return jobId;
    }

    /**
     * Creates a job and runs it on the calling thread.
     *
     * @return the finalized job
     */
    public Job runJob(EntityProfile profile, List<StrategyKind> strategyOverride) {
        Job job = ledger.create(profile, hasOverride(strategyOverride));
        return orchestrator.run(job.getId(), copyOf(strategyOverride));
    }

    public Job runJob(String targetIdentity, EntityType entityType) {
        return runJob(EntityProfile.of(targetIdentity, entityType), null);
    }

    /**
     * Current snapshot of a job, including its attempts and full reasoning log.
     */
    public Optional<Job> getJob(String jobId) {
        return ledger.get(jobId);
    }

    /**
     * Requests cooperative cancellation. Strategies already running finish; nothing new is dispatched.
     *
     * @return false if the job is unknown or already finished
     */
    public boolean cancelJob(String jobId) {
        if (ledger.get(jobId).isEmpty()) {
            return false;
        }
        return ledger.requestCancel(jobId);
    }

    /**
     * Looks up the stored entity for a name: first by its normalized key, then by fuzzy match
     * against every stored entity.
     */
    public Optional<MergedEntity> getMergedEntity(String targetIdentity) {
        if (targetIdentity == null || targetIdentity.isBlank()) {
            return Optional.empty();
        }
        String key = matcher.normalize(targetIdentity);
        Optional<MergedEntity> exact = store.findByKey(key);
        if (exact.isPresent()) {
            return exact;
        }
        List<KnownEntity> known = store.findAll().stream().map(KnownEntity::of).toList();
        MatchResult match = matcher.matchName(targetIdentity, known);
        if (match.isNew()) {
            return Optional.empty();
        }
        return store.findByKey(match.normalizedKey());
    }

    /**
     * Report of a job together with the stored entities its records contributed to.
     */
    public Optional<JobReport> getJobReport(String jobId) {
        return ledger.get(jobId).map(job -> JobReport.of(job, store.findAll()));
    }

    public List<MergedEntity> getMergedEntities() {
        return store.findAll();
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public ResearchOptions getOptions() {
        return options;
    }

    public StrategyRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        jobExecutor.shutdownNow();
        try {
            if (!jobExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("research.close jobs still running after 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        orchestrator.close();
        retryExecutor.close();
        log.info("ResearchService closed");
    }

    private void runInBackground(String jobId, List<StrategyKind> override) {
        try {
            orchestrator.run(jobId, override);
        } catch (InvalidTransitionException e) {
            log.error("job.aborted jobId={} error={}", jobId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("job.crashed jobId={}", jobId, e);
        }
    }

    private static boolean hasOverride(List<StrategyKind> override) {
        return override != null && !override.isEmpty();
    }

    private static List<StrategyKind> copyOf(List<StrategyKind> override) {
        return hasOverride(override) ? List.copyOf(override) : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<Strategy> strategies = new ArrayList<>();
        private StrategyRegistry registry;
        private ResearchOptions options = ResearchOptions.defaults();
        private NormalizationEngine normalizationEngine;
        private SimilarityAlgorithm similarity;
        private ScoringPolicy scoringPolicy;
        private JobRepository jobRepository;
        private MergedEntityStore entityStore;
        private ResponseCache cache;
        private MetricsService metricsService;
        private MeterRegistry meterRegistry;
        private TimeSource timeSource = TimeSource.system();

        public Builder strategy(Strategy strategy) {
            this.strategies.add(strategy);
            return this;
        }

        public Builder strategies(Collection<? extends Strategy> strategies) {
            this.strategies.addAll(strategies);
            return this;
        }

        /**
         * Uses a prepared registry. Strategies added with {@link #strategy(Strategy)} are registered into it.
         */
        public Builder registry(StrategyRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder options(ResearchOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets a custom normalization engine.
         * Defaults to {@link DefaultNormalizationRules#createDefaultEngine()} if not set.
         */
        public Builder normalizationEngine(NormalizationEngine normalizationEngine) {
            this.normalizationEngine = normalizationEngine;
            return this;
        }

        public Builder similarity(SimilarityAlgorithm similarity) {
            this.similarity = similarity;
            return this;
        }

        public Builder scoringPolicy(ScoringPolicy scoringPolicy) {
            this.scoringPolicy = scoringPolicy;
            return this;
        }

        /**
         * Sets where jobs, attempts and candidate records are kept.
         * Defaults to {@link InMemoryJobRepository} if not set.
         */
        public Builder jobRepository(JobRepository jobRepository) {
            this.jobRepository = jobRepository;
            return this;
        }

        public Builder entityStore(MergedEntityStore entityStore) {
            this.entityStore = entityStore;
            return this;
        }

        /**
         * Replaces the response cache built from the options.
         */
        public Builder cache(ResponseCache cache) {
            this.cache = cache;
            return this;
        }

        /**
         * Sets a custom metrics service. Takes precedence over {@link #meterRegistry(MeterRegistry)}.
         * Defaults to {@link NoOpMetricsService} if neither is set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        /**
         * Clock used for pacing, backoff, cache expiry and ledger timestamps.
         */
        public Builder timeSource(TimeSource timeSource) {
            this.timeSource = timeSource;
            return this;
        }

        public ResearchService build() {
            if (options == null) {
                throw new IllegalStateException("ResearchOptions are required");
            }
            if (timeSource == null) {
                throw new IllegalStateException("TimeSource is required");
            }
            if (registry == null) {
                registry = new StrategyRegistry();
            }
            strategies.forEach(registry::register);
            if (registry.kinds().isEmpty()) {
                throw new IllegalStateException("At least one strategy must be registered");
            }
            return new ResearchService(this);
        }
    }
}
