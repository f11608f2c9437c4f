package com.entity.research.cdi;

import com.entity.research.api.ResearchService;
import com.entity.research.core.model.SourceType;
import com.entity.research.orchestrator.ResearchOptions;
import com.entity.research.strategy.Strategy;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * CDI producer that wires the research engine from MicroProfile Config properties.
 *
 * <p>Strategies are discovered as CDI beans implementing {@link Strategy}. A {@link MeterRegistry}
 * bean, when one is resolvable, receives the engine's metrics.</p>
 *
 * <h2>Example configuration</h2>
 * <pre>
 * entity-research:
 *   rate-limit:
 *     max-concurrent-per-target: 3
 *     requests-per-second-per-target: 1.0
 *   retry:
 *     max-attempts: 3
 *     base-delay-seconds: 1.0
 *   job:
 *     max-strategies: 5
 *     max-duration-seconds: 600
 *   matching:
 *     fuzzy-threshold: 0.85
 *   synthesis:
 *     source-priority-order: regulatory_filing,official_primary,structured_registry,first_party_content,press_news,inferred_signal
 * </pre>
 */
@ApplicationScoped
public class ResearchProducer {

    private static final Logger log = LoggerFactory.getLogger(ResearchProducer.class);

    // ── Rate Limiting ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-research.rate-limit.max-concurrent-per-target", defaultValue = "3")
    int maxConcurrentPerTarget;

    @Inject
    @ConfigProperty(name = "entity-research.rate-limit.requests-per-second-per-target", defaultValue = "1.0")
    double requestsPerSecondPerTarget;

    // ── Retry ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-research.retry.max-attempts", defaultValue = "3")
    int maxAttempts;

    @Inject
    @ConfigProperty(name = "entity-research.retry.base-delay-seconds", defaultValue = "1.0")
    double baseDelaySeconds;

    @Inject
    @ConfigProperty(name = "entity-research.retry.max-delay-seconds", defaultValue = "60")
    long maxDelaySeconds;

    @Inject
    @ConfigProperty(name = "entity-research.retry.request-timeout-seconds", defaultValue = "30")
    long requestTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "entity-research.retry.circuit-failure-threshold", defaultValue = "5")
    int circuitFailureThreshold;

    @Inject
    @ConfigProperty(name = "entity-research.retry.circuit-reset-seconds", defaultValue = "60")
    long circuitResetSeconds;

    // ── Jobs ──────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-research.job.max-strategies", defaultValue = "5")
    int maxStrategiesPerJob;

    @Inject
    @ConfigProperty(name = "entity-research.job.max-duration-seconds", defaultValue = "600")
    long maxJobDurationSeconds;

    @Inject
    @ConfigProperty(name = "entity-research.job.max-parallel-strategies", defaultValue = "3")
    int maxParallelStrategies;

    @Inject
    @ConfigProperty(name = "entity-research.job.strategy-timeout-seconds", defaultValue = "120")
    long strategyTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "entity-research.job.coverage-threshold", defaultValue = "80")
    int coverageThreshold;

    @Inject
    @ConfigProperty(name = "entity-research.job.min-source-types", defaultValue = "2")
    int minSourceTypes;

    // ── Matching & Synthesis ──────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-research.matching.fuzzy-threshold", defaultValue = "0.85")
    double fuzzyMatchThreshold;

    @Inject
    @ConfigProperty(name = "entity-research.synthesis.source-priority-order")
    Optional<List<String>> sourcePriorityOrder;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-research.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "entity-research.cache.max-size", defaultValue = "10000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "entity-research.cache.ttl-seconds", defaultValue = "3600")
    long cacheTtlSeconds;

    // ── Collaborators ─────────────────────────────────────────

    @Inject
    Instance<Strategy> strategies;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ResearchService researchService() {
        ResearchOptions options = researchOptions();
        List<Strategy> discovered = strategies.stream().toList();
        log.info("Producing ResearchService: strategies={} maxStrategiesPerJob={} maxParallel={}",
                discovered.stream().map(Strategy::id).toList(), options.getMaxStrategiesPerJob(),
                options.getMaxParallelStrategies());

        ResearchService.Builder builder = ResearchService.builder()
                .strategies(discovered)
                .options(options);

        if (meterRegistry != null && meterRegistry.isResolvable()) {
            builder.meterRegistry(meterRegistry.get());
            log.info("Micrometer metrics enabled");
        }
        return builder.build();
    }

    public void closeResearchService(@Disposes ResearchService service) {
        log.info("Closing ResearchService");
        service.close();
    }

    ResearchOptions researchOptions() {
        ResearchOptions.Builder builder = ResearchOptions.builder()
                .maxConcurrentPerTarget(maxConcurrentPerTarget)
                .requestsPerSecondPerTarget(requestsPerSecondPerTarget)
                .maxAttempts(maxAttempts)
                .baseDelay(Duration.ofMillis(Math.round(baseDelaySeconds * 1000)))
                .maxDelay(Duration.ofSeconds(maxDelaySeconds))
                .requestTimeout(Duration.ofSeconds(requestTimeoutSeconds))
                .circuitFailureThreshold(circuitFailureThreshold)
                .circuitResetTimeout(Duration.ofSeconds(circuitResetSeconds))
                .maxStrategiesPerJob(maxStrategiesPerJob)
                .maxJobDuration(Duration.ofSeconds(maxJobDurationSeconds))
                .maxParallelStrategies(maxParallelStrategies)
                .strategyTimeout(Duration.ofSeconds(strategyTimeoutSeconds))
                .coverageThreshold(coverageThreshold)
                .minSourceTypes(minSourceTypes)
                .fuzzyMatchThreshold(fuzzyMatchThreshold)
                .cacheEnabled(cacheEnabled)
                .cacheMaxSize(cacheMaxSize)
                .cacheTtl(Duration.ofSeconds(cacheTtlSeconds));
        if (sourcePriorityOrder != null) {
            sourcePriorityOrder.filter(codes -> !codes.isEmpty()).ifPresent(codes ->
                    builder.sourcePriorityOrder(codes.stream().map(SourceType::fromCode).toList()));
        }
        return builder.build();
    }
}
