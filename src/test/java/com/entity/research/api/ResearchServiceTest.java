package com.entity.research.api;

import com.entity.research.core.model.EntityFields;
import com.entity.research.core.model.EntityProfile;
import com.entity.research.core.model.EntityType;
import com.entity.research.core.model.MergedEntity;
import com.entity.research.core.model.SourceType;
import com.entity.research.ledger.DecisionKind;
import com.entity.research.ledger.Job;
import com.entity.research.ledger.JobStatus;
import com.entity.research.ledger.ReasoningEntry;
import com.entity.research.ledger.StrategyAttempt;
import com.entity.research.orchestrator.ResearchOptions;
import com.entity.research.retry.PermanentClientException;
import com.entity.research.strategy.StrategyKind;
import com.entity.research.strategy.StrategyStatus;
import com.entity.research.strategy.StubStrategy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ResearchServiceTest {

    private static final List<StrategyKind> OVERRIDE =
            List.of(StrategyKind.SEC_13F, StrategyKind.WEBSITE, StrategyKind.NEWS);

    private StubStrategy filings;
    private StubStrategy website;
    private StubStrategy news;
    private SimpleMeterRegistry meterRegistry;
    private ResearchService service;

    @BeforeEach
    void setUp() {
        filings = StubStrategy.returning(StrategyKind.SEC_13F, SourceType.REGULATORY_FILING, "test-filings",
                List.of(Map.of(EntityFields.NAME, "Acme Capital, LLC", EntityFields.AUM, 500_000_000L)));
        website = StubStrategy.returning(StrategyKind.WEBSITE, SourceType.FIRST_PARTY_CONTENT, "test-web",
                List.of(Map.of(EntityFields.NAME, "Acme Capital", EntityFields.WEBSITE, "acmecap.com")));
        news = StubStrategy.returning(StrategyKind.NEWS, SourceType.PRESS_NEWS, "test-news", List.of());
        meterRegistry = new SimpleMeterRegistry();
        service = ResearchService.builder()
                .strategies(List.of(filings, website, news))
                .meterRegistry(meterRegistry)
                .build();
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    private static EntityProfile acme() {
        return EntityProfile.of("Acme Capital LLC", EntityType.INVESTOR);
    }

    private Job awaitTerminal(String jobId) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (System.nanoTime() < deadline) {
            Job job = service.getJob(jobId).orElseThrow();
            if (job.isTerminal()) {
                return job;
            }
            Thread.sleep(20);
        }
        fail("Job " + jobId + " did not finish in time");
        return null;
    }

    @Test
    @DisplayName("Variants of one investor from two sources merge into a single entity")
    void mergesSourcesIntoOneEntity() {
        Job job = service.runJob(acme(), OVERRIDE);

        assertEquals(JobStatus.SUCCESS, job.getStatus());
        assertTrue(job.isStrategyOverride());
        MergedEntity entity = service.getMergedEntity("Acme Capital").orElseThrow();
        assertEquals("acme capital", entity.normalizedKey());
        assertEquals(500_000_000L, entity.attributes().get(EntityFields.AUM));
        assertEquals("acmecap.com", entity.attributes().get(EntityFields.WEBSITE));
        assertEquals("Acme Capital, LLC", entity.attributes().get(EntityFields.NAME));
        assertEquals(SourceType.REGULATORY_FILING, entity.provenance().get(EntityFields.AUM).sourceType());
        assertEquals(2, entity.sourceCount());
        assertEquals(100, entity.completenessScore());
        assertEquals(1, service.getMergedEntities().size());
    }

    @Test
    void summaryAndReasoningDescribeTheRun() {
        Job job = service.runJob(acme(), OVERRIDE);

        assertTrue(job.getStartedAt().isPresent());
        assertTrue(job.getFinishedAt().isPresent());
        assertEquals(1, job.getSummary().orElseThrow().newEntities());
        assertEquals(2, job.getSummary().orElseThrow().recordsCollected());
        List<DecisionKind> kinds = job.getReasoningLog().stream().map(ReasoningEntry::kind).toList();
        assertEquals(DecisionKind.PLAN, kinds.get(0));
        assertTrue(kinds.contains(DecisionKind.DISPATCH));
        assertTrue(kinds.contains(DecisionKind.STOP));
        assertEquals(DecisionKind.FINALIZE, kinds.get(kinds.size() - 1));
        for (int i = 0; i < job.getReasoningLog().size(); i++) {
            assertEquals(i + 1, job.getReasoningLog().get(i).sequence());
        }
        assertTrue(job.getAttempts().stream().noneMatch(StrategyAttempt::isOpen));
    }

    @Test
    @DisplayName("Re-running the same research changes nothing and is served from cache")
    void rerunIsIdempotent() {
        service.runJob(acme(), OVERRIDE);
        MergedEntity first = service.getMergedEntity("Acme Capital").orElseThrow();

        Job second = service.runJob(acme(), OVERRIDE);
        MergedEntity again = service.getMergedEntity("Acme Capital").orElseThrow();

        assertEquals(first.attributes(), again.attributes());
        assertEquals(first.provenance(), again.provenance());
        assertEquals(first.recordCount(), again.recordCount());
        assertEquals(0, second.getSummary().orElseThrow().newEntities());
        assertEquals(1, second.getSummary().orElseThrow().updatedEntities());
        assertEquals(1, filings.getFetches());
        assertTrue(service.getCacheStats().hitCount() >= 3);
    }

    @Test
    void failedStrategyYieldsPartialSuccess() {
        StubStrategy registry = StubStrategy.failing(StrategyKind.REGISTRY_LOOKUP,
                SourceType.STRUCTURED_REGISTRY, "test-registry", new PermanentClientException("404 not found"));
        try (ResearchService partial = ResearchService.builder()
                .strategies(List.of(filings, registry))
                .build()) {
            Job job = partial.runJob(acme(), List.of(StrategyKind.SEC_13F, StrategyKind.REGISTRY_LOOKUP));

            assertEquals(JobStatus.PARTIAL_SUCCESS, job.getStatus());
            StrategyAttempt failed = job.findAttempt("registry_lookup").orElseThrow();
            assertEquals(StrategyStatus.FAILED, failed.status());
            assertEquals(1, job.getErrors().size());
            assertEquals("registry_lookup", job.getErrors().get(0).strategyId());
            assertTrue(job.getReasoningLog().stream().anyMatch(e -> e.kind() == DecisionKind.ATTEMPT_FAILED));
        }
    }

    @Test
    void noApplicableStrategiesFailsJob() {
        try (ResearchService webOnly = ResearchService.builder().strategy(website).build()) {
            Job job = webOnly.runJob("Blue Heron", EntityType.COMPANY);

            assertEquals(JobStatus.FAILED, job.getStatus());
            assertEquals("no_applicable_strategies", job.getSummary().orElseThrow().stopReason());
            assertTrue(job.getAttempts().isEmpty());
        }
    }

    @Test
    void startJobRunsInBackground() throws InterruptedException {
        String jobId = service.startJob("Acme Capital LLC", EntityType.INVESTOR, OVERRIDE);

        Job job = awaitTerminal(jobId);

        assertEquals(JobStatus.SUCCESS, job.getStatus());
        assertTrue(service.getJobReport(jobId).isPresent());
        assertFalse(service.cancelJob(jobId));
    }

    @Test
    @DisplayName("Cancellation stops further dispatch and finalizes the job as failed")
    void cancelStopsDispatch() throws InterruptedException {
        CountDownLatch gate = new CountDownLatch(1);
        StubStrategy slow = StubStrategy.gated(StrategyKind.NEWS, SourceType.PRESS_NEWS, "test-slow-news",
                List.of(), gate);
        try (ResearchService sequential = ResearchService.builder()
                .strategies(List.of(slow, website))
                .options(ResearchOptions.builder().maxParallelStrategies(1).build())
                .build()) {
            String jobId = sequential.startJob(acme(), List.of(StrategyKind.NEWS, StrategyKind.WEBSITE));
            assertTrue(slow.getStarted().await(10, TimeUnit.SECONDS));

            assertTrue(sequential.cancelJob(jobId));
            gate.countDown();

            Job job = null;
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
            while (System.nanoTime() < deadline) {
                job = sequential.getJob(jobId).orElseThrow();
                if (job.isTerminal()) {
                    break;
                }
                Thread.sleep(20);
            }
            assertNotNull(job);
            assertEquals(JobStatus.FAILED, job.getStatus());
            assertEquals("cancelled", job.getSummary().orElseThrow().stopReason());
            assertEquals(1, job.getAttempts().size());
            assertTrue(job.findAttempt("website").isEmpty());
            assertTrue(job.getReasoningLog().stream().anyMatch(e -> e.kind() == DecisionKind.CANCEL));
        }
    }

    @Test
    void unknownJobCannotBeCancelled() {
        assertFalse(service.cancelJob("no-such-job"));
        assertTrue(service.getJob("no-such-job").isEmpty());
        assertTrue(service.getJobReport("no-such-job").isEmpty());
    }

    @Test
    void lookupOfUnknownOrBlankNameIsEmpty() {
        service.runJob(acme(), OVERRIDE);

        assertTrue(service.getMergedEntity("").isEmpty());
        assertTrue(service.getMergedEntity("Zenith Ventures").isEmpty());
        assertTrue(service.getMergedEntity("The Acme Capitol").isPresent());
    }

    @Test
    void metricsAreRecorded() {
        service.runJob(acme(), OVERRIDE);

        assertEquals(1.0, meterRegistry.get("research.job.finalized").tag("status", "success").counter().count());
    }

    @Nested
    class Building {

        @Test
        void requiresAtLeastOneStrategy() {
            assertThrows(IllegalStateException.class, () -> ResearchService.builder().build());
        }

        @Test
        void overrideNamingUnregisteredStrategyIsRejected() {
            try (ResearchService webOnly = ResearchService.builder().strategy(website).build()) {
                Job job = webOnly.runJob(acme(), List.of(StrategyKind.SEC_13F));

                assertEquals(JobStatus.FAILED, job.getStatus());
                assertEquals("IllegalArgumentException", job.getErrors().get(0).errorType());
            }
        }
    }
}
