package com.entity.research.ledger;

import com.entity.research.core.FakeTimeSource;
import com.entity.research.core.model.CandidateRecord;
import com.entity.research.core.model.EntityProfile;
import com.entity.research.core.model.EntityType;
import com.entity.research.core.model.SourceType;
import com.entity.research.planner.PlannedStrategy;
import com.entity.research.strategy.StrategyKind;
import com.entity.research.strategy.StrategyResult;
import com.entity.research.strategy.StrategyStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobLedgerTest {

    private static final PlannedStrategy FILINGS =
            new PlannedStrategy(StrategyKind.SEC_13F, 8, 0.9, "Large manager files 13F");
    private static final PlannedStrategy NEWS =
            new PlannedStrategy(StrategyKind.NEWS, 6, 0.5, "Covered by press");

    private FakeTimeSource time;
    private JobLedger ledger;
    private String jobId;

    @BeforeEach
    void setUp() {
        time = new FakeTimeSource();
        ledger = new JobLedger(new InMemoryJobRepository(), time);
        jobId = ledger.create(EntityProfile.of("Acme Capital", EntityType.INVESTOR), false).getId();
    }

    private static CandidateRecord record(String id) {
        return CandidateRecord.builder()
                .id(id)
                .rawName("Acme Capital")
                .entityType(EntityType.INVESTOR)
                .sourceType(SourceType.REGULATORY_FILING)
                .strategyId("sec_13f")
                .build();
    }

    @Test
    void newJobIsPending() {
        Job job = ledger.require(jobId);

        assertEquals(JobStatus.PENDING, job.getStatus());
        assertEquals("Acme Capital", job.getTargetIdentity());
        assertTrue(job.getStartedAt().isEmpty());
        assertTrue(job.getSummary().isEmpty());
        assertFalse(job.isStrategyOverride());
    }

    @Test
    void unknownJobIsReported() {
        assertTrue(ledger.get("missing").isEmpty());
        assertThrows(JobNotFoundException.class, () -> ledger.require("missing"));
    }

    @Nested
    class Transitions {

        @Test
        void pendingToRunningStampsStart() {
            time.advance(Duration.ofSeconds(2));
            Job running = ledger.transition(jobId, JobStatus.RUNNING);

            assertEquals(JobStatus.RUNNING, running.getStatus());
            assertEquals(time.now(), running.getStartedAt().orElseThrow());
        }

        @Test
        void pendingCannotSkipToSuccess() {
            InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
                    () -> ledger.transition(jobId, JobStatus.SUCCESS));
            assertEquals(jobId, e.getJobId());
            assertTrue(e.getMessage().startsWith("Job " + jobId));
        }

        @Test
        @DisplayName("Terminal jobs accept no further updates")
        void terminalJobIsFrozen() {
            ledger.transition(jobId, JobStatus.RUNNING);
            ledger.finalizeJob(jobId, JobStatus.SUCCESS,
                    new JobSummary(1, 1, 1, 1, 0, 1, 2, Duration.ofSeconds(3), "Stop: sufficient coverage"));

            assertThrows(InvalidTransitionException.class, () -> ledger.transition(jobId, JobStatus.RUNNING));
            assertThrows(InvalidTransitionException.class,
                    () -> ledger.finalizeJob(jobId, JobStatus.FAILED, new JobSummary(0, 0, 0, 0, 0, 0, 0, null, null)));
            assertThrows(InvalidTransitionException.class,
                    () -> ledger.appendReasoning(jobId, DecisionKind.CONTINUE, Map.of(), "late"));
            assertThrows(InvalidTransitionException.class,
                    () -> ledger.recordError(jobId, "news", "IOException", "late"));
            assertFalse(ledger.requestCancel(jobId));
        }

        @Test
        @DisplayName("Per-job locks are dropped once jobs finish, and never kept for unknown jobs")
        void locksDoNotOutliveActiveJobs() {
            for (int i = 0; i < 50; i++) {
                String id = ledger.create(EntityProfile.of("Fund " + i, EntityType.INVESTOR), false).getId();
                ledger.transition(id, JobStatus.RUNNING);
                ledger.finalizeJob(id, JobStatus.FAILED,
                        new JobSummary(0, 0, 0, 0, 0, 0, 0, Duration.ZERO, "Stop: no data found"));
                assertFalse(ledger.requestCancel(id));
            }
            ledger.transition(jobId, JobStatus.RUNNING);
            assertThrows(JobNotFoundException.class, () -> ledger.requestCancel("missing"));

            assertEquals(1, ledger.lockCount());

            ledger.transition(jobId, JobStatus.FAILED);
            assertEquals(0, ledger.lockCount());
        }

        @Test
        void finalizeRequiresTerminalStatus() {
            ledger.transition(jobId, JobStatus.RUNNING);
            assertThrows(IllegalArgumentException.class, () -> ledger.finalizeJob(jobId, JobStatus.RUNNING,
                    new JobSummary(0, 0, 0, 0, 0, 0, 0, null, null)));
        }
    }

    @Nested
    class Attempts {

        @BeforeEach
        void run() {
            ledger.transition(jobId, JobStatus.RUNNING);
            ledger.recordPlan(jobId, List.of(FILINGS, NEWS));
        }

        @Test
        void openAndCloseAttempt() {
            StrategyAttempt opened = ledger.openAttempt(jobId, FILINGS, SourceType.REGULATORY_FILING);
            assertTrue(opened.isOpen());

            time.advance(Duration.ofSeconds(1));
            StrategyAttempt closed = ledger.closeAttempt(jobId, "sec_13f",
                    StrategyResult.success(List.of(record("r1"), record("r2")), 3));

            assertFalse(closed.isOpen());
            assertTrue(closed.isSucceeded());
            assertEquals(StrategyStatus.SUCCESS, closed.status());
            assertEquals(List.of("r1", "r2"), closed.recordIds());
            assertEquals(3, closed.requestsMade());
            assertEquals(List.of("sec_13f"), ledger.require(jobId).getCompletedStrategies());
            assertEquals(2, ledger.candidates(jobId).size());
            assertEquals(2, ledger.candidates(jobId, "sec_13f").size());
        }

        @Test
        void unplannedStrategyCannotBeDispatched() {
            PlannedStrategy website = new PlannedStrategy(StrategyKind.WEBSITE, 6, 0.7, "not in plan");
            assertThrows(InvalidTransitionException.class,
                    () -> ledger.openAttempt(jobId, website, SourceType.FIRST_PARTY_CONTENT));
        }

        @Test
        void strategyRunsAtMostOncePerJob() {
            ledger.openAttempt(jobId, NEWS, SourceType.PRESS_NEWS);
            assertThrows(InvalidTransitionException.class,
                    () -> ledger.openAttempt(jobId, NEWS, SourceType.PRESS_NEWS));

            ledger.closeAttempt(jobId, "news", StrategyResult.failed(1, "timeout"));
            assertThrows(InvalidTransitionException.class,
                    () -> ledger.closeAttempt(jobId, "news", StrategyResult.failed(1, "again")));
        }

        @Test
        void reasoningIsSequencedAndDropsNullInputs() {
            Map<String, Object> inputs = new HashMap<>();
            inputs.put("coverage", 40);
            inputs.put("missing", null);

            ReasoningEntry first = ledger.appendReasoning(jobId, DecisionKind.PLAN, Map.of("size", 2), "planned");
            ReasoningEntry second = ledger.appendReasoning(jobId, DecisionKind.CONTINUE, inputs, "Continue");

            assertEquals(first.sequence() + 1, second.sequence());
            assertEquals(Map.of("coverage", 40), second.inputs());
        }

        @Test
        void finalizeAppendsSummaryAndFinalEntry() {
            ledger.recordError(jobId, "news", "RetryExhaustedException", "gave up");
            Job done = ledger.finalizeJob(jobId, JobStatus.PARTIAL_SUCCESS,
                    new JobSummary(2, 1, 1, 1, 0, 2, 4, Duration.ofSeconds(5), "Stop: plan exhausted"));

            assertEquals(JobStatus.PARTIAL_SUCCESS, done.getStatus());
            assertTrue(done.getFinishedAt().isPresent());
            assertEquals("Stop: plan exhausted", done.getSummary().orElseThrow().stopReason());
            assertEquals(1, done.getErrors().size());
            ReasoningEntry last = done.getReasoningLog().get(done.getReasoningLog().size() - 1);
            assertEquals(DecisionKind.FINALIZE, last.kind());
        }
    }

    @Test
    void cancelIsRecordedOnActiveJob() {
        assertTrue(ledger.requestCancel(jobId));
        assertTrue(ledger.require(jobId).isCancelRequested());
    }
}
