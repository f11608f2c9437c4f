package com.entity.research.orchestrator;

import com.entity.research.ledger.JobStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class StopPredicatesTest {

    private final ResearchOptions options = ResearchOptions.defaults();

    private static ProgressSnapshot progress(int tried, int sourceTypes, int coverage, int records, long seconds) {
        return new ProgressSnapshot(tried, sourceTypes, coverage, records, Duration.ofSeconds(seconds));
    }

    @Test
    void continuesWhileNothingFires() {
        StopDecision decision = StopPredicates.evaluate(progress(1, 1, 66, 2, 10), options);

        assertFalse(decision.shouldStop());
        assertTrue(decision.stopReason().isEmpty());
        assertEquals("Continue", decision.outcome());
    }

    @Test
    void sufficientCoverageNeedsBothCoverageAndSourceDiversity() {
        assertEquals(StopReason.SUFFICIENT_COVERAGE,
                StopPredicates.evaluate(progress(2, 2, 80, 3, 10), options).reason());
        assertFalse(StopPredicates.evaluate(progress(2, 1, 100, 3, 10), options).shouldStop());
    }

    @Test
    void budgetStopsRegardlessOfCoverage() {
        StopDecision decision = StopPredicates.evaluate(progress(6, 1, 10, 4, 10), options);

        assertEquals(StopReason.BUDGET_EXHAUSTED, decision.reason());
        assertEquals("Stop: budget exhausted", decision.outcome());
        assertTrue(decision.condition().contains("6 >= max 5"));
    }

    @Test
    void coverageIsCheckedBeforeBudget() {
        assertEquals(StopReason.SUFFICIENT_COVERAGE,
                StopPredicates.evaluate(progress(5, 3, 100, 9, 10), options).reason());
    }

    @Test
    void timeLimitStops() {
        assertEquals(StopReason.TIME_EXCEEDED,
                StopPredicates.evaluate(progress(2, 1, 40, 3, 600), options).reason());
    }

    @Test
    void noDataAfterFloorStops() {
        ResearchOptions wide = ResearchOptions.builder().maxStrategiesPerJob(8).build();

        assertEquals(StopReason.NO_DATA_FOUND, StopPredicates.evaluate(progress(4, 0, 0, 0, 10), wide).reason());
        assertFalse(StopPredicates.evaluate(progress(3, 0, 0, 0, 10), wide).shouldStop());
    }

    @ParameterizedTest
    @CsvSource({
            "SUFFICIENT_COVERAGE, 5, false, SUCCESS",
            "BUDGET_EXHAUSTED, 5, true, PARTIAL_SUCCESS",
            "BUDGET_EXHAUSTED, 0, false, FAILED",
            "TIME_EXCEEDED, 3, false, PARTIAL_SUCCESS",
            "PLAN_EXHAUSTED, 3, false, SUCCESS",
            "PLAN_EXHAUSTED, 3, true, PARTIAL_SUCCESS",
            "PLAN_EXHAUSTED, 0, false, FAILED",
            "NO_DATA_FOUND, 0, false, FAILED",
            "CANCELLED, 7, false, FAILED",
            "NO_APPLICABLE_STRATEGIES, 0, false, FAILED"
    })
    void terminalStatusFollowsStopReason(StopReason reason, int records, boolean anyFailed, JobStatus expected) {
        assertEquals(expected, ResearchOrchestrator.resolveStatus(reason, records, anyFailed));
    }
}
