package com.entity.research.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class LogContextTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void jobContextPopulatesAndClearsMdc() {
        try (LogContext ignored = LogContext.forJob("job-1", "Acme Capital")) {
            assertEquals("job-1", MDC.get("jobId"));
            assertEquals("Acme Capital", MDC.get("targetIdentity"));
            assertEquals("research", MDC.get("operation"));
        }
        assertNull(MDC.get("jobId"));
        assertNull(MDC.get("targetIdentity"));
    }

    @Test
    void attemptContextAddsStrategyAndSkipsNulls() {
        try (LogContext ctx = LogContext.forAttempt("job-1", "sec_13f").with("target", null).with("attempt", "2")) {
            assertEquals("sec_13f", MDC.get("strategy"));
            assertEquals("2", MDC.get("attempt"));
            assertNull(MDC.get("target"));
        }
        assertNull(MDC.get("strategy"));
        assertNull(MDC.get("attempt"));
    }
}
