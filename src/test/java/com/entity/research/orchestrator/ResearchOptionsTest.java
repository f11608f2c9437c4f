package com.entity.research.orchestrator;

import com.entity.research.core.model.SourceType;
import com.entity.research.ratelimit.TargetLimit;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResearchOptionsTest {

    @Test
    void defaults() {
        ResearchOptions options = ResearchOptions.defaults();

        assertEquals(5, options.getMaxStrategiesPerJob());
        assertEquals(Duration.ofSeconds(600), options.getMaxJobDuration());
        assertEquals(3, options.getMaxParallelStrategies());
        assertEquals(0.85, options.getFuzzyMatchThreshold());
        assertEquals(80, options.getCoverageThreshold());
        assertEquals(2, options.getMinSourceTypes());
        assertEquals(new TargetLimit(3, 1.0), options.rateLimitConfig().getDefaultLimit());
        assertEquals(3, options.retryPolicy().maxAttempts());
        assertTrue(options.cacheConfig().enabled());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> ResearchOptions.builder().maxStrategiesPerJob(0).build());
        assertThrows(IllegalArgumentException.class, () -> ResearchOptions.builder().maxParallelStrategies(9).build());
        assertThrows(IllegalArgumentException.class, () -> ResearchOptions.builder().fuzzyMatchThreshold(0.0).build());
        assertThrows(IllegalArgumentException.class, () -> ResearchOptions.builder().coverageThreshold(101).build());
        assertThrows(IllegalArgumentException.class,
                () -> ResearchOptions.builder().circuitResetTimeout(Duration.ZERO).build());
    }

    @Test
    void perTargetOverridesReachRateLimitConfig() {
        ResearchOptions options = ResearchOptions.builder()
                .targetLimit("test-filings", new TargetLimit(1, 0.5))
                .sourcePriorityOrder(List.of(SourceType.OFFICIAL_PRIMARY, SourceType.REGULATORY_FILING))
                .build();

        assertEquals(new TargetLimit(1, 0.5), options.rateLimitConfig().limitFor("test-filings"));
        assertEquals(2, options.sourcePriority().rank(SourceType.OFFICIAL_PRIMARY));
    }
}
