package com.entity.research.retry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class FailureClassifierTest {

    @ParameterizedTest
    @CsvSource({
            "429, RATE_LIMITED",
            "408, TRANSIENT",
            "500, TRANSIENT",
            "503, TRANSIENT",
            "400, PERMANENT",
            "403, PERMANENT",
            "404, PERMANENT"
    })
    void classifiesHttpStatus(int status, FailureKind expected) {
        assertEquals(expected, FailureClassifier.classifyStatus(status));
    }

    @Test
    void classifiesExceptions() {
        assertEquals(FailureKind.TRANSIENT, FailureClassifier.classify(new IOException("reset")));
        assertEquals(FailureKind.TRANSIENT,
                FailureClassifier.classify(new UncheckedIOException(new IOException("reset"))));
        assertEquals(FailureKind.TRANSIENT, FailureClassifier.classify(new TimeoutException()));
        assertEquals(FailureKind.RATE_LIMITED, FailureClassifier.classify(new RateLimitedException("slow down")));
        assertEquals(FailureKind.PERMANENT, FailureClassifier.classify(new IllegalStateException("bad parse")));
    }

    @Test
    void retryAfterIsOptional() {
        assertTrue(new RateLimitedException("slow down").getRetryAfter().isEmpty());
        assertEquals(Duration.ofSeconds(3),
                new RateLimitedException("slow down", Duration.ofSeconds(3)).getRetryAfter().orElseThrow());
    }

    @Test
    void backoffIsExponentialAndCapped() {
        RetryPolicy policy = new RetryPolicy(10, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(5), 0.0, null);

        assertEquals(Duration.ofSeconds(1), policy.backoff(1));
        assertEquals(Duration.ofSeconds(4), policy.backoff(3));
        assertEquals(Duration.ofSeconds(5), policy.backoff(6));
        assertNull(policy.requestTimeout());
    }
}
