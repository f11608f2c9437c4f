package com.entity.research.core;

import java.time.Duration;
import java.time.Instant;

/**
 * Clock and sleep abstraction used by every component that waits.
 * Tests substitute a manual implementation so pacing and backoff can be
 * verified without real delays.
 */
public interface TimeSource {

    /**
     * Monotonic time in nanoseconds, only meaningful as a difference.
     */
    long nanoTime();

    /**
     * Wall-clock time used for timestamps.
     */
    Instant now();

    /**
     * Suspends the calling thread for the given duration.
     */
    void sleep(Duration duration) throws InterruptedException;

    static TimeSource system() {
        return SystemTimeSource.INSTANCE;
    }
}
