package com.entity.research.ratelimit;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A granted rate limiter slot. Closing releases it; closing twice is harmless.
 */
public final class Permit implements AutoCloseable {

    private final String targetKey;
    private final long grantedAtNanos;
    private final Semaphore semaphore;
    private final AtomicBoolean released = new AtomicBoolean();

    Permit(String targetKey, long grantedAtNanos, Semaphore semaphore) {
        this.targetKey = targetKey;
        this.grantedAtNanos = grantedAtNanos;
        this.semaphore = semaphore;
    }

    public String getTargetKey() {
        return targetKey;
    }

    /**
     * Monotonic time of the grant, from the limiter's time source.
     */
    public long getGrantedAtNanos() {
        return grantedAtNanos;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            semaphore.release();
        }
    }
}
