package com.entity.research.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC wrapper. Entries added through this context are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forJob(jobId, target)) {
 *     log.info("job.started jobId={}", jobId);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forJob(String jobId, String targetIdentity) {
        LogContext ctx = new LogContext();
        ctx.put("jobId", jobId);
        ctx.put("targetIdentity", targetIdentity);
        ctx.put("operation", "research");
        return ctx;
    }

    /**
     * Context for one strategy attempt, which runs on a worker thread.
     */
    public static LogContext forAttempt(String jobId, String strategyId) {
        LogContext ctx = new LogContext();
        ctx.put("jobId", jobId);
        ctx.put("strategy", strategyId);
        ctx.put("operation", "attempt");
        return ctx;
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
