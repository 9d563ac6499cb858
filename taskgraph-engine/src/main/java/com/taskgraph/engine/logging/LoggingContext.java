package com.taskgraph.engine.logging;

import com.taskgraph.core.task.SolvePhase;
import org.slf4j.MDC;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures solver logs carry the run, batch and task they belong to.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(runId, "build.api", "build", SolvePhase.PROCESS)) {
 *     log.info("Processing task"); // Automatically includes runId, taskKey, phase
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [taskgraph-worker-1] INFO  c.t.e.s.GraphSolver - Processing task
 *   runId=abc-123 taskKey=build.api taskType=build phase=PROCESS
 */
public final class LoggingContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String BATCH_ID = "batchId";
    public static final String TASK_KEY = "taskKey";
    public static final String TASK_TYPE = "taskType";
    public static final String PHASE = "phase";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for run-level operations.
     */
    public static LoggingContext forRun(UUID runId) {
        return forBatch(runId, null);
    }

    /**
     * Create a logging context for batch-level operations.
     */
    public static LoggingContext forBatch(UUID runId, UUID batchId) {
        LoggingContext ctx = new LoggingContext();
        if (runId != null) {
            MDC.put(RUN_ID, runId.toString());
        }
        if (batchId != null) {
            MDC.put(BATCH_ID, batchId.toString());
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for a single task invocation.
     */
    public static LoggingContext forTask(UUID runId, String taskKey, String taskType, SolvePhase phase) {
        LoggingContext ctx = new LoggingContext();
        if (runId != null) {
            MDC.put(RUN_ID, runId.toString());
        }
        if (taskKey != null) {
            MDC.put(TASK_KEY, taskKey);
        }
        if (taskType != null) {
            MDC.put(TASK_TYPE, taskType);
        }
        if (phase != null) {
            MDC.put(PHASE, phase.name());
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Get current run ID from context.
     */
    public static String getRunId() {
        return MDC.get(RUN_ID);
    }

    /**
     * Get current task key from context.
     */
    public static String getTaskKey() {
        return MDC.get(TASK_KEY);
    }

    /**
     * Get current trace ID from context.
     */
    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    /**
     * Ensure a trace ID exists in the context.
     */
    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(RUN_ID);
        MDC.remove(BATCH_ID);
        MDC.remove(TASK_KEY);
        MDC.remove(TASK_TYPE);
        MDC.remove(PHASE);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request or worker loop.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
