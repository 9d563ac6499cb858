package com.taskgraph.engine.metrics;

import com.taskgraph.core.task.SolvePhase;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the task graph solver.
 * One instance may be shared by many solver runs; gauges aggregate across them.
 * 
 * Metrics exposed:
 * - Task outcomes (processed, cached, failed, cancelled)
 * - Status check and processing latency per task type
 * - In-progress and queued task gauges
 * - Batch counts by outcome
 */
@Component
public class SolverMetrics implements MeterBinder {

    // Metric names
    public static final String TASKS_COMPLETED = "taskgraph.tasks.completed";
    public static final String TASKS_FAILED = "taskgraph.tasks.failed";
    public static final String TASKS_CANCELLED = "taskgraph.tasks.cancelled";
    public static final String TASK_DURATION = "taskgraph.task.duration";
    public static final String BATCH_DURATION = "taskgraph.batch.duration";
    public static final String TASKS_IN_PROGRESS = "taskgraph.tasks.in_progress";
    public static final String TASKS_QUEUED = "taskgraph.tasks.queued";

    public static final String BATCHES_STARTED = "taskgraph.batches.started";
    public static final String BATCHES_SETTLED = "taskgraph.batches.settled";
    public static final String BATCHES_CANCELLED = "taskgraph.batches.cancelled";
    public static final String CYCLES_DETECTED = "taskgraph.graph.cycles";

    private MeterRegistry registry;

    private final AtomicInteger inProgress = new AtomicInteger(0);
    private final AtomicInteger queued = new AtomicInteger(0);

    /**
     * Metrics bound to a private registry, for solvers built without one.
     */
    public static SolverMetrics standalone() {
        return bound(new SimpleMeterRegistry());
    }

    public static SolverMetrics bound(MeterRegistry registry) {
        SolverMetrics metrics = new SolverMetrics();
        metrics.bindTo(registry);
        return metrics;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(TASKS_IN_PROGRESS, inProgress, AtomicInteger::get)
            .description("Tasks currently checking status or processing")
            .register(registry);

        Gauge.builder(TASKS_QUEUED, queued, AtomicInteger::get)
            .description("Tasks ready to run but waiting for a concurrency slot")
            .register(registry);
    }

    // ========== Task Metrics ==========

    public void taskStarted(String taskType, SolvePhase phase) {
        inProgress.incrementAndGet();
    }

    public void taskFinished(String taskType, SolvePhase phase, long durationNanos) {
        inProgress.decrementAndGet();

        Timer.builder(TASK_DURATION)
            .tag("type", taskType)
            .tag("phase", phase.name().toLowerCase())
            .description("Duration of status checks and processing")
            .register(registry)
            .record(Duration.ofNanos(durationNanos));
    }

    public void taskCompleted(String taskType, boolean processed) {
        Counter.builder(TASKS_COMPLETED)
            .tag("type", taskType)
            .tag("outcome", processed ? "processed" : "cached")
            .description("Tasks that finished successfully")
            .register(registry)
            .increment();
    }

    public void taskFailed(String taskType, String errorCode) {
        Counter.builder(TASKS_FAILED)
            .tag("type", taskType)
            .tag("error_code", errorCode)
            .description("Tasks whose status check or processing failed")
            .register(registry)
            .increment();
    }

    public void taskCancelled(String taskType, String reason) {
        Counter.builder(TASKS_CANCELLED)
            .tag("type", taskType)
            .tag("reason", reason)
            .description("Tasks cancelled by a failed dependency, batch cancellation or deadline")
            .register(registry)
            .increment();
    }

    public void queueSize(int size) {
        queued.set(size);
    }

    // ========== Batch Metrics ==========

    public void batchStarted() {
        Counter.builder(BATCHES_STARTED)
            .description("Batches submitted")
            .register(registry)
            .increment();
    }

    public void batchSettled(boolean failed, long durationMs) {
        Counter.builder(BATCHES_SETTLED)
            .tag("outcome", failed ? "failed" : "success")
            .description("Batches whose tasks all reached a terminal state")
            .register(registry)
            .increment();

        Timer.builder(BATCH_DURATION)
            .tag("outcome", failed ? "failed" : "success")
            .description("Time from submission until a batch settled")
            .register(registry)
            .record(Duration.ofMillis(durationMs));
    }

    public void batchCancelled(String reason) {
        Counter.builder(BATCHES_CANCELLED)
            .tag("reason", reason)
            .description("Batches cancelled by callers or deadlines")
            .register(registry)
            .increment();
    }

    public void cycleDetected() {
        Counter.builder(CYCLES_DETECTED)
            .description("Submissions rejected because of circular dependencies")
            .register(registry)
            .increment();
    }

    public int getInProgress() {
        return inProgress.get();
    }

    public int getQueued() {
        return queued.get();
    }
}
