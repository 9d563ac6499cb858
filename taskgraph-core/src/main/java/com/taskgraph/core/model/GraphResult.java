package com.taskgraph.core.model;

import com.taskgraph.core.exception.TaskGraphException;
import com.taskgraph.core.task.Task;

import java.time.Instant;
import java.util.Map;

/**
 * The recorded outcome of one task key within one solver run.
 * Written once by the solver, read by dependents and by the caller.
 *
 * Invariants:
 * - state is terminal (DONE, FAILED or CANCELLED)
 * - result set iff state == DONE
 * - error set iff state != DONE
 * - startedAt is null only for tasks cancelled before they were invoked
 * - for processed tasks startedAt is when processing began, otherwise when the status check began
 * - sequence is the order the solver recorded results in a run, starting at 1; 0 if not recorded by a solver
 */
public record GraphResult(
    // Identity
    String key,
    String type,
    String name,
    String description,
    
    // Outcome
    TaskState state,
    TaskStatus result,
    boolean processed,
    TaskGraphException error,
    String inputVersion,
    
    // Timing
    Instant startedAt,
    Instant completedAt,
    
    // Dependency results handed to the task
    GraphResults dependencyResults,

    // Write order within the run
    long sequence
) {
    /**
     * Result of a task that finished successfully, by processing or by status short-circuit.
     */
    public static GraphResult done(
            Task task,
            TaskStatus result,
            boolean processed,
            Instant startedAt,
            Instant completedAt,
            GraphResults dependencyResults) {
        return new GraphResult(
            task.getKey(),
            task.getType(),
            task.getName(),
            task.getDescription(),
            TaskState.DONE,
            result,
            processed,
            null,
            task.getInputVersion(),
            startedAt,
            completedAt,
            dependencyResults,
            0L
        );
    }

    /**
     * Result of a task whose status check or processing failed.
     */
    public static GraphResult failed(
            Task task,
            TaskGraphException error,
            Instant startedAt,
            Instant completedAt,
            GraphResults dependencyResults) {
        return new GraphResult(
            task.getKey(),
            task.getType(),
            task.getName(),
            task.getDescription(),
            TaskState.FAILED,
            null,
            false,
            error,
            task.getInputVersion(),
            startedAt,
            completedAt,
            dependencyResults,
            0L
        );
    }

    /**
     * Result of a task cancelled by a failed dependency, its batch or a deadline.
     */
    public static GraphResult cancelled(
            Task task,
            TaskGraphException error,
            Instant startedAt,
            Instant completedAt,
            GraphResults dependencyResults) {
        return new GraphResult(
            task.getKey(),
            task.getType(),
            task.getName(),
            task.getDescription(),
            TaskState.CANCELLED,
            null,
            false,
            error,
            task.getInputVersion(),
            startedAt,
            completedAt,
            dependencyResults,
            0L
        );
    }

    /**
     * Copy stamped with the order it was recorded in.
     */
    public GraphResult withSequence(long sequence) {
        return new GraphResult(key, type, name, description, state, result, processed, error, inputVersion,
            startedAt, completedAt, dependencyResults, sequence);
    }

    public boolean isSuccess() {
        return state == TaskState.DONE;
    }

    public boolean isFailed() {
        return state == TaskState.FAILED;
    }

    public boolean isCancelled() {
        return state == TaskState.CANCELLED;
    }

    /**
     * Action state of the recorded status, or {@link ActionState#FAILED} when the task did not succeed.
     */
    public ActionState actionState() {
        return result != null ? result.state() : ActionState.FAILED;
    }

    /**
     * Outputs of the status check or processing that produced this result.
     */
    public Map<String, Object> outputs() {
        return result != null ? result.outputs() : Map.of();
    }
}
