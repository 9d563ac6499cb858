package com.taskgraph.core.task;

import com.taskgraph.core.model.TaskStatus;

import java.util.List;

/**
 * A unit of work the solver can schedule.
 *
 * <p>The solver depends only on this capability set. Concrete variants (builds, deployments,
 * test runs) live outside the solver and supply their edges at construction time.</p>
 *
 * <p>Two instances with the same {@link #getKey()} are the same node for a run: only the
 * first instance seen is ever invoked.</p>
 */
public interface Task {

    /**
     * Task type, e.g. {@code build}. Per-type concurrency limits are keyed on it.
     */
    String getType();

    /**
     * Name of the target within its type, e.g. {@code api}.
     */
    String getName();

    /**
     * Stable identity used for deduplication and caching.
     */
    default String getKey() {
        return getType() + "." + getName();
    }

    /**
     * Human readable description for logs and errors.
     */
    default String getDescription() {
        return getType() + " " + getName();
    }

    /**
     * Tasks that must be processed successfully before this task is processed.
     * Must return the same tasks on every call.
     */
    List<Task> getDependencies();

    /**
     * Tasks whose status must be resolved before this task's status can be checked.
     */
    default List<Task> getStatusDependencies() {
        return List.of();
    }

    /**
     * Skip the status short-circuit and always process.
     */
    default boolean isForce() {
        return false;
    }

    /**
     * Content version or fingerprint of the task's inputs, attached to its result.
     */
    String getInputVersion();

    /**
     * Check whether the task's outcome is already satisfied.
     *
     * @param context dependency results and cancellation for this invocation
     * @return the current status, READY to skip processing
     * @throws Exception on failure; {@link com.taskgraph.core.exception.TaskGraphException}s are kept as-is
     */
    TaskStatus getStatus(TaskContext context) throws Exception;

    /**
     * Do the work.
     *
     * @param context dependency results and cancellation for this invocation
     * @return READY with outputs on success
     * @throws Exception on failure; {@link com.taskgraph.core.exception.TaskGraphException}s are kept as-is
     */
    TaskStatus process(TaskContext context) throws Exception;
}
