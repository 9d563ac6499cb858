package com.taskgraph.core.model;

/**
 * Lifecycle states of a task key within one solver run.
 */
public enum TaskState {
    /**
     * Task is known to the run and waiting for its status dependencies
     * (and any of its dependencies already requested) to settle.
     * Transitions: -> STATUS_CHECKING, AWAITING_DEPENDENCIES (forced), CANCELLED
     */
    PENDING,

    /**
     * The task's status check is running on a worker.
     * Transitions: -> SHORT_CIRCUITED, AWAITING_DEPENDENCIES, FAILED, CANCELLED
     */
    STATUS_CHECKING,

    /**
     * Status reported ready; processing is skipped.
     * Transitions: -> DONE
     */
    SHORT_CIRCUITED,

    /**
     * Task must be processed and waits for all dependencies to be done.
     * Transitions: -> PROCESSING, CANCELLED
     */
    AWAITING_DEPENDENCIES,

    /**
     * The task's processing is running on a worker.
     * Transitions: -> DONE, FAILED, CANCELLED
     */
    PROCESSING,

    /**
     * Task finished successfully, processed or not. Terminal state.
     */
    DONE,

    /**
     * Status check or processing failed. Terminal state.
     */
    FAILED,

    /**
     * Task was cancelled by a failed dependency, its batch or a deadline. Terminal state.
     */
    CANCELLED;

    /**
     * Check if this state is terminal (no further transitions).
     */
    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if this state means the task body is running on a worker.
     */
    public boolean isActive() {
        return this == STATUS_CHECKING || this == PROCESSING;
    }

    /**
     * Check if this is a terminal state other than success.
     */
    public boolean isUnsuccessful() {
        return this == FAILED || this == CANCELLED;
    }

    /**
     * Check if transition to target state is valid.
     */
    public boolean canTransitionTo(TaskState target) {
        return switch (this) {
            case PENDING -> target == STATUS_CHECKING || target == AWAITING_DEPENDENCIES || target == CANCELLED;
            case STATUS_CHECKING -> target == SHORT_CIRCUITED || target == AWAITING_DEPENDENCIES
                || target == FAILED || target == CANCELLED;
            case SHORT_CIRCUITED -> target == DONE;
            case AWAITING_DEPENDENCIES -> target == PROCESSING || target == CANCELLED;
            case PROCESSING -> target == DONE || target == FAILED || target == CANCELLED;
            case DONE, FAILED, CANCELLED -> false;
        };
    }
}
