package com.taskgraph.core.model;

/**
 * Lifecycle of a batch of submitted root tasks.
 */
public enum BatchStatus {
    /**
     * Some task the batch depends on has not reached a terminal state.
     */
    RUNNING,

    /**
     * Every task the batch depends on has a result. Terminal state.
     */
    SETTLED,

    /**
     * The batch was cancelled explicitly or by its deadline. Terminal once its tasks drained.
     */
    CANCELLED;

    public boolean isActive() {
        return this == RUNNING;
    }
}
