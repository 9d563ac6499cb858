package com.taskgraph.core.model;

/**
 * Types of events emitted by the solver.
 * Events are immutable facts appended to the event log.
 */
public enum SolverEventType {
    // Batch lifecycle events
    BATCH_STARTED,
    BATCH_SETTLED,
    BATCH_CANCELLED,

    // Task lifecycle events
    TASK_PENDING,
    TASK_STATUS_CHECKING,
    TASK_PROCESSING,
    TASK_COMPLETED,
    TASK_FAILED,
    TASK_CANCELLED,

    // Solver activity events
    GRAPH_PROCESSING,
    GRAPH_IDLE
}
