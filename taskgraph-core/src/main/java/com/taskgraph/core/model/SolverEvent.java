package com.taskgraph.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of something that happened during a solver run.
 * Logging and reporting observe the solver through these events only.
 *
 * Invariants:
 * - sequenceNumber is contiguous within a run
 * - taskKey is set for task events, batchId for batch events
 */
public record SolverEvent(
    // Primary key
    UUID eventId,
    
    // Ordering
    UUID runId,
    long sequenceNumber,
    
    // Event data
    SolverEventType type,
    Instant timestamp,
    UUID batchId,
    String taskKey,
    JsonNode payload
) {
    /**
     * Create a new event.
     */
    public static SolverEvent create(
            UUID runId,
            long sequenceNumber,
            SolverEventType type,
            Instant timestamp,
            UUID batchId,
            String taskKey,
            JsonNode payload) {
        return new SolverEvent(
            UUID.randomUUID(),
            runId,
            sequenceNumber,
            type,
            timestamp,
            batchId,
            taskKey,
            payload
        );
    }

    /**
     * Check if this event is a batch lifecycle event.
     */
    public boolean isBatchEvent() {
        return type.name().startsWith("BATCH_");
    }

    /**
     * Check if this event is a task lifecycle event.
     */
    public boolean isTaskEvent() {
        return type.name().startsWith("TASK_");
    }
}
