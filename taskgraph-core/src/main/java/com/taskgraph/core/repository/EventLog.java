package com.taskgraph.core.repository;

import com.taskgraph.core.model.SolverEvent;
import com.taskgraph.core.model.SolverEventType;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only stream of solver events.
 * The solver appends from its bookkeeping thread, so implementations must not block.
 */
public interface EventLog {

    /**
     * Append a new event to the log.
     * 
     * @param event The event to append
     */
    void append(SolverEvent event);

    /**
     * Get all events in order.
     * 
     * @return All events ordered by sequence number
     */
    List<SolverEvent> findAll();

    /**
     * Get the events of one batch.
     * 
     * @param batchId The batch ID
     * @return Events for the batch ordered by sequence number
     */
    List<SolverEvent> findByBatch(UUID batchId);

    /**
     * Get the events of one task key.
     * 
     * @param taskKey The task key
     * @return Events for the task ordered by sequence number
     */
    List<SolverEvent> findByTask(String taskKey);

    /**
     * Get the events of the given types.
     * 
     * @param types Event types to filter by
     * @return Matching events ordered by sequence number
     */
    List<SolverEvent> findByTypes(List<SolverEventType> types);

    /**
     * Count events by type.
     * 
     * @return Count per event type
     */
    Map<SolverEventType, Long> countByType();
}
