package com.taskgraph.core.repository;

import com.taskgraph.core.model.GraphResult;
import com.taskgraph.core.model.GraphResults;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Outcomes of one solver run, keyed by task key.
 * Results are write-once: a key never gets a second result within a run.
 */
public interface ResultStore {

    /**
     * Find the result recorded for a task key.
     * 
     * @param key The task key
     * @return The result if one has been recorded
     */
    Optional<GraphResult> get(String key);

    /**
     * Record a terminal result.
     * 
     * @param result The result to record
     * @throws com.taskgraph.core.exception.DuplicateResultException if the key already has a result
     */
    void put(GraphResult result);

    /**
     * Get every recorded result.
     * 
     * @return Results ordered by completion time
     */
    Map<String, GraphResult> getAll();

    /**
     * Get the recorded results for the given keys, in the order of the keys.
     * Keys without a result are skipped.
     * 
     * @param keys Task keys to look up
     * @return The matching results
     */
    GraphResults pick(Collection<String> keys);

    /**
     * Check if a task key has a result.
     * 
     * @param key The task key
     * @return true if a result has been recorded
     */
    boolean contains(String key);

    /**
     * Count recorded results.
     * 
     * @return Number of results
     */
    int size();
}
