package com.taskgraph.engine.service;

import com.taskgraph.core.model.Batch;
import com.taskgraph.core.model.GraphResults;
import com.taskgraph.core.model.SolveOptions;
import com.taskgraph.core.task.Task;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

/**
 * Caller-facing API of the task graph solver.
 * Used by CLI-style callers and higher-level orchestration alike.
 */
public interface SolverService {

    /**
     * Submit root tasks and wait for the batch to settle.
     * 
     * @param tasks Root tasks
     * @param options Submission options
     * @return Results of every task the batch needed, keyed by task key
     * @throws com.taskgraph.core.exception.CircularDependencyException if the graph has a cycle
     * @throws com.taskgraph.core.exception.GraphSolveException if throwOnError is set and a task failed
     */
    GraphResults solve(List<? extends Task> tasks, SolveOptions options);

    /**
     * Submit root tasks with default options and wait for them.
     */
    default GraphResults solve(List<? extends Task> tasks) {
        return solve(tasks, SolveOptions.defaults());
    }

    /**
     * Submit root tasks without waiting.
     * 
     * @param tasks Root tasks
     * @param options Submission options; throwOnError is ignored
     * @return The batch ID
     * @throws com.taskgraph.core.exception.CircularDependencyException if the graph has a cycle
     */
    UUID submit(List<? extends Task> tasks, SolveOptions options);

    /**
     * Block until every task of the batch has a terminal result.
     * 
     * @param batchId The batch ID
     * @return The batch results
     * @throws com.taskgraph.core.exception.NotFoundException if the batch is unknown
     */
    GraphResults waitUntilSettled(UUID batchId);

    /**
     * Block until the batch settles or the timeout elapses.
     */
    GraphResults waitUntilSettled(UUID batchId, Duration timeout) throws TimeoutException, InterruptedException;

    /**
     * Future completed with the batch results once it settles.
     */
    CompletableFuture<GraphResults> whenSettled(UUID batchId);

    /**
     * Cancel a batch. Tasks still needed by another active batch keep running.
     * 
     * @param batchId The batch ID
     * @throws com.taskgraph.core.exception.NotFoundException if the batch is unknown
     */
    void cancel(UUID batchId);

    /**
     * Get a snapshot of a batch.
     */
    Optional<Batch> getBatch(UUID batchId);

    /**
     * Snapshots of every batch of the run, in submission order.
     */
    List<Batch> getBatches();

    /**
     * Every result recorded during the run, in completion order.
     */
    GraphResults getResults();
}
