package com.taskgraph.api.service;

import com.taskgraph.core.model.Batch;
import com.taskgraph.core.model.GraphResults;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Starts and tracks runs: one solver per run, solving the requested catalog actions.
 */
public interface RunService {

    /**
     * Start a run.
     *
     * @param request the actions to solve and how
     * @return the run as submitted
     * @throws com.taskgraph.core.exception.NotFoundException if an action is unknown
     * @throws com.taskgraph.core.exception.CircularDependencyException if the actions form a cycle
     * @throws IllegalStateException if the service is shutting down
     */
    RunSnapshot startRun(StartRunRequest request);

    /**
     * Get a run by ID.
     *
     * @throws com.taskgraph.core.exception.NotFoundException if no such run exists
     */
    RunSnapshot getRun(UUID runId);

    /**
     * Results recorded so far. Complete once the run has settled.
     */
    GraphResults getResults(UUID runId);

    /**
     * Cancel a run. Settled runs are left as they are.
     */
    RunSnapshot cancelRun(UUID runId);

    List<RunSnapshot> listRuns();

    /**
     * Request to start a run.
     */
    record StartRunRequest(
        List<String> actions,
        boolean force,
        boolean forceBuild,
        Duration deadline
    ) {}

    /**
     * Point-in-time view of a run.
     */
    record RunSnapshot(
        UUID runId,
        List<String> actions,
        boolean force,
        boolean forceBuild,
        Instant submittedAt,
        Batch batch
    ) {}
}
