package com.taskgraph.core.task;

import com.taskgraph.core.model.GraphResult;
import com.taskgraph.core.model.GraphResults;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Context provided to a task's status check or processing.
 *
 * <p>Dependency results are restricted to the task's own declared dependencies and status
 * dependencies, and only contain the ones that succeeded. A status dependency that failed is
 * simply absent. The results are read-only.</p>
 */
public class TaskContext {
    
    private final UUID runId;
    private final Task task;
    private final SolvePhase phase;
    private final GraphResults dependencyResults;
    private final CancellationToken cancellationToken;
    
    public TaskContext(
            UUID runId,
            Task task,
            SolvePhase phase,
            GraphResults dependencyResults,
            CancellationToken cancellationToken) {
        this.runId = runId;
        this.task = task;
        this.phase = phase;
        this.dependencyResults = dependencyResults;
        this.cancellationToken = cancellationToken;
    }
    
    /**
     * Get the solver run this invocation belongs to.
     */
    public UUID getRunId() {
        return runId;
    }
    
    public Task getTask() {
        return task;
    }
    
    public String getKey() {
        return task.getKey();
    }
    
    public SolvePhase getPhase() {
        return phase;
    }
    
    public GraphResults getDependencyResults() {
        return dependencyResults;
    }
    
    /**
     * Get the result of a dependency, if it has one.
     */
    public Optional<GraphResult> getDependencyResult(Task dependency) {
        return dependencyResults.getResult(dependency);
    }
    
    /**
     * Get the result of a dependency by key, if it has one.
     */
    public Optional<GraphResult> getDependencyResult(String key) {
        return dependencyResults.get(key);
    }
    
    /**
     * Get the outputs of a dependency, empty if it has no result.
     */
    public Map<String, Object> getDependencyOutputs(Task dependency) {
        return getDependencyResult(dependency)
            .map(GraphResult::outputs)
            .orElse(Map.of());
    }
    
    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }
    
    public boolean isCancelled() {
        return cancellationToken.isCancelled();
    }
    
    /**
     * Abort the invocation if the solver cancelled it.
     */
    public void throwIfCancelled() {
        cancellationToken.throwIfCancelled();
    }
}
