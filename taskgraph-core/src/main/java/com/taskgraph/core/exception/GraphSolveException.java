package com.taskgraph.core.exception;

import com.taskgraph.core.model.GraphResult;
import com.taskgraph.core.model.GraphResults;

import java.util.stream.Collectors;

/**
 * Raised by a solve call with {@code throwOnError} when any task failed or was cancelled.
 * The cause is the earliest recorded error; the complete result set stays available.
 */
public class GraphSolveException extends TaskGraphException {
    
    public static final String ERROR_CODE = "GRAPH_FAILED";
    
    private final transient GraphResults results;
    
    public GraphSolveException(GraphResults results, GraphResult firstFailure) {
        super(ERROR_CODE, String.format(
            "%d task(s) failed or were cancelled [%s]; first error from %s: %s",
            results.failed().size(),
            results.failed().stream().map(GraphResult::key).collect(Collectors.joining(", ")),
            firstFailure.key(),
            firstFailure.error().getMessage()
        ), firstFailure.error());
        this.results = results;
    }
    
    public GraphResults getResults() {
        return results;
    }
    
    public TaskGraphException getFirstError() {
        return (TaskGraphException) getCause();
    }
}
