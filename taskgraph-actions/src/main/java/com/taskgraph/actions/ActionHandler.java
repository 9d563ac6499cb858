package com.taskgraph.actions;

import com.taskgraph.core.model.TaskStatus;

/**
 * Status check or processing logic of an action.
 * Implementations decide how an action computes its result; the solver decides when.
 */
@FunctionalInterface
public interface ActionHandler {

    /**
     * Run the handler.
     *
     * @param context dependency outputs, cancellation and JSON helpers
     * @return the resulting status
     * @throws ActionException for expected failures; any other exception is recorded as a crash
     */
    TaskStatus handle(ActionContext context) throws Exception;
}
