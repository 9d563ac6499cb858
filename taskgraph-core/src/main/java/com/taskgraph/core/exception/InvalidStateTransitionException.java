package com.taskgraph.core.exception;

import com.taskgraph.core.model.TaskState;

/**
 * Thrown when the solver attempts an illegal task state transition.
 * Seeing this means solver bookkeeping is broken, not that a task failed.
 */
public class InvalidStateTransitionException extends TaskGraphException {
    
    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";
    
    public InvalidStateTransitionException(String taskKey, TaskState currentState, TaskState targetState) {
        super(ERROR_CODE, String.format(
            "Cannot transition task %s from %s to %s",
            taskKey, currentState, targetState
        ));
    }
}
