package com.taskgraph.core.exception;

/**
 * Thrown from inside a task body when its cancellation token has been signalled.
 * The solver records the token's reason on the result, not this exception.
 */
public class TaskCancelledException extends TaskGraphException {
    
    public static final String ERROR_CODE = "TASK_CANCELLED";
    
    public TaskCancelledException(TaskGraphException reason) {
        super(ERROR_CODE, "Task cancelled: " + reason.getMessage(), reason);
    }
}
