package com.taskgraph.core.exception;

/**
 * Structured failure deliberately raised by a task implementation.
 * The solver records it on the task's result as-is, without wrapping.
 */
public class TaskFailureException extends TaskGraphException {
    
    public static final String ERROR_CODE = "TASK_FAILED";
    public static final String NOT_READY_CODE = "TASK_NOT_READY";
    
    public TaskFailureException(String message) {
        super(ERROR_CODE, message);
    }
    
    public TaskFailureException(String errorCode, String message) {
        super(errorCode, message);
    }
    
    public TaskFailureException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
