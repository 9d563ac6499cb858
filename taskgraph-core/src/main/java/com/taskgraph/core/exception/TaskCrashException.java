package com.taskgraph.core.exception;

/**
 * Wraps an unexpected failure (a programming fault, an unchecked library error)
 * raised inside a task's status check or processing.
 */
public class TaskCrashException extends TaskGraphException {
    
    public static final String ERROR_CODE = "INTERNAL";
    
    private final String taskKey;
    
    public TaskCrashException(String taskKey, String phase, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Internal error while %s task %s: %s",
            phase, taskKey, cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName()
        ), cause);
        this.taskKey = taskKey;
    }
    
    public String getTaskKey() {
        return taskKey;
    }
}
