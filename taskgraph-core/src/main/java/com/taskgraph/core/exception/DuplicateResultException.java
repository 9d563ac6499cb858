package com.taskgraph.core.exception;

/**
 * Thrown when a second result is written for a task key within the same run.
 */
public class DuplicateResultException extends TaskGraphException {
    
    public static final String ERROR_CODE = "DUPLICATE_RESULT";
    
    private final String taskKey;
    
    public DuplicateResultException(String taskKey) {
        super(ERROR_CODE, String.format(
            "A result has already been recorded for task '%s'",
            taskKey
        ));
        this.taskKey = taskKey;
    }
    
    public String getTaskKey() {
        return taskKey;
    }
}
