package com.taskgraph.core.exception;

/**
 * Thrown when a task is malformed (missing identity, null dependency entries, unknown references).
 */
public class TaskDefinitionException extends TaskGraphException {
    
    public static final String ERROR_CODE = "INVALID_TASK";
    
    private final String taskKey;
    
    public TaskDefinitionException(String taskKey, String reason) {
        super(ERROR_CODE, String.format(
            "Invalid task %s: %s",
            taskKey, reason
        ));
        this.taskKey = taskKey;
    }
    
    public String getTaskKey() {
        return taskKey;
    }
}
