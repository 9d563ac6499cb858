package com.taskgraph.core.exception;

/**
 * Thrown when a batch, run or action is not found.
 */
public class NotFoundException extends TaskGraphException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
