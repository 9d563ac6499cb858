package com.taskgraph.core.exception;

/**
 * Base exception for all task graph errors.
 * Every subclass carries a stable error code that callers and the REST layer can switch on.
 */
public class TaskGraphException extends RuntimeException {
    
    private final String errorCode;
    
    public TaskGraphException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public TaskGraphException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
