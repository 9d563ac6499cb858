package com.taskgraph.core.exception;

import java.time.Duration;
import java.util.UUID;

/**
 * Batch cancellation triggered by the caller-supplied deadline.
 */
public class DeadlineExceededException extends BatchCancelledException {
    
    public static final String ERROR_CODE = "DEADLINE_EXCEEDED";
    
    public DeadlineExceededException(UUID batchId, Duration deadline) {
        super(ERROR_CODE, batchId, "deadline of " + deadline + " exceeded");
    }
}
