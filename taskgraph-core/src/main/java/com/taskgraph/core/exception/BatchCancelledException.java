package com.taskgraph.core.exception;

import java.util.UUID;

/**
 * Recorded on tasks cancelled because the batch that requested them was cancelled.
 */
public class BatchCancelledException extends TaskGraphException {
    
    public static final String ERROR_CODE = "BATCH_CANCELLED";
    
    private final UUID batchId;
    
    public BatchCancelledException(UUID batchId, String reason) {
        this(ERROR_CODE, batchId, reason);
    }
    
    protected BatchCancelledException(String errorCode, UUID batchId, String reason) {
        super(errorCode, String.format(
            "Batch %s cancelled: %s",
            batchId, reason
        ));
        this.batchId = batchId;
    }
    
    public UUID getBatchId() {
        return batchId;
    }
}
