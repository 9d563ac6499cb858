package com.taskgraph.core.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Snapshot of a batch: the root tasks submitted together under one id.
 * Batches group submissions for reporting and cancellation; they never affect ordering.
 */
public record Batch(
    UUID batchId,
    List<String> rootKeys,
    BatchStatus status,
    int trackedTasks,
    int remainingTasks,
    Instant startedAt,
    Instant settledAt
) {
    public boolean isSettled() {
        return settledAt != null;
    }
}
