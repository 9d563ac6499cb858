package com.taskgraph.engine.solver;

import com.taskgraph.core.model.Batch;
import com.taskgraph.core.model.BatchStatus;
import com.taskgraph.core.model.GraphResult;
import com.taskgraph.core.model.GraphResults;
import com.taskgraph.core.model.SolveOptions;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Mutable state of one batch. Mutated from the solver loop, snapshotted from any thread.
 *
 * Invariants:
 * - remaining is a subset of tracked
 * - a key leaves remaining once its result is recorded or the batch releases it
 * - the settled future completes exactly once, after remaining became empty
 */
public final class BatchState {

    private final UUID batchId;
    private final List<String> rootKeys;
    private final SolveOptions options;
    private final Instant startedAt;

    private final Set<String> tracked = new LinkedHashSet<>();
    private final Set<String> remaining = new LinkedHashSet<>();
    private final Map<String, GraphResult> results = new LinkedHashMap<>();
    private final CompletableFuture<GraphResults> settled = new CompletableFuture<>();

    private BatchStatus status = BatchStatus.RUNNING;
    private Instant settledAt;

    BatchState(UUID batchId, List<String> rootKeys, SolveOptions options, Instant startedAt) {
        this.batchId = batchId;
        this.rootKeys = List.copyOf(rootKeys);
        this.options = options;
        this.startedAt = startedAt;
    }

    public UUID batchId() {
        return batchId;
    }

    public List<String> rootKeys() {
        return rootKeys;
    }

    public SolveOptions options() {
        return options;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public synchronized BatchStatus status() {
        return status;
    }

    /**
     * Still accepting and running work: neither settled nor cancelled.
     */
    public synchronized boolean isActive() {
        return status.isActive() && settledAt == null;
    }

    public synchronized boolean isSettled() {
        return settledAt != null;
    }

    CompletableFuture<GraphResults> settledFuture() {
        return settled;
    }

    synchronized boolean track(String key) {
        if (!tracked.add(key)) {
            return false;
        }
        remaining.add(key);
        return true;
    }

    synchronized boolean isWaitingFor(String key) {
        return remaining.contains(key);
    }

    synchronized void record(GraphResult result) {
        if (remaining.remove(result.key())) {
            results.put(result.key(), result);
        }
    }

    synchronized void release(String key) {
        remaining.remove(key);
    }

    synchronized List<String> remainingKeys() {
        return new ArrayList<>(remaining);
    }

    synchronized void markCancelled() {
        status = BatchStatus.CANCELLED;
    }

    synchronized boolean readyToSettle() {
        return settledAt == null && remaining.isEmpty();
    }

    synchronized GraphResults markSettled(Instant now) {
        settledAt = now;
        if (status == BatchStatus.RUNNING) {
            status = BatchStatus.SETTLED;
        }
        return results();
    }

    /**
     * Results recorded for this batch so far, in the order the batch first needed them.
     */
    public synchronized GraphResults results() {
        List<GraphResult> ordered = new ArrayList<>();
        for (String key : tracked) {
            GraphResult result = results.get(key);
            if (result != null) {
                ordered.add(result);
            }
        }
        return GraphResults.of(ordered);
    }

    public synchronized Batch snapshot() {
        return new Batch(
            batchId,
            rootKeys,
            status,
            tracked.size(),
            remaining.size(),
            startedAt,
            settledAt
        );
    }
}
