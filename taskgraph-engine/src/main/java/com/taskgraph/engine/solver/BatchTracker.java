package com.taskgraph.engine.solver;

import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.model.Batch;
import com.taskgraph.core.model.GraphResult;
import com.taskgraph.core.model.GraphResults;
import com.taskgraph.core.model.SolveOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bookkeeping for batches of submitted root tasks.
 *
 * <p>Every task key a batch needs is attached to it, and each key keeps the set of batches that
 * reference it. Cancelling a batch only gives up keys that no other active batch references, so
 * a shared in-flight task keeps running for the batches that still need it.</p>
 *
 * <p>Mutations happen on the solver loop. Lookups and waits are safe from any thread.</p>
 */
public class BatchTracker {

    private static final Logger log = LoggerFactory.getLogger(BatchTracker.class);

    private final Map<UUID, BatchState> batches = new ConcurrentHashMap<>();
    private final Map<String, Set<UUID>> references = new HashMap<>();

    /**
     * Register a new batch.
     * 
     * @param rootKeys Root task keys of the batch
     * @param options Options the batch was submitted with
     * @param startedAt Submission time
     * @return The batch state
     */
    public BatchState startBatch(List<String> rootKeys, SolveOptions options, Instant startedAt) {
        BatchState batch = new BatchState(UUID.randomUUID(), rootKeys, options, startedAt);
        batches.put(batch.batchId(), batch);
        log.debug("Started batch {} with roots {}", batch.batchId(), rootKeys);
        return batch;
    }

    public Optional<BatchState> get(UUID batchId) {
        return Optional.ofNullable(batches.get(batchId));
    }

    public BatchState require(UUID batchId) {
        return get(batchId).orElseThrow(() -> new NotFoundException("Batch", String.valueOf(batchId)));
    }

    /**
     * Attach a task key to a batch.
     * 
     * @return true if the key was not attached to the batch before
     */
    public boolean attach(UUID batchId, String key) {
        BatchState batch = require(batchId);
        if (!batch.track(key)) {
            return false;
        }
        references.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(batchId);
        return true;
    }

    /**
     * Number of active batches referencing a key.
     */
    public int referenceCount(String key) {
        Set<UUID> refs = references.get(key);
        return refs == null ? 0 : refs.size();
    }

    /**
     * Active batches referencing a key, in attach order.
     */
    public List<BatchState> batchesFor(String key) {
        Set<UUID> refs = references.get(key);
        if (refs == null) {
            return List.of();
        }
        return refs.stream().map(batches::get).toList();
    }

    /**
     * Hand a terminal result to every batch still waiting for it.
     */
    public void record(GraphResult result) {
        for (BatchState batch : batches.values()) {
            if (batch.isWaitingFor(result.key())) {
                batch.record(result);
            }
        }
        references.remove(result.key());
    }

    /**
     * Cancel a batch and detach it from every key.
     * Keys still referenced by other batches are released from this batch.
     * 
     * @param batchId The batch to cancel
     * @return Keys the batch was waiting for that no other batch references
     */
    public List<String> cancel(UUID batchId) {
        BatchState batch = require(batchId);
        batch.markCancelled();

        List<String> orphaned = new ArrayList<>();
        for (String key : batch.remainingKeys()) {
            Set<UUID> refs = references.get(key);
            if (refs != null) {
                refs.remove(batchId);
            }
            if (refs == null || refs.isEmpty()) {
                references.remove(key);
                orphaned.add(key);
            } else {
                batch.release(key);
            }
        }
        log.debug("Cancelled batch {}: {} orphaned key(s)", batchId, orphaned.size());
        return orphaned;
    }

    /**
     * Mark every batch with nothing left to wait for as settled.
     * 
     * @param now Settle time
     * @return Newly settled batches, in start order
     */
    public List<BatchState> collectSettled(Instant now) {
        List<BatchState> settled = new ArrayList<>();
        for (BatchState batch : batches.values()) {
            if (batch.readyToSettle()) {
                batch.markSettled(now);
                settled.add(batch);
            }
        }
        settled.sort(Comparator.comparing(BatchState::startedAt));
        return settled;
    }

    /**
     * Active (not settled, not cancelled) batches.
     */
    public List<BatchState> active() {
        return batches.values().stream().filter(BatchState::isActive).toList();
    }

    public List<Batch> snapshots() {
        return batches.values().stream()
            .map(BatchState::snapshot)
            .sorted(Comparator.comparing(Batch::startedAt))
            .toList();
    }

    /**
     * Block until a batch has settled.
     */
    public GraphResults waitUntilSettled(UUID batchId) {
        return require(batchId).settledFuture().join();
    }

    /**
     * Block until a batch has settled or the timeout elapses.
     */
    public GraphResults waitUntilSettled(UUID batchId, Duration timeout) throws TimeoutException, InterruptedException {
        try {
            return require(batchId).settledFuture().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Batch " + batchId + " completed exceptionally", e.getCause());
        }
    }
}
