package com.taskgraph.engine.solver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Fires a callback when a batch outlives its deadline.
 */
class DeadlineWatcher {

    private static final Logger log = LoggerFactory.getLogger(DeadlineWatcher.class);

    private final ScheduledExecutorService scheduler;
    private final Map<UUID, ScheduledFuture<?>> deadlines = new ConcurrentHashMap<>();

    DeadlineWatcher(String threadName) {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Schedule the expiry callback for a batch.
     */
    void schedule(UUID batchId, Duration deadline, Runnable onExpired) {
        ScheduledFuture<?> future = scheduler.schedule(() -> {
            deadlines.remove(batchId);
            log.info("Deadline of {} reached for batch {}", deadline, batchId);
            onExpired.run();
        }, deadline.toMillis(), TimeUnit.MILLISECONDS);
        deadlines.put(batchId, future);
    }

    /**
     * Drop the deadline of a batch that settled or was cancelled.
     */
    void cancel(UUID batchId) {
        ScheduledFuture<?> future = deadlines.remove(batchId);
        if (future != null) {
            future.cancel(false);
        }
    }

    int pending() {
        return deadlines.size();
    }

    void stop() {
        deadlines.values().forEach(f -> f.cancel(false));
        deadlines.clear();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
