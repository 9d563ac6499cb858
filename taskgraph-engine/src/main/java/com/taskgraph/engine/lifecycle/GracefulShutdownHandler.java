package com.taskgraph.engine.lifecycle;

import com.taskgraph.engine.solver.GraphSolver;
import com.taskgraph.engine.solver.SolverProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Manages graceful shutdown of solver runs.
 *
 * On shutdown:
 * 1. Stops accepting new runs
 * 2. Waits for active batches to settle (with timeout)
 * 3. Closes every registered solver, cancelling whatever is still running
 */
@Component
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);
    private static final long POLL_INTERVAL_MS = 200;

    private final Duration shutdownTimeout;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final Map<UUID, GraphSolver> solvers = new ConcurrentHashMap<>();
    // Guards registration against the start of shutdown
    private final Object registrationLock = new Object();

    public GracefulShutdownHandler(SolverProperties properties) {
        this.shutdownTimeout = properties.shutdownTimeout();
    }

    /**
     * Check if shutdown is in progress.
     */
    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Check if new runs can be started.
     */
    public boolean canAcceptRuns() {
        return !shuttingDown.get();
    }

    /**
     * Register a solver so it is closed on shutdown.
     *
     * @throws IllegalStateException if shutdown already started
     */
    public void register(GraphSolver solver) {
        synchronized (registrationLock) {
            if (shuttingDown.get()) {
                throw new IllegalStateException("Cannot accept new runs during shutdown");
            }
            solvers.put(solver.getRunId(), solver);
        }
        log.debug("Registered solver run: {}", solver.getRunId());
    }

    /**
     * Unregister a solver that was closed by its owner.
     */
    public void unregister(UUID runId) {
        solvers.remove(runId);
        log.debug("Unregistered solver run: {}", runId);
    }

    public int getActiveRunCount() {
        return (int) solvers.values().stream().filter(GraphSolver::hasActiveBatches).count();
    }

    public int getRegisteredRunCount() {
        return solvers.size();
    }

    /**
     * Handle application shutdown event.
     * This runs before Spring context is fully closed.
     */
    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown(ContextClosedEvent event) {
        shutdown();
    }

    /**
     * Stop accepting runs, wait for active batches, then close all solvers.
     */
    public void shutdown() {
        synchronized (registrationLock) {
            if (!shuttingDown.compareAndSet(false, true)) {
                return;
            }
        }
        log.info("Initiating graceful shutdown of {} solver run(s)", solvers.size());

        waitForActiveBatches();
        closeSolvers();

        log.info("Graceful shutdown complete");
    }

    private void waitForActiveBatches() {
        if (getActiveRunCount() == 0) {
            log.info("No active batches to wait for");
            return;
        }

        log.info("Waiting for {} run(s) with active batches (timeout: {})", getActiveRunCount(), shutdownTimeout);

        long deadline = System.currentTimeMillis() + shutdownTimeout.toMillis();
        while (getActiveRunCount() > 0 && System.currentTimeMillis() < deadline) {
            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for batches to settle");
                break;
            }
        }

        int remaining = getActiveRunCount();
        if (remaining > 0) {
            log.warn("Shutdown timeout reached with {} run(s) still active, cancelling them", remaining);
        } else {
            log.info("All active batches settled");
        }
    }

    private void closeSolvers() {
        int closed = 0;
        int failed = 0;
        for (GraphSolver solver : solvers.values()) {
            try {
                solver.close();
                closed++;
            } catch (RuntimeException e) {
                log.error("Failed to close solver run {}: {}", solver.getRunId(), e.getMessage(), e);
                failed++;
            }
        }
        solvers.clear();
        log.info("Closed {} solver run(s) ({} failed)", closed, failed);
    }
}
