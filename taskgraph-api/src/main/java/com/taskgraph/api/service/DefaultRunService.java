package com.taskgraph.api.service;

import com.taskgraph.actions.ActionCatalog;
import com.taskgraph.actions.ActionCatalog.TaskOptions;
import com.taskgraph.api.config.SolverConfigProperties;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.model.Batch;
import com.taskgraph.core.model.GraphResults;
import com.taskgraph.core.model.SolveOptions;
import com.taskgraph.core.task.Task;
import com.taskgraph.engine.lifecycle.GracefulShutdownHandler;
import com.taskgraph.engine.logging.LoggingContext;
import com.taskgraph.engine.metrics.SolverMetrics;
import com.taskgraph.engine.solver.GraphSolver;
import com.taskgraph.engine.solver.SolverProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Run service backed by one {@link GraphSolver} per run.
 *
 * <p>A solver is registered with the {@link GracefulShutdownHandler} while its batch runs and
 * closed on a separate thread once the batch settles. Closed solvers stay readable, so runs
 * can be inspected after they finish.</p>
 */
@Service
public class DefaultRunService implements RunService {

    private static final Logger log = LoggerFactory.getLogger(DefaultRunService.class);

    private final ActionCatalog catalog;
    private final SolverProperties solverProperties;
    private final SolverMetrics metrics;
    private final GracefulShutdownHandler shutdownHandler;
    private final Duration defaultDeadline;
    private final Clock clock;

    private final Map<UUID, RunRecord> runs = new ConcurrentHashMap<>();
    private final ExecutorService closer = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "taskgraph-run-closer");
        thread.setDaemon(true);
        return thread;
    });

    @Autowired
    public DefaultRunService(
            ActionCatalog catalog,
            SolverProperties solverProperties,
            SolverMetrics metrics,
            GracefulShutdownHandler shutdownHandler,
            SolverConfigProperties config) {
        this(catalog, solverProperties, metrics, shutdownHandler, config.getDefaultDeadline(), Clock.systemUTC());
    }

    DefaultRunService(
            ActionCatalog catalog,
            SolverProperties solverProperties,
            SolverMetrics metrics,
            GracefulShutdownHandler shutdownHandler,
            Duration defaultDeadline,
            Clock clock) {
        this.catalog = catalog;
        this.solverProperties = solverProperties;
        this.metrics = metrics;
        this.shutdownHandler = shutdownHandler;
        this.defaultDeadline = defaultDeadline;
        this.clock = clock;
    }

    @Override
    public RunSnapshot startRun(StartRunRequest request) {
        if (request.actions() == null || request.actions().isEmpty()) {
            throw new IllegalArgumentException("At least one action is required");
        }
        if (!shutdownHandler.canAcceptRuns()) {
            throw new IllegalStateException("Service is shutting down, not accepting new runs");
        }

        List<Task> tasks = catalog.createTasks(request.actions(),
            new TaskOptions(request.force(), request.forceBuild()));

        Duration deadline = request.deadline() != null ? request.deadline() : defaultDeadline;
        SolveOptions options = SolveOptions.defaults().withDeadline(deadline);

        GraphSolver solver = GraphSolver.builder()
            .properties(solverProperties)
            .metrics(metrics)
            .clock(clock)
            .build();

        try (LoggingContext ctx = LoggingContext.forRun(solver.getRunId())) {
            UUID batchId;
            try {
                shutdownHandler.register(solver);
                batchId = solver.submit(tasks, options);
            } catch (RuntimeException e) {
                log.warn("Run {} rejected: {}", solver.getRunId(), e.getMessage());
                release(solver);
                throw e;
            }

            RunRecord run = new RunRecord(solver, batchId, List.copyOf(request.actions()),
                request.force(), request.forceBuild(), clock.instant());
            runs.put(solver.getRunId(), run);

            solver.whenSettled(batchId).whenCompleteAsync((results, error) -> {
                if (error != null) {
                    log.warn("Run {} did not settle cleanly: {}", run.runId(), error.getMessage());
                } else {
                    log.info("Run {} settled: {} result(s), {} unsuccessful",
                        run.runId(), results.size(), results.failed().size());
                }
                release(solver);
            }, closer);

            log.info("Started run {} for actions {} (force={}, forceBuild={})",
                run.runId(), request.actions(), request.force(), request.forceBuild());
            return run.snapshot();
        }
    }

    @Override
    public RunSnapshot getRun(UUID runId) {
        return require(runId).snapshot();
    }

    @Override
    public GraphResults getResults(UUID runId) {
        return require(runId).solver().getResults();
    }

    @Override
    public RunSnapshot cancelRun(UUID runId) {
        RunRecord run = require(runId);
        if (run.solver().isClosed() || !run.batch().status().isActive()) {
            log.debug("Run {} already finished, nothing to cancel", runId);
            return run.snapshot();
        }
        try {
            run.solver().cancel(run.batchId());
            log.info("Cancelled run {}", runId);
        } catch (IllegalStateException e) {
            // closed between the check and the cancel
            log.debug("Run {} closed before it could be cancelled: {}", runId, e.getMessage());
        }
        return run.snapshot();
    }

    @Override
    public List<RunSnapshot> listRuns() {
        return runs.values().stream()
            .map(RunRecord::snapshot)
            .sorted(Comparator.comparing(RunSnapshot::submittedAt))
            .toList();
    }

    @PreDestroy
    public void stop() {
        closer.shutdown();
    }

    private RunRecord require(UUID runId) {
        RunRecord run = runs.get(runId);
        if (run == null) {
            throw new NotFoundException("Run", runId.toString());
        }
        return run;
    }

    private void release(GraphSolver solver) {
        shutdownHandler.unregister(solver.getRunId());
        solver.close();
    }

    private record RunRecord(
        GraphSolver solver,
        UUID batchId,
        List<String> actions,
        boolean force,
        boolean forceBuild,
        Instant submittedAt
    ) {
        UUID runId() {
            return solver.getRunId();
        }

        Batch batch() {
            return solver.getBatch(batchId)
                .orElseThrow(() -> new NotFoundException("Batch", batchId.toString()));
        }

        RunSnapshot snapshot() {
            return new RunSnapshot(runId(), actions, force, forceBuild, submittedAt, batch());
        }
    }
}
