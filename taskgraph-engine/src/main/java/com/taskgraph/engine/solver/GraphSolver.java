package com.taskgraph.engine.solver;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskgraph.core.exception.BatchCancelledException;
import com.taskgraph.core.exception.CircularDependencyException;
import com.taskgraph.core.exception.DeadlineExceededException;
import com.taskgraph.core.exception.GraphSolveException;
import com.taskgraph.core.exception.TaskCascadeException;
import com.taskgraph.core.exception.TaskCrashException;
import com.taskgraph.core.exception.TaskFailureException;
import com.taskgraph.core.exception.TaskGraphException;
import com.taskgraph.core.model.Batch;
import com.taskgraph.core.model.GraphResult;
import com.taskgraph.core.model.GraphResults;
import com.taskgraph.core.model.SolveOptions;
import com.taskgraph.core.model.SolverEvent;
import com.taskgraph.core.model.SolverEventType;
import com.taskgraph.core.model.TaskState;
import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.core.repository.EventLog;
import com.taskgraph.core.repository.ResultStore;
import com.taskgraph.core.task.SolvePhase;
import com.taskgraph.core.task.Task;
import com.taskgraph.core.task.TaskContext;
import com.taskgraph.engine.logging.LoggingContext;
import com.taskgraph.engine.metrics.SolverMetrics;
import com.taskgraph.engine.persistence.InMemoryEventLog;
import com.taskgraph.engine.persistence.InMemoryResultStore;
import com.taskgraph.engine.resolver.DependencyResolver;
import com.taskgraph.engine.resolver.ResolvedGraph;
import com.taskgraph.engine.service.SolverService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Concurrency-bounded, cache-aware executor of task dependency graphs.
 *
 * <p>One instance is one run: it owns the result store, the per-key state and the concurrency
 * counters, and every key gets at most one result during its lifetime. All bookkeeping happens
 * on a single loop thread, so state transitions, readiness checks and result writes never
 * interleave. Task bodies run on a worker pool; admission keeps at most
 * {@link SolverProperties#concurrency()} of them (and at most the per-type limit) running.</p>
 *
 * <p>Scheduling rules per key:</p>
 * <ul>
 *   <li>A requested task waits for its status dependencies, and for those of its dependencies
 *       that are already requested, to finish; then its status is checked.</li>
 *   <li>A READY status completes the task without processing and without touching its
 *       dependencies. Otherwise, or when the task is forced, its dependencies are requested and
 *       it is processed once all of them are done.</li>
 *   <li>A failed dependency cancels every dependent, transitively, without invoking it.</li>
 * </ul>
 *
 * <p>Usage:</p>
 * <pre>{@code
 * try (GraphSolver solver = GraphSolver.builder().properties(SolverProperties.withConcurrency(4)).build()) {
 *     GraphResults results = solver.solve(List.of(deployApi), SolveOptions.defaults().withThrowOnError(true));
 * }
 * }</pre>
 */
public class GraphSolver implements SolverService, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GraphSolver.class);

    private static final Comparator<TaskNode> READY_ORDER = Comparator
        .comparingLong((TaskNode n) -> n.readyWave)
        .thenComparingLong(n -> n.sequence);

    private static final Comparator<TaskNode> DEPENDENTS_FIRST = Comparator
        .comparingInt((TaskNode n) -> n.depth).reversed()
        .thenComparing(Comparator.comparingLong((TaskNode n) -> n.sequence).reversed());

    private final UUID runId;
    private final SolverProperties properties;
    private final ResultStore resultStore;
    private final EventLog eventLog;
    private final SolverMetrics metrics;
    private final Clock clock;

    private final DependencyResolver resolver = new DependencyResolver();
    private final BatchTracker batchTracker = new BatchTracker();
    private final DeadlineWatcher deadlineWatcher;
    private final ExecutorService loop;
    private final ExecutorService workers;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Thread loopThread;

    // Owned by the loop thread
    private final Map<String, TaskNode> nodes = new LinkedHashMap<>();
    private final List<TaskNode> readyQueue = new ArrayList<>();
    private final Map<String, Integer> inProgressByType = new HashMap<>();
    private int inProgress;
    private long wave;
    private long nodeSequence;
    private long resultSequence;
    private long eventSequence;
    private boolean busy;

    private GraphSolver(Builder builder) {
        this.runId = UUID.randomUUID();
        this.properties = builder.properties != null ? builder.properties : SolverProperties.defaults();
        this.resultStore = builder.resultStore != null ? builder.resultStore : new InMemoryResultStore();
        this.eventLog = builder.eventLog != null ? builder.eventLog : new InMemoryEventLog();
        this.metrics = builder.metrics != null ? builder.metrics : SolverMetrics.standalone();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

        String suffix = runId.toString().substring(0, 8);
        this.loop = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "taskgraph-solver-" + suffix);
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        });
        AtomicInteger workerCount = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "taskgraph-worker-" + suffix + "-" + workerCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.deadlineWatcher = new DeadlineWatcher("taskgraph-deadlines-" + suffix);

        log.info("Created solver run {} (concurrency={}, type limits={})",
            runId, properties.concurrency(), properties.typeConcurrencyLimits());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Solver with default properties and in-memory stores.
     */
    public static GraphSolver create() {
        return builder().build();
    }

    // ========== Public API ==========

    @Override
    public GraphResults solve(List<? extends Task> tasks, SolveOptions options) {
        UUID batchId = submit(tasks, options);
        GraphResults results = waitUntilSettled(batchId);

        if (options.throwOnError()) {
            Optional<GraphResult> firstFailure = results.firstFailure();
            if (firstFailure.isPresent()) {
                throw new GraphSolveException(results, firstFailure.get());
            }
        }
        return results;
    }

    /**
     * Solve a single task and return its result.
     */
    public GraphResult solveOne(Task task, SolveOptions options) {
        GraphResults results = solve(List.of(task), options);
        return results.get(task.getKey())
            .orElseThrow(() -> new IllegalStateException("No result recorded for " + task.getKey()));
    }

    @Override
    public UUID submit(List<? extends Task> tasks, SolveOptions options) {
        List<Task> roots = new ArrayList<>(tasks);
        SolveOptions effective = options != null ? options : SolveOptions.defaults();
        return onLoop(() -> submitBatch(roots, effective));
    }

    @Override
    public GraphResults waitUntilSettled(UUID batchId) {
        return batchTracker.waitUntilSettled(batchId);
    }

    @Override
    public GraphResults waitUntilSettled(UUID batchId, Duration timeout) throws TimeoutException, InterruptedException {
        return batchTracker.waitUntilSettled(batchId, timeout);
    }

    @Override
    public CompletableFuture<GraphResults> whenSettled(UUID batchId) {
        return batchTracker.require(batchId).settledFuture().copy();
    }

    @Override
    public void cancel(UUID batchId) {
        batchTracker.require(batchId);
        onLoop(() -> {
            cancelBatch(batchId, new BatchCancelledException(batchId, "cancelled by caller"));
            return null;
        });
    }

    @Override
    public Optional<Batch> getBatch(UUID batchId) {
        return batchTracker.get(batchId).map(BatchState::snapshot);
    }

    @Override
    public List<Batch> getBatches() {
        return batchTracker.snapshots();
    }

    @Override
    public GraphResults getResults() {
        return GraphResults.of(resultStore.getAll().values());
    }

    public UUID getRunId() {
        return runId;
    }

    public SolverProperties getProperties() {
        return properties;
    }

    public ResultStore getResultStore() {
        return resultStore;
    }

    public EventLog getEventLog() {
        return eventLog;
    }

    /**
     * Check if any batch of this run is still running.
     */
    public boolean hasActiveBatches() {
        return !batchTracker.active().isEmpty();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Cancel every active batch, then stop the worker pool and the loop.
     * Running tasks get their cancellation signalled and up to the shutdown timeout to return.
     */
    @Override
    public void close() {
        if (Thread.currentThread() == loopThread) {
            throw new IllegalStateException("Solver run " + runId + " cannot be closed from its own loop thread");
        }
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        log.info("Closing solver run {}", runId);
        try {
            CompletableFuture.runAsync(() -> {
                for (BatchState batch : batchTracker.active()) {
                    cancelBatch(batch.batchId(), new BatchCancelledException(batch.batchId(), "solver closed"));
                }
            }, loop).join();
        } catch (CompletionException | RejectedExecutionException e) {
            log.warn("Failed to cancel active batches of run {}: {}", runId, e.getMessage());
        }

        deadlineWatcher.stop();
        shutdown(workers, properties.shutdownTimeout());
        shutdown(loop, properties.shutdownTimeout());
        log.info("Solver run {} closed with {} result(s)", runId, resultStore.size());
    }

    // ========== Submission ==========

    private UUID submitBatch(List<Task> roots, SolveOptions options) {
        wave++;

        ResolvedGraph graph;
        try {
            graph = resolver.resolve(roots);
        } catch (CircularDependencyException e) {
            metrics.cycleDetected();
            throw e;
        }
        registerNodes(graph);

        BatchState batch = batchTracker.startBatch(graph.rootKeys(), options, clock.instant());
        metrics.batchStarted();

        try (LoggingContext ignored = LoggingContext.forBatch(runId, batch.batchId())) {
            log.info("Batch {} submitted: roots={}, closure={} task(s)",
                batch.batchId(), graph.rootKeys(), graph.size());

            ObjectNode payload = payload();
            ArrayNode rootArray = payload.putArray("roots");
            graph.rootKeys().forEach(rootArray::add);
            payload.put("closureSize", graph.size());
            if (options.hasDeadline()) {
                payload.put("deadline", options.deadline().toString());
            }
            emit(SolverEventType.BATCH_STARTED, batch.batchId(), null, payload);

            for (String key : graph.rootKeys()) {
                request(nodes.get(key), batch);
            }

            if (options.hasDeadline()) {
                UUID batchId = batch.batchId();
                Duration deadline = options.deadline();
                deadlineWatcher.schedule(batchId, deadline, () -> onDeadline(batchId, deadline));
            }
        }

        afterStep();
        return batch.batchId();
    }

    private void registerNodes(ResolvedGraph graph) {
        List<TaskNode> added = new ArrayList<>();
        for (Task task : graph.tasks()) {
            if (!nodes.containsKey(task.getKey())) {
                TaskNode node = new TaskNode(task, nodeSequence++);
                nodes.put(node.key, node);
                added.add(node);
            }
        }

        // graph.tasks() lists dependencies first, so their depth is already known
        for (TaskNode node : added) {
            for (String key : graph.dependenciesOf(node.key)) {
                TaskNode dependency = nodes.get(key);
                node.dependencies.add(dependency);
                dependency.dependents.add(node);
                node.depth = Math.max(node.depth, dependency.depth + 1);
            }
            for (String key : graph.statusDependenciesOf(node.key)) {
                TaskNode dependency = nodes.get(key);
                node.statusDependencies.add(dependency);
                dependency.statusDependents.add(node);
                node.depth = Math.max(node.depth, dependency.depth + 1);
            }
        }
    }

    /**
     * Mark a node as needed by a batch, along with whatever it needs right now.
     */
    private void request(TaskNode node, BatchState batch) {
        if (!batchTracker.attach(batch.batchId(), node.key)) {
            return;
        }
        if (node.isTerminal()) {
            // Already settled earlier in the run
            batchTracker.record(node.result);
            return;
        }
        if (batch.options().unlimitedConcurrency()) {
            node.unlimitedConcurrency = true;
        }
        if (!node.requested) {
            node.requested = true;
            if (node.task.isForce()) {
                node.processRequired = true;
            }
            emit(SolverEventType.TASK_PENDING, batch.batchId(), node.key, taskPayload(node));
        }

        for (TaskNode statusDependency : node.statusDependencies) {
            request(statusDependency, batch);
        }
        if (node.processRequired) {
            for (TaskNode dependency : node.dependencies) {
                request(dependency, batch);
            }
        }
        evaluate(node);
    }

    // ========== Readiness ==========

    private void evaluate(TaskNode node) {
        if (!node.requested || node.isTerminal()) {
            return;
        }

        TaskNode blocking = blockingDependency(node);
        if (blocking != null) {
            cancelNode(node, TaskCascadeException.of(node.key, blocking.key, blocking.result.error()));
            return;
        }
        if (node.isActive() || node.queued) {
            return;
        }
        if (!node.statusDependencies.stream().allMatch(TaskNode::isTerminal)) {
            return;
        }

        if (node.state == TaskState.PENDING && !node.processRequired) {
            boolean requestedDependenciesSettled = node.dependencies.stream()
                .filter(d -> d.requested)
                .allMatch(TaskNode::isTerminal);
            if (requestedDependenciesSettled) {
                enqueue(node, SolvePhase.STATUS);
            }
            return;
        }

        if (node.state == TaskState.PENDING) {
            node.transition(TaskState.AWAITING_DEPENDENCIES);
        }
        if (node.dependencies.stream().allMatch(TaskNode::isSuccessful)) {
            enqueue(node, SolvePhase.PROCESS);
        }
    }

    /**
     * First dependency whose outcome rules the node out.
     * A dependency dropped by another batch's cancellation only matters once processing is required.
     */
    private TaskNode blockingDependency(TaskNode node) {
        for (TaskNode dependency : node.dependencies) {
            if (!dependency.isUnsuccessful()) {
                continue;
            }
            boolean droppedByBatch = dependency.result.error() instanceof BatchCancelledException;
            if (node.processRequired || !droppedByBatch) {
                return dependency;
            }
        }
        return null;
    }

    private void enqueue(TaskNode node, SolvePhase phase) {
        node.queued = true;
        node.queuedPhase = phase;
        node.readyWave = wave;
        readyQueue.add(node);
    }

    // ========== Admission ==========

    private void schedule() {
        if (readyQueue.isEmpty()) {
            return;
        }
        readyQueue.sort(READY_ORDER);

        Iterator<TaskNode> iterator = readyQueue.iterator();
        while (iterator.hasNext()) {
            TaskNode node = iterator.next();
            if (!node.unlimitedConcurrency && inProgress >= properties.concurrency()) {
                continue;
            }
            if (inProgressByType.getOrDefault(node.type(), 0) >= properties.typeLimit(node.type())) {
                continue;
            }
            iterator.remove();
            launch(node);
        }
    }

    private void launch(TaskNode node) {
        SolvePhase phase = node.queuedPhase;
        node.queued = false;
        node.transition(phase == SolvePhase.STATUS ? TaskState.STATUS_CHECKING : TaskState.PROCESSING);
        node.startedAt = clock.instant();
        node.dependencyResults = successfulResults(node);

        inProgress++;
        inProgressByType.merge(node.type(), 1, Integer::sum);
        metrics.taskStarted(node.type(), phase);

        if (!busy) {
            busy = true;
            emit(SolverEventType.GRAPH_PROCESSING, null, null, payload());
        }
        emit(phase == SolvePhase.STATUS ? SolverEventType.TASK_STATUS_CHECKING : SolverEventType.TASK_PROCESSING,
            null, node.key, taskPayload(node));

        TaskContext context = new TaskContext(runId, node.task, phase, node.dependencyResults, node.token);
        try {
            workers.execute(() -> invoke(node, context));
        } catch (RejectedExecutionException e) {
            loop.execute(() -> onTaskFinished(node, phase, null, e, 0L));
        }
    }

    private GraphResults successfulResults(TaskNode node) {
        List<GraphResult> successful = resultStore.pick(node.contextKeys()).values().stream()
            .filter(GraphResult::isSuccess)
            .toList();
        return GraphResults.of(successful);
    }

    /**
     * Runs on a worker thread. Only reads the node's immutable parts.
     */
    private void invoke(TaskNode node, TaskContext context) {
        SolvePhase phase = context.getPhase();
        TaskStatus status = null;
        Throwable error = null;
        long start = System.nanoTime();

        try (LoggingContext ignored = LoggingContext.forTask(runId, node.key, node.type(), phase)) {
            log.debug("Started {} {}", phase.verb(), node.task.getDescription());
            context.throwIfCancelled();
            status = phase == SolvePhase.STATUS
                ? node.task.getStatus(context)
                : node.task.process(context);
            context.throwIfCancelled();
        } catch (Throwable t) {
            error = t;
        }

        long elapsed = System.nanoTime() - start;
        TaskStatus outcome = status;
        Throwable failure = error;
        try {
            loop.execute(() -> onTaskFinished(node, phase, outcome, failure, elapsed));
        } catch (RejectedExecutionException e) {
            log.warn("Solver run {} stopped before the outcome of {} could be recorded", runId, node.key);
        }
    }

    // ========== Completion ==========

    private void onTaskFinished(TaskNode node, SolvePhase phase, TaskStatus status, Throwable error, long elapsedNanos) {
        wave++;
        inProgress--;
        inProgressByType.merge(node.type(), -1, Integer::sum);
        metrics.taskFinished(node.type(), phase, elapsedNanos);

        try (LoggingContext ignored = LoggingContext.forTask(runId, node.key, node.type(), phase)) {
            if (node.token.isCancelled()) {
                finish(node, GraphResult.cancelled(
                    node.task, node.token.getReason(), node.startedAt, clock.instant(), node.dependencyResults));
            } else if (error != null) {
                fail(node, phase, error);
            } else if (status == null) {
                fail(node, phase, new IllegalStateException(phase.name().toLowerCase() + " returned no status"));
            } else if (phase == SolvePhase.STATUS) {
                onStatusChecked(node, status);
            } else if (status.isReady()) {
                finish(node, GraphResult.done(
                    node.task, status, true, node.startedAt, clock.instant(), node.dependencyResults));
            } else {
                fail(node, phase, new TaskFailureException(
                    TaskFailureException.NOT_READY_CODE,
                    String.format("Task %s finished processing with state %s", node.key, status.state())));
            }
        }

        afterStep();
    }

    private void onStatusChecked(TaskNode node, TaskStatus status) {
        if (status.isReady()) {
            node.transition(TaskState.SHORT_CIRCUITED);
            finish(node, GraphResult.done(
                node.task, status, false, node.startedAt, clock.instant(), node.dependencyResults));
            return;
        }

        log.debug("Status of {} is {}, processing required", node.key, status.state());
        node.transition(TaskState.AWAITING_DEPENDENCIES);
        node.processRequired = true;
        for (BatchState batch : new ArrayList<>(batchTracker.batchesFor(node.key))) {
            for (TaskNode dependency : node.dependencies) {
                request(dependency, batch);
            }
        }
        evaluate(node);
    }

    private void fail(TaskNode node, SolvePhase phase, Throwable error) {
        TaskGraphException recorded;
        if (error instanceof TaskGraphException domainError) {
            recorded = domainError;
            log.warn("Failed {} {}: [{}] {}", phase.verb(), node.key, domainError.getErrorCode(), domainError.getMessage());
        } else {
            recorded = new TaskCrashException(node.key, phase.verb(), error);
            log.error("Unexpected error {} {}", phase.verb(), node.key, error);
        }
        finish(node, GraphResult.failed(node.task, recorded, node.startedAt, clock.instant(), node.dependencyResults));
    }

    private void cancelNode(TaskNode node, TaskGraphException reason) {
        if (node.isTerminal()) {
            return;
        }
        if (node.isActive()) {
            if (node.token.cancel(reason)) {
                log.info("Signalled cancellation of running task {}: {}", node.key, reason.getMessage());
            }
            return;
        }
        if (node.queued) {
            readyQueue.remove(node);
            node.queued = false;
        }
        finish(node, GraphResult.cancelled(
            node.task, reason, node.startedAt, clock.instant(), node.dependencyResults));
    }

    /**
     * Record a terminal result and notify dependents.
     */
    private void finish(TaskNode node, GraphResult outcome) {
        GraphResult result = outcome.withSequence(++resultSequence);
        node.transition(result.state());
        node.result = result;
        resultStore.put(result);
        batchTracker.record(result);

        ObjectNode payload = taskPayload(node);
        switch (result.state()) {
            case DONE -> {
                payload.put("processed", result.processed());
                payload.put("actionState", result.actionState().value());
                emit(SolverEventType.TASK_COMPLETED, null, node.key, payload);
                metrics.taskCompleted(node.type(), result.processed());
                log.info("{} {}", result.processed() ? "Processed" : "Already ready:", node.task.getDescription());
            }
            case FAILED -> {
                payload.put("errorCode", result.error().getErrorCode());
                payload.put("error", result.error().getMessage());
                emit(SolverEventType.TASK_FAILED, null, node.key, payload);
                metrics.taskFailed(node.type(), result.error().getErrorCode());
            }
            default -> {
                payload.put("errorCode", result.error().getErrorCode());
                payload.put("reason", result.error().getMessage());
                emit(SolverEventType.TASK_CANCELLED, null, node.key, payload);
                metrics.taskCancelled(node.type(), result.error().getErrorCode());
                log.info("Cancelled {}: {}", node.key, result.error().getMessage());
            }
        }

        for (TaskNode dependent : node.dependents) {
            evaluate(dependent);
        }
        for (TaskNode statusDependent : node.statusDependents) {
            evaluate(statusDependent);
        }
    }

    // ========== Cancellation ==========

    private void cancelBatch(UUID batchId, BatchCancelledException reason) {
        BatchState batch = batchTracker.require(batchId);
        if (!batch.isActive()) {
            log.debug("Batch {} is no longer active, nothing to cancel", batchId);
            return;
        }
        wave++;

        try (LoggingContext ignored = LoggingContext.forBatch(runId, batchId)) {
            deadlineWatcher.cancel(batchId);
            List<String> orphaned = batchTracker.cancel(batchId);
            log.info("Cancelling batch {} ({}): {} task(s) no longer needed by any batch",
                batchId, reason.getErrorCode(), orphaned.size());

            ObjectNode payload = payload();
            payload.put("reason", reason.getMessage());
            payload.put("errorCode", reason.getErrorCode());
            payload.put("cancelledTasks", orphaned.size());
            emit(SolverEventType.BATCH_CANCELLED, batchId, null, payload);
            metrics.batchCancelled(reason.getErrorCode());

            // Dependents first, so each gets the batch error rather than a cascade
            orphaned.stream()
                .map(nodes::get)
                .sorted(DEPENDENTS_FIRST)
                .forEach(node -> cancelNode(node, reason));
        }

        afterStep();
    }

    private void onDeadline(UUID batchId, Duration deadline) {
        try {
            loop.execute(() -> cancelBatch(batchId, new DeadlineExceededException(batchId, deadline)));
        } catch (RejectedExecutionException e) {
            log.debug("Solver run {} closed before deadline of batch {} could apply", runId, batchId);
        }
    }

    // ========== Internal Methods ==========

    /**
     * End of every bookkeeping step: admit work, settle batches, report idleness.
     */
    private void afterStep() {
        schedule();
        metrics.queueSize(readyQueue.size());

        List<BatchState> settled = batchTracker.collectSettled(clock.instant());
        for (BatchState batch : settled) {
            deadlineWatcher.cancel(batch.batchId());
            GraphResults results = batch.results();
            Batch snapshot = batch.snapshot();
            long durationMs = Duration.between(snapshot.startedAt(), snapshot.settledAt()).toMillis();

            ObjectNode payload = payload();
            payload.put("status", snapshot.status().name());
            payload.put("results", results.size());
            payload.put("failed", results.failed().size());
            emit(SolverEventType.BATCH_SETTLED, batch.batchId(), null, payload);
            metrics.batchSettled(results.hasErrors(), durationMs);
            log.info("Batch {} settled ({}): {} result(s), {} failed or cancelled",
                batch.batchId(), snapshot.status(), results.size(), results.failed().size());
        }

        if (busy && inProgress == 0 && readyQueue.isEmpty()) {
            busy = false;
            emit(SolverEventType.GRAPH_IDLE, null, null, payload());
        }

        for (BatchState batch : settled) {
            batch.settledFuture().complete(batch.results());
        }
    }

    private <T> T onLoop(Supplier<T> action) {
        if (Thread.currentThread() == loopThread) {
            return action.get();
        }
        if (closed.get()) {
            throw new IllegalStateException("Solver run " + runId + " is closed");
        }
        try {
            return CompletableFuture.supplyAsync(action, loop).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Solver run " + runId + " is closed", e);
        }
    }

    private void emit(SolverEventType type, UUID batchId, String taskKey, ObjectNode payload) {
        eventLog.append(SolverEvent.create(runId, eventSequence++, type, clock.instant(), batchId, taskKey, payload));
    }

    private ObjectNode payload() {
        return JsonNodeFactory.instance.objectNode();
    }

    private ObjectNode taskPayload(TaskNode node) {
        ObjectNode payload = payload();
        payload.put("type", node.type());
        payload.put("name", node.task.getName());
        payload.put("description", node.task.getDescription());
        payload.put("inputVersion", node.task.getInputVersion());
        payload.put("force", node.task.isForce());
        return payload;
    }

    private void shutdown(ExecutorService executor, Duration timeout) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Executor of run {} did not terminate within {}, forcing shutdown", runId, timeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Builder for GraphSolver. Every collaborator is optional.
     */
    public static class Builder {
        private SolverProperties properties;
        private ResultStore resultStore;
        private EventLog eventLog;
        private SolverMetrics metrics;
        private Clock clock;

        public Builder properties(SolverProperties properties) {
            this.properties = properties;
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.properties = SolverProperties.withConcurrency(concurrency);
            return this;
        }

        public Builder resultStore(ResultStore resultStore) {
            this.resultStore = resultStore;
            return this;
        }

        public Builder eventLog(EventLog eventLog) {
            this.eventLog = eventLog;
            return this;
        }

        public Builder metrics(SolverMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public GraphSolver build() {
            return new GraphSolver(this);
        }
    }
}
