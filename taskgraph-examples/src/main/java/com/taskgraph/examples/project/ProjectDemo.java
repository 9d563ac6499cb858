package com.taskgraph.examples.project;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.actions.ActionCatalog;
import com.taskgraph.actions.ActionCatalog.TaskOptions;
import com.taskgraph.core.exception.CircularDependencyException;
import com.taskgraph.core.exception.GraphSolveException;
import com.taskgraph.core.model.GraphResults;
import com.taskgraph.core.model.SolveOptions;
import com.taskgraph.core.task.Task;
import com.taskgraph.engine.metrics.SolverMetrics;
import com.taskgraph.engine.report.GraphResultRenderer;
import com.taskgraph.engine.solver.GraphSolver;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.search.Search;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Demonstration runner for the project graph in {@link ProjectActions}.
 *
 * Shows:
 * 1. First run, everything is processed
 * 2. Second run, cached artifacts short-circuit on their status
 * 3. Source change, only the stale chain is rebuilt
 * 4. Forced runs
 * 5. Failure cascading to dependents
 * 6. Cycle rejected before anything runs
 */
public class ProjectDemo {

    private static final Logger log = LoggerFactory.getLogger(ProjectDemo.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private final ProjectActions actions;
    private final MeterRegistry registry = new SimpleMeterRegistry();
    private final SolverMetrics metrics = SolverMetrics.bound(registry);
    private final GraphResultRenderer renderer = new GraphResultRenderer(mapper);
    private final int concurrency;

    public ProjectDemo(ProjectActions actions, int concurrency) {
        this.actions = actions;
        this.concurrency = concurrency;
    }

    public static void main(String[] args) throws Exception {
        ProjectDemo demo = new ProjectDemo(new ProjectActions(150), 4);

        log.info("╔══════════════════════════════════════════════════════════════════════╗");
        log.info("║     TASK GRAPH SOLVER - PROJECT DEPLOYMENT DEMONSTRATION             ║");
        log.info("╠══════════════════════════════════════════════════════════════════════╣");
        log.info("║  Demonstrating status short-circuit, forcing and failure cascades    ║");
        log.info("╚══════════════════════════════════════════════════════════════════════╝");
        log.info("");

        demo.runScenario1_FirstRun();
        demo.runScenario2_CachedRun();
        demo.runScenario3_SourceChange();
        demo.runScenario4_ForcedRun();
        demo.runScenario5_FailureCascade();
        demo.runScenario6_CycleRejected();

        log.info("");
        log.info("Tasks processed: {}, cached: {}",
            (long) demo.completed("processed"), (long) demo.completed("cached"));
        log.info("╔══════════════════════════════════════════════════════════════════════╗");
        log.info("║                    ALL DEMONSTRATIONS COMPLETE                       ║");
        log.info("╚══════════════════════════════════════════════════════════════════════╝");
    }

    /**
     * SCENARIO 1: Nothing is built or deployed yet.
     */
    public GraphResults runScenario1_FirstRun() {
        header(1, "First Run");

        GraphResults results = solve(List.of("test.e2e"), TaskOptions.defaults(), SolveOptions.defaults());

        log.info("Processed: {}", actions.getProcessed());
        complete(1, "Every action was processed");
        return results;
    }

    /**
     * SCENARIO 2: Same request against a warm cache.
     * Only the end-to-end suite, which has no status check, runs again.
     */
    public GraphResults runScenario2_CachedRun() {
        header(2, "Cached Run");

        GraphResults results = solve(List.of("test.e2e"), TaskOptions.defaults(), SolveOptions.defaults());

        log.info("Processed: {}", actions.getProcessed());
        complete(2, "Deploys were ready, their builds were never requested");
        return results;
    }

    /**
     * SCENARIO 3: The api source changes and the api deploy is requested.
     */
    public GraphResults runScenario3_SourceChange() {
        header(3, "Source Change");

        actions.changeSource("api", "v-2");
        GraphResults results = solve(List.of("deploy.api"), TaskOptions.defaults(), SolveOptions.defaults());

        log.info("Processed: {}", actions.getProcessed());
        log.info("Environment: {}", actions.getEnvironment());
        complete(3, "Only the stale api chain was rebuilt");
        return results;
    }

    /**
     * SCENARIO 4: Forcing the requested deploy, then forcing builds as well.
     */
    public GraphResults runScenario4_ForcedRun() {
        header(4, "Forced Run");

        solve(List.of("deploy.web"), new TaskOptions(true, false), SolveOptions.defaults());
        log.info("force: processed {}", actions.getProcessed());

        GraphResults results = solve(List.of("deploy.worker"), new TaskOptions(true, true), SolveOptions.defaults());
        log.info("force + forceBuild: processed {}", actions.getProcessed());

        complete(4, "Forced actions were processed despite being ready");
        return results;
    }

    /**
     * SCENARIO 5: The web build breaks after a source change.
     */
    public GraphResults runScenario5_FailureCascade() {
        header(5, "Failure Cascade");

        actions.changeSource("web", "v-2");
        actions.failAction("build.web");
        GraphResults results;
        try {
            results = solve(List.of("test.e2e"), TaskOptions.defaults(), SolveOptions.defaults().withThrowOnError(true));
        } catch (GraphSolveException e) {
            log.warn("Solve failed: {}", e.getMessage());
            log.warn("First error: [{}] {}", e.getFirstError().getErrorCode(), e.getFirstError().getMessage());
            results = e.getResults();
            log.info("Report:\n{}", renderer.render(results));
        } finally {
            actions.clearFailures();
        }

        complete(5, "Dependents of the failed build were cancelled");
        return results;
    }

    /**
     * SCENARIO 6: Migrations that need the api they are migrating for.
     */
    public CircularDependencyException runScenario6_CycleRejected() {
        header(6, "Cycle Rejected");

        actions.resetProcessed();
        CircularDependencyException rejected = null;
        try (GraphSolver solver = newSolver()) {
            solver.solve(actions.cyclicCatalog().createTasks(List.of("deploy.api")), SolveOptions.defaults());
        } catch (CircularDependencyException e) {
            log.warn("Rejected: {}", e.getMessage());
            rejected = e;
        }

        log.info("Processed: {}", actions.getProcessed());
        complete(6, "The cycle was reported before any action ran");
        return rejected;
    }

    private GraphResults solve(List<String> keys, TaskOptions taskOptions, SolveOptions solveOptions) {
        actions.resetProcessed();
        ActionCatalog catalog = actions.catalog();
        List<Task> tasks = catalog.createTasks(keys, taskOptions);
        log.info("Requesting {} (force={}, forceBuild={})", keys, taskOptions.force(), taskOptions.forceBuild());

        try (GraphSolver solver = newSolver()) {
            GraphResults results = solver.solve(tasks, solveOptions);
            log.info("Summary: {}", renderer.summarize(results));
            return results;
        }
    }

    private GraphSolver newSolver() {
        return GraphSolver.builder()
            .concurrency(concurrency)
            .metrics(metrics)
            .build();
    }

    double completed(String outcome) {
        return Search.in(registry)
            .name(SolverMetrics.TASKS_COMPLETED)
            .tag("outcome", outcome)
            .counters()
            .stream()
            .mapToDouble(c -> c.count())
            .sum();
    }

    private void header(int number, String title) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════════════");
        log.info("SCENARIO {}: {}", number, title);
        log.info("═══════════════════════════════════════════════════════════════════════");
        log.info("");
    }

    private void complete(int number, String outcome) {
        log.info("");
        log.info("✓ SCENARIO {} COMPLETE: {}", number, outcome);
        log.info("");
    }
}
