package com.taskgraph.engine.test;

import com.taskgraph.core.exception.TaskCascadeException;
import com.taskgraph.core.exception.TaskFailureException;
import com.taskgraph.core.model.GraphResult;
import com.taskgraph.core.model.GraphResults;
import com.taskgraph.core.model.SolveOptions;
import com.taskgraph.core.model.TaskState;
import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.core.task.Task;
import com.taskgraph.engine.solver.GraphSolver;
import com.taskgraph.engine.solver.SolverProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Failure injection tests for the solver.
 * Random failures and latency on a layered graph must never break ordering,
 * at-most-once invocation or cascade rules.
 */
@DisplayName("Failure Injection Tests")
@Timeout(60)
public class FailureInjectionTest {

    private static final int LAYERS = 4;
    private static final int WIDTH = 5;

    private GraphSolver solver;

    @BeforeEach
    void setUp() {
        solver = GraphSolver.builder()
            .properties(SolverProperties.withConcurrency(3).withTypeLimit("deploy", 2))
            .build();
    }

    @AfterEach
    void tearDown() {
        solver.close();
    }

    /**
     * Layer n depends on up to three random tasks of layer n-1. Every fourth task is a deploy.
     */
    private List<SolverTestTask> layeredGraph(long seed, FailureInjector injector) {
        Random random = new Random(seed);
        List<SolverTestTask> all = new ArrayList<>();
        List<SolverTestTask> previous = List.of();

        for (int layer = 0; layer < LAYERS; layer++) {
            List<SolverTestTask> current = new ArrayList<>();
            for (int i = 0; i < WIDTH; i++) {
                String type = (layer * WIDTH + i) % 4 == 3 ? "deploy" : "build";
                SolverTestTask task = SolverTestTask.of(type, "l" + layer + "-" + i).onProcess(context -> {
                    injector.maybeDelay();
                    injector.maybeFail(context);
                    return TaskStatus.ready();
                });
                if (random.nextBoolean()) {
                    task.onStatus(context -> {
                        injector.maybeDelay();
                        return TaskStatus.notReady();
                    });
                }
                for (SolverTestTask dependency : previous) {
                    if (random.nextInt(3) == 0) {
                        task.dependsOn(dependency);
                    }
                }
                current.add(task);
            }
            all.addAll(current);
            previous = current;
        }
        return all;
    }

    @Test
    @DisplayName("Random failures should cascade along dependency edges only")
    void testRandomFailuresCascadeConsistently() {
        FailureInjector injector = FailureInjector.builder()
            .failureRate(0.2)
            .latency(Duration.ofMillis(1), Duration.ofMillis(10))
            .seed(42)
            .build();
        List<SolverTestTask> tasks = layeredGraph(7, injector);

        GraphResults results = solver.solve(tasks);

        assertThat(results.size()).isEqualTo(tasks.size());
        assertThat(results.values())
            .filteredOn(r -> r.state() == TaskState.FAILED)
            .extracting(GraphResult::key)
            .containsExactlyInAnyOrderElementsOf(injector.failedKeys());
        for (SolverTestTask task : tasks) {
            GraphResult result = results.getResult(task).orElseThrow();
            assertThat(task.statusCalls()).isLessThanOrEqualTo(1);
            assertThat(task.processCalls()).isLessThanOrEqualTo(1);

            boolean dependencyFailed = task.getDependencies().stream()
                .map(d -> results.getResult(d).orElseThrow())
                .anyMatch(r -> !r.isSuccess());

            if (dependencyFailed) {
                assertThat(result.state()).isEqualTo(TaskState.CANCELLED);
                assertThat(result.error()).isInstanceOf(TaskCascadeException.class);
                assertThat(task.processCalls()).isZero();
            }
            if (result.state() == TaskState.FAILED) {
                assertThat(result.error()).isInstanceOf(TaskFailureException.class);
            }
            if (result.processed()) {
                for (Task dependency : task.getDependencies()) {
                    GraphResult dependencyResult = results.getResult(dependency).orElseThrow();
                    assertThat(dependencyResult.isSuccess()).isTrue();
                    assertThat(dependencyResult.completedAt()).isBeforeOrEqualTo(result.startedAt());
                }
            }
        }
    }

    @Test
    @DisplayName("Overlapping batches under random latency should invoke each task at most once")
    void testOverlappingBatchesUnderLatency() throws Exception {
        FailureInjector injector = FailureInjector.builder()
            .failureRate(0.0)
            .latency(Duration.ofMillis(1), Duration.ofMillis(15))
            .seed(1234)
            .build();
        List<SolverTestTask> tasks = layeredGraph(99, injector);
        List<SolverTestTask> lastLayer = tasks.subList(tasks.size() - WIDTH, tasks.size());

        List<UUID> batches = new ArrayList<>();
        for (SolverTestTask root : lastLayer) {
            batches.add(solver.submit(List.of(root), SolveOptions.defaults()));
        }
        for (UUID batchId : batches) {
            GraphResults results = solver.waitUntilSettled(batchId, Duration.ofSeconds(30));
            assertThat(results.values()).allMatch(GraphResult::isSuccess);
        }

        assertThat(injector.failedKeys()).isEmpty();
        for (SolverTestTask task : tasks) {
            assertThat(task.statusCalls()).isLessThanOrEqualTo(1);
            assertThat(task.processCalls()).isLessThanOrEqualTo(1);
        }
    }
}
