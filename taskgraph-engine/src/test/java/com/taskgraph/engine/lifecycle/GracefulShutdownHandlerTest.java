package com.taskgraph.engine.lifecycle;

import com.taskgraph.core.model.GraphResults;
import com.taskgraph.core.model.SolveOptions;
import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.engine.solver.GraphSolver;
import com.taskgraph.engine.solver.SolverProperties;
import com.taskgraph.engine.test.SolverTestTask;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class GracefulShutdownHandlerTest {

    private final SolverProperties properties = SolverProperties.withConcurrency(2)
        .withShutdownTimeout(Duration.ofMillis(300));
    private final GracefulShutdownHandler handler = new GracefulShutdownHandler(properties);

    @Test
    void shutdown_shouldCloseIdleSolvers() {
        GraphSolver solver = GraphSolver.builder().properties(properties).build();
        handler.register(solver);

        handler.shutdown();

        assertThat(solver.isClosed()).isTrue();
        assertThat(handler.isShuttingDown()).isTrue();
        assertThat(handler.canAcceptRuns()).isFalse();
        assertThat(handler.getRegisteredRunCount()).isZero();
    }

    @Test
    void shutdown_shouldCancelBatchesStillRunningAfterTimeout() throws Exception {
        CountDownLatch processing = new CountDownLatch(1);
        SolverTestTask slow = SolverTestTask.build("slow").onProcess(context -> {
            processing.countDown();
            context.getCancellationToken().await(5, TimeUnit.SECONDS);
            return TaskStatus.ready();
        });
        GraphSolver solver = GraphSolver.builder().properties(properties).build();
        handler.register(solver);

        UUID batchId = solver.submit(List.of(slow), SolveOptions.defaults());
        assertThat(processing.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(handler.getActiveRunCount()).isEqualTo(1);

        handler.shutdown();

        GraphResults results = solver.waitUntilSettled(batchId, Duration.ofSeconds(5));
        assertThat(results.get("build.slow").orElseThrow().isCancelled()).isTrue();
        assertThat(solver.isClosed()).isTrue();
    }

    @Test
    void register_shouldFailDuringShutdown() {
        handler.shutdown();
        GraphSolver solver = GraphSolver.builder().properties(properties).build();

        try {
            assertThatThrownBy(() -> handler.register(solver))
                .isInstanceOf(IllegalStateException.class);
        } finally {
            solver.close();
        }
    }

    @Test
    void register_racingShutdown_shouldNeverLeaveAnAcceptedSolverOpen() throws Exception {
        int threads = 4;
        Queue<GraphSolver> accepted = new ConcurrentLinkedQueue<>();
        CountDownLatch started = new CountDownLatch(threads);
        ExecutorService registrars = Executors.newFixedThreadPool(threads);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(registrars.submit(() -> {
                    started.countDown();
                    for (int attempt = 0; attempt < 50; attempt++) {
                        GraphSolver solver = GraphSolver.builder().properties(properties).build();
                        try {
                            handler.register(solver);
                            accepted.add(solver);
                        } catch (IllegalStateException e) {
                            solver.close();
                            return;
                        }
                    }
                }));
            }
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            handler.shutdown();

            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            registrars.shutdownNow();
        }

        assertThat(handler.getRegisteredRunCount()).isZero();
        assertThat(accepted).allSatisfy(solver -> assertThat(solver.isClosed()).isTrue());
        GraphSolver late = GraphSolver.builder().properties(properties).build();
        try {
            assertThatThrownBy(() -> handler.register(late)).isInstanceOf(IllegalStateException.class);
        } finally {
            late.close();
        }
    }
}
