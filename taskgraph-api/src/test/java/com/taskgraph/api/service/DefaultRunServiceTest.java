package com.taskgraph.api.service;

import com.taskgraph.actions.ActionCatalog;
import com.taskgraph.actions.ActionDefinition;
import com.taskgraph.actions.ActionKind;
import com.taskgraph.api.service.RunService.RunSnapshot;
import com.taskgraph.api.service.RunService.StartRunRequest;
import com.taskgraph.core.exception.CircularDependencyException;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.model.BatchStatus;
import com.taskgraph.core.model.GraphResults;
import com.taskgraph.core.model.TaskState;
import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.engine.lifecycle.GracefulShutdownHandler;
import com.taskgraph.engine.metrics.SolverMetrics;
import com.taskgraph.engine.solver.SolverProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@Timeout(30)
class DefaultRunServiceTest {

    private GracefulShutdownHandler shutdownHandler;
    private DefaultRunService runService;

    @BeforeEach
    void setUp() {
        ActionCatalog catalog = new ActionCatalog()
            .register(ActionDefinition.builder(ActionKind.BUILD, "api")
                .onStatus(ctx -> TaskStatus.notReady())
                .onProcess(ctx -> ctx.ready(Map.of("image", "api:1")))
                .build())
            .register(ActionDefinition.builder(ActionKind.DEPLOY, "api")
                .dependsOn("build.api")
                .onProcess(ctx -> TaskStatus.ready())
                .build())
            .register(ActionDefinition.builder(ActionKind.RUN, "slow")
                .onProcess(ctx -> {
                    ctx.getTaskContext().getCancellationToken().await(10, TimeUnit.SECONDS);
                    return TaskStatus.ready();
                })
                .build())
            .register(ActionDefinition.builder(ActionKind.BUILD, "left")
                .dependsOn("build.right")
                .onProcess(ctx -> TaskStatus.ready())
                .build())
            .register(ActionDefinition.builder(ActionKind.BUILD, "right")
                .dependsOn("build.left")
                .onProcess(ctx -> TaskStatus.ready())
                .build());

        SolverProperties properties = SolverProperties.withConcurrency(4).withShutdownTimeout(Duration.ofSeconds(2));
        shutdownHandler = new GracefulShutdownHandler(properties);
        runService = new DefaultRunService(catalog, properties, SolverMetrics.standalone(), shutdownHandler,
            null, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        shutdownHandler.shutdown();
        runService.stop();
    }

    @Test
    void startRun_shouldSolveRequestedActions() throws InterruptedException {
        RunSnapshot started = runService.startRun(new StartRunRequest(List.of("deploy.api"), false, false, null));

        RunSnapshot settled = awaitSettled(started.runId());

        assertThat(settled.batch().status()).isEqualTo(BatchStatus.SETTLED);
        GraphResults results = runService.getResults(started.runId());
        assertThat(results.keys()).containsExactlyInAnyOrder("build.api", "deploy.api");
        assertThat(results.get("deploy.api").orElseThrow().state()).isEqualTo(TaskState.DONE);
    }

    @Test
    void startRun_shouldCloseSolverOnceSettled() throws InterruptedException {
        RunSnapshot started = runService.startRun(new StartRunRequest(List.of("build.api"), false, false, null));

        awaitSettled(started.runId());

        long deadline = System.currentTimeMillis() + 5000;
        while (shutdownHandler.getRegisteredRunCount() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(shutdownHandler.getRegisteredRunCount()).isZero();
        assertThat(runService.getRun(started.runId()).batch().isSettled()).isTrue();
    }

    @Test
    void startRun_shouldRejectUnknownAction() {
        assertThatThrownBy(() -> runService.startRun(
                new StartRunRequest(List.of("deploy.unknown"), false, false, null)))
            .isInstanceOf(NotFoundException.class);
        assertThat(runService.listRuns()).isEmpty();
    }

    @Test
    void startRun_shouldRejectCycleAndReleaseSolver() {
        assertThatThrownBy(() -> runService.startRun(
                new StartRunRequest(List.of("build.left"), false, false, null)))
            .isInstanceOf(CircularDependencyException.class);

        assertThat(runService.listRuns()).isEmpty();
        assertThat(shutdownHandler.getRegisteredRunCount()).isZero();
    }

    @Test
    void startRun_shouldRejectEmptyRequest() {
        assertThatThrownBy(() -> runService.startRun(new StartRunRequest(List.of(), false, false, null)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void startRun_shouldRejectDuringShutdown() {
        shutdownHandler.shutdown();

        assertThatThrownBy(() -> runService.startRun(
                new StartRunRequest(List.of("build.api"), false, false, null)))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cancelRun_shouldCancelRunningBatch() throws InterruptedException {
        RunSnapshot started = runService.startRun(new StartRunRequest(List.of("run.slow"), false, false, null));

        runService.cancelRun(started.runId());
        RunSnapshot settled = awaitSettled(started.runId());

        assertThat(settled.batch().status()).isEqualTo(BatchStatus.CANCELLED);
        assertThat(runService.getResults(started.runId()).get("run.slow").orElseThrow().state())
            .isEqualTo(TaskState.CANCELLED);
    }

    @Test
    void cancelRun_shouldIgnoreSettledRun() throws InterruptedException {
        RunSnapshot started = runService.startRun(new StartRunRequest(List.of("build.api"), false, false, null));
        awaitSettled(started.runId());

        RunSnapshot afterCancel = runService.cancelRun(started.runId());

        assertThat(afterCancel.batch().status()).isEqualTo(BatchStatus.SETTLED);
    }

    @Test
    void deadline_shouldCancelRun() throws InterruptedException {
        RunSnapshot started = runService.startRun(
            new StartRunRequest(List.of("run.slow"), false, false, Duration.ofMillis(200)));

        RunSnapshot settled = awaitSettled(started.runId());

        assertThat(settled.batch().status()).isEqualTo(BatchStatus.CANCELLED);
    }

    @Test
    void getRun_shouldThrowForUnknownRun() {
        UUID runId = UUID.randomUUID();

        assertThatThrownBy(() -> runService.getRun(runId))
            .isInstanceOf(NotFoundException.class)
            .hasMessageContaining(runId.toString());
    }

    private RunSnapshot awaitSettled(UUID runId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        RunSnapshot run = runService.getRun(runId);
        while (!run.batch().isSettled() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            run = runService.getRun(runId);
        }
        assertThat(run.batch().isSettled()).as("run %s settled", runId).isTrue();
        return run;
    }
}
