package com.taskgraph.examples.project;

import com.taskgraph.core.exception.CircularDependencyException;
import com.taskgraph.core.exception.TaskCascadeException;
import com.taskgraph.core.model.GraphResult;
import com.taskgraph.core.model.GraphResults;
import com.taskgraph.core.model.TaskState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.assertj.core.api.Assertions.assertThat;

@Timeout(30)
class ProjectDemoTest {

    private ProjectActions actions;
    private ProjectDemo demo;

    @BeforeEach
    void setUp() {
        actions = new ProjectActions(0);
        demo = new ProjectDemo(actions, 4);
    }

    @Test
    void firstRun_shouldProcessEveryAction() {
        GraphResults results = demo.runScenario1_FirstRun();

        assertThat(results.hasErrors()).isFalse();
        assertThat(actions.getProcessed()).containsExactlyInAnyOrder(
            "build.api", "build.web", "build.worker",
            "deploy.db", "run.migrate",
            "deploy.api", "deploy.web", "deploy.worker",
            "test.e2e");
        assertThat(actions.getProcessed()).doesNotHaveDuplicates();
        assertThat(actions.getRegistry()).containsEntry("api", "api:v-1");
        assertThat(results.get("deploy.api").orElseThrow().outputs()).containsEntry("image", "api:v-1");
    }

    @Test
    void cachedRun_shouldOnlyProcessActionsWithoutStatusCheck() {
        demo.runScenario1_FirstRun();

        GraphResults results = demo.runScenario2_CachedRun();

        assertThat(actions.getProcessed()).containsExactly("test.e2e");
        assertThat(results.keys()).containsExactlyInAnyOrder("test.e2e", "deploy.web", "deploy.worker");
        assertThat(results.get("deploy.web").orElseThrow().processed()).isFalse();
        assertThat(demo.completed("cached")).isGreaterThanOrEqualTo(2);
    }

    @Test
    void sourceChange_shouldRebuildOnlyTheStaleChain() {
        demo.runScenario1_FirstRun();

        GraphResults results = demo.runScenario3_SourceChange();

        assertThat(actions.getProcessed()).containsExactlyInAnyOrder("build.api", "run.migrate", "deploy.api");
        assertThat(results.get("deploy.db").orElseThrow().processed()).isFalse();
        assertThat(actions.getEnvironment()).containsEntry("api", "v-2");
    }

    @Test
    void forcedRun_shouldProcessForcedActionsOnly() {
        demo.runScenario1_FirstRun();

        GraphResults results = demo.runScenario4_ForcedRun();

        assertThat(actions.getProcessed()).containsExactly("build.worker", "deploy.worker");
        assertThat(results.get("deploy.db").orElseThrow().processed()).isFalse();
        assertThat(results.get("deploy.worker").orElseThrow().processed()).isTrue();
    }

    @Test
    void failureCascade_shouldCancelDependentsOfFailedBuild() {
        demo.runScenario1_FirstRun();

        GraphResults results = demo.runScenario5_FailureCascade();

        GraphResult build = results.get("build.web").orElseThrow();
        assertThat(build.state()).isEqualTo(TaskState.FAILED);

        GraphResult deploy = results.get("deploy.web").orElseThrow();
        assertThat(deploy.state()).isEqualTo(TaskState.CANCELLED);
        assertThat(deploy.error()).isInstanceOf(TaskCascadeException.class);
        assertThat(((TaskCascadeException) deploy.error()).getFailedTaskKey()).isEqualTo("build.web");

        assertThat(results.get("test.e2e").orElseThrow().state()).isEqualTo(TaskState.CANCELLED);
        assertThat(results.get("deploy.worker").orElseThrow().state()).isEqualTo(TaskState.DONE);
        assertThat(actions.getRegistry()).containsEntry("web", "web:v-1");
    }

    @Test
    void cycle_shouldBeRejectedBeforeAnythingRuns() {
        CircularDependencyException rejected = demo.runScenario6_CycleRejected();

        assertThat(rejected).isNotNull();
        assertThat(rejected.getCycle()).contains("deploy.api", "run.migrate");
        assertThat(actions.getProcessed()).isEmpty();
    }
}
