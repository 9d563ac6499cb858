package com.taskgraph.core.exception;

import com.taskgraph.core.model.GraphResult;
import com.taskgraph.core.model.GraphResults;
import com.taskgraph.core.test.StubTask;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskCascadeExceptionTest {

    @Test
    void of_shouldWrapDirectFailure() {
        TaskFailureException root = new TaskFailureException("compile error");

        TaskCascadeException cascade = TaskCascadeException.of("deploy.api", "build.api", root);

        assertEquals(TaskCascadeException.ERROR_CODE, cascade.getErrorCode());
        assertEquals(List.of("deploy.api", "build.api"), cascade.getChain());
        assertEquals("build.api", cascade.getFailedTaskKey());
        assertSame(root, cascade.getRootError());
        assertTrue(cascade.getMessage().contains("compile error"));
    }

    @Test
    void of_shouldFlattenNestedCascades() {
        TaskFailureException root = new TaskFailureException("compile error");
        TaskCascadeException first = TaskCascadeException.of("deploy.api", "build.api", root);

        TaskCascadeException second = TaskCascadeException.of("test.e2e", "deploy.api", first);

        assertEquals(List.of("test.e2e", "deploy.api", "build.api"), second.getChain());
        assertSame(root, second.getRootError());
        assertSame(root, second.getCause());
    }

    @Test
    void circularDependency_shouldDescribeClosedLoop() {
        CircularDependencyException error = new CircularDependencyException(List.of("a", "b", "c"));

        assertEquals("a -> b -> c -> a", CircularDependencyException.describe(error.getCycle()));
        assertEquals(CircularDependencyException.ERROR_CODE, error.getErrorCode());
        assertFalse(error.involvesStatusDependencies());
    }

    @Test
    void graphSolve_shouldExposeFirstError() {
        StubTask task = StubTask.of("build", "a");
        TaskFailureException failure = new TaskFailureException("broken");
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        GraphResult failed = GraphResult.failed(task, failure, now, now, GraphResults.empty());

        GraphSolveException error = new GraphSolveException(GraphResults.of(List.of(failed)), failed);

        assertSame(failure, error.getFirstError());
        assertEquals(1, error.getResults().size());
        assertTrue(error.getMessage().contains("build.a"));
    }

    @Test
    void crash_shouldUseInternalCode() {
        TaskCrashException crash = new TaskCrashException("build.a", "processing", new NullPointerException("npe"));

        assertEquals(TaskCrashException.ERROR_CODE, crash.getErrorCode());
        assertEquals("build.a", crash.getTaskKey());
        assertInstanceOf(NullPointerException.class, crash.getCause());
    }
}
