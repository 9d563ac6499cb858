package com.taskgraph.engine.solver;

import com.taskgraph.core.exception.InvalidStateTransitionException;
import com.taskgraph.core.model.GraphResult;
import com.taskgraph.core.model.GraphResults;
import com.taskgraph.core.model.TaskState;
import com.taskgraph.core.task.CancellationToken;
import com.taskgraph.core.task.SolvePhase;
import com.taskgraph.core.task.Task;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-key bookkeeping of a solver run. Only touched from the solver's loop thread.
 */
final class TaskNode {

    final Task task;
    final String key;
    final long sequence;

    final List<TaskNode> dependencies = new ArrayList<>();
    final List<TaskNode> statusDependencies = new ArrayList<>();
    final List<TaskNode> dependents = new ArrayList<>();
    final List<TaskNode> statusDependents = new ArrayList<>();
    int depth;

    final CancellationToken token = new CancellationToken();

    TaskState state = TaskState.PENDING;
    // Some batch needs this task's outcome
    boolean requested;
    // Status was not ready, or the task is forced
    boolean processRequired;
    boolean unlimitedConcurrency;

    boolean queued;
    SolvePhase queuedPhase;
    long readyWave;

    Instant startedAt;
    GraphResults dependencyResults = GraphResults.empty();
    GraphResult result;

    TaskNode(Task task, long sequence) {
        this.task = task;
        this.key = task.getKey();
        this.sequence = sequence;
    }

    String type() {
        return task.getType();
    }

    void transition(TaskState target) {
        if (!state.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(key, state, target);
        }
        state = target;
    }

    boolean isTerminal() {
        return state.isTerminal();
    }

    boolean isActive() {
        return state.isActive();
    }

    boolean isSuccessful() {
        return state == TaskState.DONE;
    }

    boolean isUnsuccessful() {
        return state.isUnsuccessful();
    }

    /**
     * Keys whose results this task may read.
     */
    List<String> contextKeys() {
        List<String> keys = new ArrayList<>(dependencies.size() + statusDependencies.size());
        dependencies.forEach(d -> keys.add(d.key));
        statusDependencies.stream()
            .map(d -> d.key)
            .filter(k -> !keys.contains(k))
            .forEach(keys::add);
        return keys;
    }

    @Override
    public String toString() {
        return key + "[" + state + "]";
    }
}
