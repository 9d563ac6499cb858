package com.taskgraph.engine.resolver;

import com.taskgraph.core.task.Task;

import java.util.List;
import java.util.Map;

/**
 * Validated dependency closure of a set of root tasks.
 *
 * @param rootKeys distinct root keys in submission order
 * @param tasks canonical task instances, every dependency before its dependents
 * @param dependencies dependency keys per task key
 * @param statusDependencies status dependency keys per task key
 */
public record ResolvedGraph(
    List<String> rootKeys,
    List<Task> tasks,
    Map<String, List<String>> dependencies,
    Map<String, List<String>> statusDependencies
) {
    public List<String> dependenciesOf(String key) {
        return dependencies.getOrDefault(key, List.of());
    }

    public List<String> statusDependenciesOf(String key) {
        return statusDependencies.getOrDefault(key, List.of());
    }

    public int size() {
        return tasks.size();
    }
}
