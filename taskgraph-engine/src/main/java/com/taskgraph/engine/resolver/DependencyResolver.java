package com.taskgraph.engine.resolver;

import com.taskgraph.core.exception.CircularDependencyException;
import com.taskgraph.core.exception.TaskDefinitionException;
import com.taskgraph.core.task.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Expands root tasks into their dependency closure and validates it.
 *
 * <p>One resolver serves one solver run. The first instance seen for a key stays canonical for
 * the whole run; later instances with the same key are never invoked, and edges always point
 * at keys so dependents are rewired to the canonical instance. Dependency lookups are memoized
 * per {@code (key, edge kind)} so a task's dependency methods are called once per run.</p>
 *
 * <p>Not thread-safe: the solver only calls it from its bookkeeping thread.</p>
 */
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    /**
     * Kind of edge between two tasks.
     */
    public enum EdgeKind {
        DEPENDENCY,
        STATUS_DEPENDENCY
    }

    private record EdgeCacheKey(String taskKey, EdgeKind kind) {}

    private enum Color { WHITE, GRAY, BLACK }

    private final Map<String, Task> canonical = new LinkedHashMap<>();
    private final Map<EdgeCacheKey, List<String>> edgeCache = new HashMap<>();

    /**
     * Resolve the closure of the given roots.
     *
     * @param roots Root tasks in submission order
     * @return The validated closure
     * @throws CircularDependencyException if the dependency edges contain a cycle
     * @throws TaskDefinitionException if a task in the closure is malformed
     */
    public ResolvedGraph resolve(Collection<? extends Task> roots) {
        List<String> rootKeys = new ArrayList<>();
        Set<String> closure = new LinkedHashSet<>();
        Deque<String> toVisit = new ArrayDeque<>();

        for (Task root : roots) {
            String key = register(root);
            if (!rootKeys.contains(key)) {
                rootKeys.add(key);
            }
            toVisit.add(key);
        }

        while (!toVisit.isEmpty()) {
            String key = toVisit.poll();
            if (!closure.add(key)) {
                continue;
            }
            toVisit.addAll(edges(key, EdgeKind.DEPENDENCY));
            toVisit.addAll(edges(key, EdgeKind.STATUS_DEPENDENCY));
        }

        Map<String, List<String>> dependencies = new LinkedHashMap<>();
        Map<String, List<String>> statusDependencies = new LinkedHashMap<>();
        for (String key : closure) {
            dependencies.put(key, edges(key, EdgeKind.DEPENDENCY));
            statusDependencies.put(key, edges(key, EdgeKind.STATUS_DEPENDENCY));
        }

        List<String> traversal = new ArrayList<>(rootKeys);
        traversal.addAll(closure);

        // Dependency edges alone must be acyclic.
        depthFirst(traversal, dependencies::get, false);

        // Status edges mixed in must not close a loop either, or the run could never settle.
        Map<String, List<String>> combined = new LinkedHashMap<>();
        for (String key : closure) {
            List<String> all = new ArrayList<>(dependencies.get(key));
            all.addAll(statusDependencies.get(key));
            combined.put(key, all);
        }
        List<String> order = depthFirst(traversal, combined::get, true);

        List<Task> tasks = order.stream().map(canonical::get).toList();
        log.debug("Resolved {} root task(s) into {} task(s)", rootKeys.size(), tasks.size());

        return new ResolvedGraph(
            List.copyOf(rootKeys),
            tasks,
            Map.copyOf(dependencies),
            Map.copyOf(statusDependencies)
        );
    }

    /**
     * Canonical instance for a key, if the resolver has seen one.
     */
    public Task canonical(String key) {
        return canonical.get(key);
    }

    /**
     * Number of distinct task keys seen during the run.
     */
    public int knownTasks() {
        return canonical.size();
    }

    // ========== Internal Methods ==========

    private String register(Task task) {
        if (task == null) {
            throw new TaskDefinitionException("<null>", "task must not be null");
        }
        String key = validate(task);
        canonical.putIfAbsent(key, task);
        return key;
    }

    private String validate(Task task) {
        String type = task.getType();
        String name = task.getName();
        if (type == null || type.isBlank()) {
            throw new TaskDefinitionException(String.valueOf(task.getKey()), "task type must not be blank");
        }
        if (name == null || name.isBlank()) {
            throw new TaskDefinitionException(String.valueOf(task.getKey()), "task name must not be blank");
        }
        String key = task.getKey();
        if (key == null || key.isBlank()) {
            throw new TaskDefinitionException(type + "." + name, "task key must not be blank");
        }
        return key;
    }

    private List<String> edges(String key, EdgeKind kind) {
        EdgeCacheKey cacheKey = new EdgeCacheKey(key, kind);
        List<String> cached = edgeCache.get(cacheKey);
        if (cached != null) {
            return cached;
        }

        Task task = canonical.get(key);
        List<Task> declared = kind == EdgeKind.DEPENDENCY
            ? task.getDependencies()
            : task.getStatusDependencies();

        List<String> keys = new ArrayList<>();
        if (declared != null) {
            for (Task dependency : declared) {
                if (dependency == null) {
                    throw new TaskDefinitionException(key, "null entry in " + describe(kind));
                }
                String dependencyKey = register(dependency);
                if (!keys.contains(dependencyKey)) {
                    keys.add(dependencyKey);
                }
            }
        }

        List<String> resolved = List.copyOf(keys);
        edgeCache.put(cacheKey, resolved);
        return resolved;
    }

    /**
     * White/gray/black depth-first traversal. Returns keys in post-order, so every task comes
     * after everything it points at.
     */
    private List<String> depthFirst(List<String> startKeys, Function<String, List<String>> next, boolean mixed) {
        Map<String, Color> colors = new HashMap<>();
        List<String> path = new ArrayList<>();
        List<String> order = new ArrayList<>();
        for (String key : startKeys) {
            if (colors.getOrDefault(key, Color.WHITE) == Color.WHITE) {
                visit(key, next, colors, path, order, mixed);
            }
        }
        return order;
    }

    private void visit(
            String key,
            Function<String, List<String>> next,
            Map<String, Color> colors,
            List<String> path,
            List<String> order,
            boolean mixed) {
        colors.put(key, Color.GRAY);
        path.add(key);

        for (String target : next.apply(key)) {
            Color color = colors.getOrDefault(target, Color.WHITE);
            if (color == Color.GRAY) {
                List<String> cycle = List.copyOf(path.subList(path.indexOf(target), path.size()));
                log.warn("Circular task dependencies detected: {}", CircularDependencyException.describe(cycle));
                throw new CircularDependencyException(cycle, mixed);
            }
            if (color == Color.WHITE) {
                visit(target, next, colors, path, order, mixed);
            }
        }

        path.remove(path.size() - 1);
        colors.put(key, Color.BLACK);
        order.add(key);
    }

    private static String describe(EdgeKind kind) {
        return kind == EdgeKind.DEPENDENCY ? "dependencies" : "status dependencies";
    }
}
