package com.taskgraph.core.model;

import com.taskgraph.core.task.Task;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, insertion-ordered set of results keyed by task key.
 */
public final class GraphResults implements Iterable<GraphResult> {

    private static final GraphResults EMPTY = new GraphResults(Map.of());

    private final Map<String, GraphResult> results;

    private GraphResults(Map<String, GraphResult> results) {
        this.results = results;
    }

    public static GraphResults empty() {
        return EMPTY;
    }

    /**
     * Build from results in the order given. A later result for the same key replaces an earlier one.
     */
    public static GraphResults of(Collection<GraphResult> results) {
        if (results.isEmpty()) {
            return EMPTY;
        }
        Map<String, GraphResult> byKey = new LinkedHashMap<>();
        for (GraphResult result : results) {
            byKey.put(result.key(), result);
        }
        return new GraphResults(Collections.unmodifiableMap(byKey));
    }

    public Optional<GraphResult> get(String key) {
        return Optional.ofNullable(results.get(key));
    }

    public Optional<GraphResult> getResult(Task task) {
        return get(task.getKey());
    }

    public boolean contains(String key) {
        return results.containsKey(key);
    }

    public Set<String> keys() {
        return results.keySet();
    }

    public Collection<GraphResult> values() {
        return results.values();
    }

    public Map<String, GraphResult> asMap() {
        return results;
    }

    public int size() {
        return results.size();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    /**
     * Failed and cancelled results, in order.
     */
    public List<GraphResult> failed() {
        return results.values().stream()
            .filter(r -> !r.isSuccess())
            .toList();
    }

    public boolean hasErrors() {
        return results.values().stream().anyMatch(r -> !r.isSuccess());
    }

    /**
     * The unsuccessful result that completed first.
     * Equal completion times are ordered by the solver's write sequence, so a failure wins over
     * the cascades it caused. Unsequenced ties keep insertion order.
     */
    public Optional<GraphResult> firstFailure() {
        return results.values().stream()
            .filter(r -> !r.isSuccess())
            .min(Comparator.comparing(GraphResult::completedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
                .thenComparingLong(GraphResult::sequence));
    }

    @Override
    public Iterator<GraphResult> iterator() {
        return results.values().iterator();
    }

    @Override
    public String toString() {
        return "GraphResults" + results.keySet();
    }
}
