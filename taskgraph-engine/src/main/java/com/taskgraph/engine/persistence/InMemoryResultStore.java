package com.taskgraph.engine.persistence;

import com.taskgraph.core.exception.DuplicateResultException;
import com.taskgraph.core.model.GraphResult;
import com.taskgraph.core.model.GraphResults;
import com.taskgraph.core.repository.ResultStore;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ResultStore, scoped to one solver run.
 * Written by the solver loop; readable from any thread.
 */
public class InMemoryResultStore implements ResultStore {
    
    private final Map<String, GraphResult> results = new ConcurrentHashMap<>();
    
    @Override
    public Optional<GraphResult> get(String key) {
        return Optional.ofNullable(results.get(key));
    }
    
    @Override
    public void put(GraphResult result) {
        if (results.putIfAbsent(result.key(), result) != null) {
            throw new DuplicateResultException(result.key());
        }
    }
    
    @Override
    public Map<String, GraphResult> getAll() {
        return results.values().stream()
            .sorted(Comparator.comparing(GraphResult::completedAt).thenComparing(GraphResult::key))
            .collect(Collectors.toMap(
                GraphResult::key,
                r -> r,
                (a, b) -> a,
                LinkedHashMap::new
            ));
    }
    
    @Override
    public GraphResults pick(Collection<String> keys) {
        List<GraphResult> picked = new ArrayList<>();
        for (String key : keys) {
            GraphResult result = results.get(key);
            if (result != null) {
                picked.add(result);
            }
        }
        return GraphResults.of(picked);
    }
    
    @Override
    public boolean contains(String key) {
        return results.containsKey(key);
    }
    
    @Override
    public int size() {
        return results.size();
    }
}
