package com.taskgraph.engine.persistence;

import com.taskgraph.core.model.SolverEvent;
import com.taskgraph.core.model.SolverEventType;
import com.taskgraph.core.repository.EventLog;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of EventLog.
 * Events are kept in append order, which is sequence order.
 */
public class InMemoryEventLog implements EventLog {
    
    private final List<SolverEvent> events = new CopyOnWriteArrayList<>();
    
    @Override
    public void append(SolverEvent event) {
        events.add(event);
    }
    
    @Override
    public List<SolverEvent> findAll() {
        return List.copyOf(events);
    }
    
    @Override
    public List<SolverEvent> findByBatch(UUID batchId) {
        return events.stream()
            .filter(e -> batchId.equals(e.batchId()))
            .collect(Collectors.toList());
    }
    
    @Override
    public List<SolverEvent> findByTask(String taskKey) {
        return events.stream()
            .filter(e -> taskKey.equals(e.taskKey()))
            .collect(Collectors.toList());
    }
    
    @Override
    public List<SolverEvent> findByTypes(List<SolverEventType> types) {
        if (types.isEmpty()) {
            return List.of();
        }
        Set<SolverEventType> typeSet = EnumSet.copyOf(types);
        return events.stream()
            .filter(e -> typeSet.contains(e.type()))
            .collect(Collectors.toList());
    }
    
    @Override
    public Map<SolverEventType, Long> countByType() {
        return events.stream()
            .collect(Collectors.groupingBy(
                SolverEvent::type,
                () -> new EnumMap<>(SolverEventType.class),
                Collectors.counting()
            ));
    }
}
