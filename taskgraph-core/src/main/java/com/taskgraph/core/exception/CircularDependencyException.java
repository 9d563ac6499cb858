package com.taskgraph.core.exception;

import java.util.List;

/**
 * Thrown at resolve time when the dependency graph contains a cycle.
 * This is a configuration error: no task of the submission has been executed.
 *
 * <p>The cycle is reported in traversal order, starting from the first task of the cycle
 * the resolver reached. For edges a→b→c→a reached from a, the cycle is {@code [a, b, c]}.</p>
 */
public class CircularDependencyException extends TaskGraphException {
    
    public static final String ERROR_CODE = "CIRCULAR_DEPENDENCIES";
    
    private final List<String> cycle;
    private final boolean involvesStatusDependencies;
    
    public CircularDependencyException(List<String> cycle, boolean involvesStatusDependencies) {
        super(ERROR_CODE, String.format(
            "Circular task dependencies detected%s: %s",
            involvesStatusDependencies ? " (through status dependencies)" : "",
            describe(cycle)
        ));
        this.cycle = List.copyOf(cycle);
        this.involvesStatusDependencies = involvesStatusDependencies;
    }
    
    public CircularDependencyException(List<String> cycle) {
        this(cycle, false);
    }
    
    /**
     * Task keys forming the cycle, in traversal order.
     */
    public List<String> getCycle() {
        return cycle;
    }
    
    public boolean involvesStatusDependencies() {
        return involvesStatusDependencies;
    }
    
    /**
     * Render a cycle as {@code a -> b -> c -> a}.
     */
    public static String describe(List<String> cycle) {
        if (cycle.isEmpty()) {
            return "";
        }
        return String.join(" -> ", cycle) + " -> " + cycle.get(0);
    }
}
