package com.taskgraph.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What a task's status check or processing returns: a state plus opaque outputs.
 */
public record TaskStatus(
    ActionState state,
    Map<String, Object> outputs
) {
    public TaskStatus {
        Objects.requireNonNull(state, "state");
        outputs = outputs == null || outputs.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    public static TaskStatus ready() {
        return new TaskStatus(ActionState.READY, Map.of());
    }

    public static TaskStatus ready(Map<String, Object> outputs) {
        return new TaskStatus(ActionState.READY, outputs);
    }

    public static TaskStatus notReady() {
        return new TaskStatus(ActionState.NOT_READY, Map.of());
    }

    public static TaskStatus notReady(Map<String, Object> outputs) {
        return new TaskStatus(ActionState.NOT_READY, outputs);
    }

    public static TaskStatus unknown() {
        return new TaskStatus(ActionState.UNKNOWN, Map.of());
    }

    public static TaskStatus of(ActionState state, Map<String, Object> outputs) {
        return new TaskStatus(state, outputs);
    }

    public boolean isReady() {
        return state.isReady();
    }

    /**
     * Copy with an additional output entry.
     */
    public TaskStatus withOutput(String name, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(outputs);
        merged.put(name, value);
        return new TaskStatus(state, merged);
    }
}
