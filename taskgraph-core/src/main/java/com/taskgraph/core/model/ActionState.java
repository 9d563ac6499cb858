package com.taskgraph.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * State reported by a task's status check or processing.
 * Only {@link #READY} lets the solver skip processing.
 */
public enum ActionState {
    /**
     * The task's output is missing or outdated and must be (re)processed.
     */
    NOT_READY("not-ready"),

    /**
     * The task's output is up to date.
     */
    READY("ready"),

    /**
     * The status could not be determined. Treated like not-ready.
     */
    UNKNOWN("unknown"),

    /**
     * The last attempt at this task failed. Treated like not-ready.
     */
    FAILED("failed");

    private final String value;

    ActionState(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isReady() {
        return this == READY;
    }

    @JsonCreator
    public static ActionState fromValue(String value) {
        for (ActionState state : values()) {
            if (state.value.equals(value) || state.name().equalsIgnoreCase(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown action state: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
