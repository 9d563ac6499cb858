package com.taskgraph.core.task;

/**
 * Which task operation an invocation runs.
 */
public enum SolvePhase {
    STATUS("checking status of"),
    PROCESS("processing");

    private final String verb;

    SolvePhase(String verb) {
        this.verb = verb;
    }

    /**
     * Phrase used in log lines and error messages.
     */
    public String verb() {
        return verb;
    }
}
