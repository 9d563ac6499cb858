package com.taskgraph.actions;

import java.util.Arrays;
import java.util.Locale;

/**
 * Kinds of actions a project graph is made of. The lower-case name is the task type,
 * so per-type concurrency limits are configured as {@code build}, {@code deploy} and so on.
 */
public enum ActionKind {
    /**
     * Produces an artifact, e.g. a container image.
     */
    BUILD,

    /**
     * Brings a service up in an environment.
     */
    DEPLOY,

    /**
     * One-off job, e.g. a database migration.
     */
    RUN,

    /**
     * Test suite against built or deployed targets.
     */
    TEST;

    public String type() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether actions of this kind exercise running deploys rather than producing them.
     */
    public boolean isRuntimeConsumer() {
        return this == RUN || this == TEST;
    }

    /**
     * Parse a task type or enum name.
     *
     * @throws IllegalArgumentException for an unknown kind
     */
    public static ActionKind fromType(String type) {
        return Arrays.stream(values())
            .filter(kind -> kind.type().equalsIgnoreCase(type))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown action kind: " + type));
    }
}
