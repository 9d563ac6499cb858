package com.taskgraph.actions;

import java.util.ArrayList;
import java.util.List;

/**
 * Definition of an action in a catalog.
 * Describes what the action is and which actions it needs, referenced by key.
 *
 * Invariants:
 * - name is non-empty, key is {@code kind.name}
 * - dependency keys reference actions of the same catalog
 * - processHandler is set
 */
public record ActionDefinition(
    // Identity
    ActionKind kind,
    String name,
    String description,

    // Edges, as action keys
    List<String> dependencies,
    List<String> statusDependencies,

    // Content version of the action's inputs
    String version,

    // Behaviour
    ActionHandler statusHandler,
    ActionHandler processHandler
) {
    public ActionDefinition {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        statusDependencies = statusDependencies == null ? List.of() : List.copyOf(statusDependencies);
    }

    public String key() {
        return kind.type() + "." + name;
    }

    public boolean hasStatusHandler() {
        return statusHandler != null;
    }

    public static Builder builder(ActionKind kind, String name) {
        return new Builder(kind, name);
    }

    public static class Builder {
        private final ActionKind kind;
        private final String name;
        private String description;
        private final List<String> dependencies = new ArrayList<>();
        private final List<String> statusDependencies = new ArrayList<>();
        private String version = "unversioned";
        private ActionHandler statusHandler;
        private ActionHandler processHandler;

        private Builder(ActionKind kind, String name) {
            this.kind = kind;
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder dependsOn(String... keys) {
            dependencies.addAll(List.of(keys));
            return this;
        }

        public Builder statusDependsOn(String... keys) {
            statusDependencies.addAll(List.of(keys));
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder onStatus(ActionHandler handler) {
            this.statusHandler = handler;
            return this;
        }

        public Builder onProcess(ActionHandler handler) {
            this.processHandler = handler;
            return this;
        }

        public ActionDefinition build() {
            return new ActionDefinition(kind, name, description, dependencies, statusDependencies,
                version, statusHandler, processHandler);
        }
    }
}
