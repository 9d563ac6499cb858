package com.taskgraph.actions;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.core.exception.TaskDefinitionException;
import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.core.task.Task;
import com.taskgraph.core.task.TaskContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A build, deploy, run or test task whose behaviour is supplied by handlers.
 *
 * <p>Dependencies may be given eagerly or as a supplier. A supplier is called at most once,
 * when the solver first asks for the edges, so large graphs are only materialized as far
 * as they are actually walked.</p>
 *
 * Usage:
 * <pre>
 * ActionTask build = ActionTask.builder(ActionKind.BUILD, "api")
 *     .version("v-3f2a")
 *     .onStatus(ctx -&gt; registry.has("api", ctx.getVersion()) ? TaskStatus.ready() : TaskStatus.notReady())
 *     .onProcess(ctx -&gt; ctx.ready(registry.push("api", ctx.getVersion())))
 *     .build();
 * </pre>
 */
public class ActionTask implements Task {

    private static final Logger log = LoggerFactory.getLogger(ActionTask.class);

    private static final ActionHandler UNKNOWN_STATUS = context -> TaskStatus.unknown();

    private final ActionKind kind;
    private final String name;
    private final String description;
    private final String version;
    private final boolean force;
    private final ActionHandler statusHandler;
    private final ActionHandler processHandler;
    private final ObjectMapper objectMapper;

    private final Supplier<List<Task>> dependencySupplier;
    private final Supplier<List<Task>> statusDependencySupplier;
    private List<Task> dependencies;
    private List<Task> statusDependencies;

    private ActionTask(Builder builder) {
        this.kind = builder.kind;
        this.name = builder.name;
        this.description = builder.description != null
            ? builder.description
            : defaultDescription(builder.kind, builder.name);
        this.version = builder.version;
        this.force = builder.force;
        this.statusHandler = builder.statusHandler;
        this.processHandler = builder.processHandler;
        this.objectMapper = builder.objectMapper;
        this.dependencySupplier = builder.dependencySupplier;
        this.statusDependencySupplier = builder.statusDependencySupplier;
    }

    public static Builder builder(ActionKind kind, String name) {
        return new Builder(kind, name);
    }

    public ActionKind getKind() {
        return kind;
    }

    @Override
    public String getType() {
        return kind.type();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public boolean isForce() {
        return force;
    }

    @Override
    public String getInputVersion() {
        return version;
    }

    @Override
    public synchronized List<Task> getDependencies() {
        if (dependencies == null) {
            dependencies = materialize(dependencySupplier, "dependencies");
        }
        return dependencies;
    }

    @Override
    public synchronized List<Task> getStatusDependencies() {
        if (statusDependencies == null) {
            statusDependencies = materialize(statusDependencySupplier, "status dependencies");
        }
        return statusDependencies;
    }

    @Override
    public TaskStatus getStatus(TaskContext context) throws Exception {
        log.debug("Checking status of {} at version {}", getKey(), version);
        return statusHandler.handle(new ActionContext(this, context, objectMapper));
    }

    @Override
    public TaskStatus process(TaskContext context) throws Exception {
        log.debug("Processing {} at version {} (force={})", getKey(), version, force);
        return processHandler.handle(new ActionContext(this, context, objectMapper));
    }

    @Override
    public String toString() {
        return "ActionTask[" + getKey() + "@" + version + (force ? ", force" : "") + "]";
    }

    private List<Task> materialize(Supplier<List<Task>> supplier, String what) {
        List<Task> tasks = supplier.get();
        if (tasks == null) {
            throw new TaskDefinitionException(getKey(), what + " supplier returned null");
        }
        return Collections.unmodifiableList(new ArrayList<>(tasks));
    }

    private static String defaultDescription(ActionKind kind, String name) {
        return switch (kind) {
            case BUILD -> "building " + name;
            case DEPLOY -> "deploying " + name;
            case RUN -> "running " + name;
            case TEST -> "testing " + name;
        };
    }

    public static class Builder {
        private final ActionKind kind;
        private final String name;
        private String description;
        private String version = "unversioned";
        private boolean force;
        private ActionHandler statusHandler = UNKNOWN_STATUS;
        private ActionHandler processHandler;
        private ObjectMapper objectMapper;
        private Supplier<List<Task>> dependencySupplier = List::of;
        private Supplier<List<Task>> statusDependencySupplier = List::of;

        private Builder(ActionKind kind, String name) {
            this.kind = Objects.requireNonNull(kind, "kind");
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder force(boolean force) {
            this.force = force;
            return this;
        }

        public Builder dependsOn(Task... tasks) {
            List<Task> fixed = new ArrayList<>(Arrays.asList(tasks));
            this.dependencySupplier = () -> fixed;
            return this;
        }

        /**
         * Supply dependencies lazily. Called at most once.
         */
        public Builder dependencies(Supplier<List<Task>> supplier) {
            this.dependencySupplier = Objects.requireNonNull(supplier, "supplier");
            return this;
        }

        public Builder statusDependsOn(Task... tasks) {
            List<Task> fixed = new ArrayList<>(Arrays.asList(tasks));
            this.statusDependencySupplier = () -> fixed;
            return this;
        }

        public Builder statusDependencies(Supplier<List<Task>> supplier) {
            this.statusDependencySupplier = Objects.requireNonNull(supplier, "supplier");
            return this;
        }

        /**
         * Status check handler. Without one the status is unknown and the action always processes.
         */
        public Builder onStatus(ActionHandler handler) {
            this.statusHandler = Objects.requireNonNull(handler, "handler");
            return this;
        }

        public Builder onProcess(ActionHandler handler) {
            this.processHandler = Objects.requireNonNull(handler, "handler");
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * @throws TaskDefinitionException if the name or process handler is missing
         */
        public ActionTask build() {
            String key = kind.type() + "." + name;
            if (name == null || name.isBlank()) {
                throw new TaskDefinitionException(key, "name is required");
            }
            if (processHandler == null) {
                throw new TaskDefinitionException(key, "process handler is required");
            }
            if (objectMapper == null) {
                objectMapper = new ObjectMapper();
            }
            return new ActionTask(this);
        }
    }
}
