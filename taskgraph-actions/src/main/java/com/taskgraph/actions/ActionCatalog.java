package com.taskgraph.actions;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.exception.TaskDefinitionException;
import com.taskgraph.core.task.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Registry of action definitions that turns requested action keys into tasks.
 *
 * <p>Every {@link #createTasks} call builds a fresh set of task instances. Within one call
 * each key maps to exactly one instance, shared by every action that depends on it, and
 * dependency instances are only created when the solver walks to them.</p>
 */
public class ActionCatalog {

    private static final Logger log = LoggerFactory.getLogger(ActionCatalog.class);

    private final Map<String, ActionDefinition> definitions = new ConcurrentSkipListMap<>();
    private final ObjectMapper objectMapper;

    public ActionCatalog() {
        this(new ObjectMapper());
    }

    public ActionCatalog(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Register or replace a definition.
     *
     * @throws TaskDefinitionException if the definition has no name or process handler
     */
    public ActionCatalog register(ActionDefinition definition) {
        if (definition.kind() == null || definition.name() == null || definition.name().isBlank()) {
            throw new TaskDefinitionException(String.valueOf(definition.name()), "kind and name are required");
        }
        if (definition.processHandler() == null) {
            throw new TaskDefinitionException(definition.key(), "process handler is required");
        }
        ActionDefinition previous = definitions.put(definition.key(), definition);
        if (previous != null) {
            log.info("Replaced action definition: {}", definition.key());
        } else {
            log.debug("Registered action definition: {}", definition.key());
        }
        return this;
    }

    public Optional<ActionDefinition> find(String key) {
        return Optional.ofNullable(definitions.get(key));
    }

    /**
     * @throws NotFoundException if no action is registered under the key
     */
    public ActionDefinition get(String key) {
        return find(key).orElseThrow(() -> new NotFoundException("Action", key));
    }

    /**
     * Registered keys in sorted order.
     */
    public Set<String> keys() {
        return definitions.keySet();
    }

    public Collection<ActionDefinition> definitions() {
        return definitions.values();
    }

    public int size() {
        return definitions.size();
    }

    /**
     * Build tasks for the requested keys with default options.
     */
    public List<Task> createTasks(Collection<String> keys) {
        return createTasks(keys, TaskOptions.defaults());
    }

    /**
     * Build tasks for the requested keys.
     *
     * @throws NotFoundException if a requested key is not registered
     */
    public List<Task> createTasks(Collection<String> keys, TaskOptions options) {
        Set<String> roots = new LinkedHashSet<>(keys);
        for (String key : roots) {
            get(key);
        }
        TaskFactory factory = new TaskFactory(roots, options);
        List<Task> tasks = new ArrayList<>(roots.size());
        for (String key : roots) {
            tasks.add(factory.create(key));
        }
        log.debug("Created {} root task(s) {} with {}", tasks.size(), roots, options);
        return tasks;
    }

    /**
     * Flags applied when turning keys into tasks.
     *
     * @param force                      process the requested actions even if their status is ready
     * @param forceBuild                 also process every build action the requested actions reach
     * @param processRuntimeDependencies when a test or run action is requested, also process every
     *                                   deploy action it reaches, so the suite runs against fresh deploys
     */
    public record TaskOptions(boolean force, boolean forceBuild, boolean processRuntimeDependencies) {
        public TaskOptions(boolean force, boolean forceBuild) {
            this(force, forceBuild, false);
        }

        public static TaskOptions defaults() {
            return new TaskOptions(false, false, false);
        }

        public TaskOptions withProcessRuntimeDependencies(boolean processRuntimeDependencies) {
            return new TaskOptions(force, forceBuild, processRuntimeDependencies);
        }
    }

    /**
     * Per-call instance cache. Dependency suppliers may run on another thread than the
     * one that called {@link #createTasks}, hence the synchronization.
     */
    private final class TaskFactory {
        private final Set<String> roots;
        private final TaskOptions options;
        private final boolean forceDeploys;
        private final Map<String, ActionTask> created = new HashMap<>();

        private TaskFactory(Set<String> roots, TaskOptions options) {
            this.roots = roots;
            this.options = options;
            this.forceDeploys = options.processRuntimeDependencies()
                && roots.stream().map(key -> get(key).kind()).anyMatch(ActionKind::isRuntimeConsumer);
        }

        synchronized ActionTask create(String key) {
            ActionTask existing = created.get(key);
            if (existing != null) {
                return existing;
            }
            ActionDefinition definition = get(key);
            ActionTask.Builder builder = ActionTask.builder(definition.kind(), definition.name())
                .description(definition.description())
                .version(definition.version())
                .force(isForced(definition))
                .onProcess(definition.processHandler())
                .objectMapper(objectMapper)
                .dependencies(() -> resolveAll(key, definition.dependencies()))
                .statusDependencies(() -> resolveAll(key, definition.statusDependencies()));
            if (definition.hasStatusHandler()) {
                builder.onStatus(definition.statusHandler());
            }
            ActionTask task = builder.build();
            created.put(key, task);
            return task;
        }

        private List<Task> resolveAll(String owner, List<String> dependencyKeys) {
            List<Task> tasks = new ArrayList<>(dependencyKeys.size());
            for (String dependencyKey : dependencyKeys) {
                if (!definitions.containsKey(dependencyKey)) {
                    throw new TaskDefinitionException(owner, "unknown dependency " + dependencyKey);
                }
                tasks.add(create(dependencyKey));
            }
            return tasks;
        }

        private boolean isForced(ActionDefinition definition) {
            if (options.force() && roots.contains(definition.key())) {
                return true;
            }
            if (forceDeploys && definition.kind() == ActionKind.DEPLOY) {
                return true;
            }
            return options.forceBuild() && definition.kind() == ActionKind.BUILD;
        }
    }
}
