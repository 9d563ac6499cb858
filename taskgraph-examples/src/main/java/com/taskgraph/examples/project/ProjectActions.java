package com.taskgraph.examples.project;

import com.taskgraph.actions.ActionCatalog;
import com.taskgraph.actions.ActionContext;
import com.taskgraph.actions.ActionDefinition;
import com.taskgraph.actions.ActionException;
import com.taskgraph.actions.ActionKind;
import com.taskgraph.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Actions of a small three-service project, backed by a simulated artifact cache.
 *
 * <pre>
 *   test.e2e      -> deploy.web, deploy.worker
 *   deploy.web    -> build.web, deploy.api
 *   deploy.worker -> build.worker, deploy.db
 *   deploy.api    -> build.api, run.migrate
 *   run.migrate   -> deploy.db
 * </pre>
 *
 * Builds are ready when the registry holds an image of the current source version.
 * Deploys are ready when the environment runs that version.
 * Migrations and the end-to-end suite have no status check and run whenever requested.
 *
 * DEMONSTRATES:
 * - Status short-circuit against cached artifacts
 * - Outputs handed from builds to deploys
 * - Failure injection per action key
 */
public class ProjectActions {

    private static final Logger log = LoggerFactory.getLogger(ProjectActions.class);

    public static final String DATABASE_VERSION = "postgres-15";

    private final Map<String, String> sourceVersions = new ConcurrentHashMap<>();
    private final Map<String, String> registry = new ConcurrentHashMap<>();
    private final Map<String, String> environment = new ConcurrentHashMap<>();
    private final Set<String> failing = ConcurrentHashMap.newKeySet();
    private final List<String> processed = new CopyOnWriteArrayList<>();
    private final long latencyMillis;

    public ProjectActions(long latencyMillis) {
        this.latencyMillis = latencyMillis;
        sourceVersions.put("api", "v-1");
        sourceVersions.put("web", "v-1");
        sourceVersions.put("worker", "v-1");
    }

    /**
     * Catalog for the current source versions.
     * Create a new one after {@link #changeSource} so the actions carry the new versions.
     */
    public ActionCatalog catalog() {
        ActionCatalog catalog = new ActionCatalog();
        for (String service : List.of("api", "web", "worker")) {
            catalog.register(build(service));
        }

        catalog.register(ActionDefinition.builder(ActionKind.DEPLOY, "db")
            .description("deploying the database")
            .version(DATABASE_VERSION)
            .onStatus(this::deployStatus)
            .onProcess(ctx -> deploy(ctx, "postgres:" + DATABASE_VERSION))
            .build());

        catalog.register(ActionDefinition.builder(ActionKind.RUN, "migrate")
            .description("running database migrations")
            .dependsOn("deploy.db")
            .onProcess(this::migrate)
            .build());

        catalog.register(ActionDefinition.builder(ActionKind.DEPLOY, "api")
            .version(sourceVersions.get("api"))
            .dependsOn("build.api", "run.migrate")
            .onStatus(this::deployStatus)
            .onProcess(ctx -> deploy(ctx, ctx.getDependencyOutput("build.api", "image", String.class)))
            .build());

        catalog.register(ActionDefinition.builder(ActionKind.DEPLOY, "web")
            .version(sourceVersions.get("web"))
            .dependsOn("build.web", "deploy.api")
            .onStatus(this::deployStatus)
            .onProcess(ctx -> deploy(ctx, ctx.getDependencyOutput("build.web", "image", String.class)))
            .build());

        catalog.register(ActionDefinition.builder(ActionKind.DEPLOY, "worker")
            .version(sourceVersions.get("worker"))
            .dependsOn("build.worker", "deploy.db")
            .onStatus(this::deployStatus)
            .onProcess(ctx -> deploy(ctx, ctx.getDependencyOutput("build.worker", "image", String.class)))
            .build());

        catalog.register(ActionDefinition.builder(ActionKind.TEST, "e2e")
            .description("running the end-to-end suite")
            .dependsOn("deploy.web", "deploy.worker")
            .onProcess(this::runEndToEnd)
            .build());

        return catalog;
    }

    /**
     * Catalog whose migrations need the api deployed, which in turn needs the migrations.
     */
    public ActionCatalog cyclicCatalog() {
        return catalog()
            .register(ActionDefinition.builder(ActionKind.RUN, "migrate")
                .description("running database migrations against the api")
                .dependsOn("deploy.db", "deploy.api")
                .onProcess(this::migrate)
                .build());
    }

    private ActionDefinition build(String service) {
        return ActionDefinition.builder(ActionKind.BUILD, service)
            .version(sourceVersions.get(service))
            .onStatus(ctx -> {
                String image = service + ":" + ctx.getVersion();
                return image.equals(registry.get(service))
                    ? ctx.ready(Map.of("image", image))
                    : ctx.notReady();
            })
            .onProcess(ctx -> {
                log.info("[{}] Building image {}:{}", ctx.getKey(), service, ctx.getVersion());
                simulateWork(ctx);
                fail(ctx);

                String image = service + ":" + ctx.getVersion();
                registry.put(service, image);
                processed.add(ctx.getKey());

                log.info("[{}] Pushed {}", ctx.getKey(), image);
                return ctx.ready(Map.of("image", image, "builtAt", Instant.now().toString()));
            })
            .build();
    }

    private TaskStatus deployStatus(ActionContext ctx) {
        String service = ctx.getAction().getName();
        return ctx.getVersion().equals(environment.get(service))
            ? ctx.ready(Map.of("version", ctx.getVersion()))
            : ctx.notReady();
    }

    private TaskStatus deploy(ActionContext ctx, String image) throws InterruptedException {
        String service = ctx.getAction().getName();
        log.info("[{}] Rolling out {}", ctx.getKey(), image);
        simulateWork(ctx);
        fail(ctx);

        environment.put(service, ctx.getVersion());
        processed.add(ctx.getKey());

        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("version", ctx.getVersion());
        outputs.put("image", image);
        outputs.put("endpoint", "http://" + service + ".local");
        log.info("[{}] {} is live at {}", ctx.getKey(), service, outputs.get("endpoint"));
        return ctx.ready(outputs);
    }

    private TaskStatus migrate(ActionContext ctx) throws InterruptedException {
        log.info("[{}] Applying migrations to {}", ctx.getKey(),
            ctx.getDependencyOutput("deploy.db", "version", String.class));
        simulateWork(ctx);
        fail(ctx);
        processed.add(ctx.getKey());
        return ctx.ready(Map.of("applied", 3));
    }

    private TaskStatus runEndToEnd(ActionContext ctx) throws InterruptedException {
        String web = ctx.getDependencyOutput("deploy.web", "version", String.class);
        String worker = ctx.getDependencyOutput("deploy.worker", "version", String.class);
        log.info("[{}] Testing web {} against worker {}", ctx.getKey(), web, worker);
        simulateWork(ctx);
        fail(ctx);
        processed.add(ctx.getKey());
        return ctx.ready(Map.of("passed", 42, "failed", 0));
    }

    private void simulateWork(ActionContext ctx) throws InterruptedException {
        if (latencyMillis > 0) {
            Thread.sleep(latencyMillis);
        }
        ctx.throwIfCancelled();
    }

    private void fail(ActionContext ctx) {
        if (failing.contains(ctx.getKey())) {
            log.warn("[{}] SIMULATED FAILURE", ctx.getKey());
            throw ActionException.failed(ctx.getKey(), "simulated failure in " + ctx.getKey());
        }
    }

    // Configuration methods for the scenarios

    public void changeSource(String service, String version) {
        if (!sourceVersions.containsKey(service)) {
            throw new IllegalArgumentException("Unknown service: " + service);
        }
        sourceVersions.put(service, version);
    }

    public void failAction(String key) {
        failing.add(key);
    }

    public void clearFailures() {
        failing.clear();
    }

    public void resetProcessed() {
        processed.clear();
    }

    public List<String> getProcessed() {
        return List.copyOf(processed);
    }

    public Map<String, String> getRegistry() {
        return Map.copyOf(registry);
    }

    public Map<String, String> getEnvironment() {
        return Map.copyOf(environment);
    }
}
