package com.taskgraph.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.actions.ActionCatalog;
import com.taskgraph.actions.ActionDefinition;
import com.taskgraph.actions.ActionException;
import com.taskgraph.actions.ActionKind;
import com.taskgraph.api.config.SolverConfigProperties;
import com.taskgraph.api.service.DefaultRunService;
import com.taskgraph.api.service.RunService.RunSnapshot;
import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.engine.lifecycle.GracefulShutdownHandler;
import com.taskgraph.engine.metrics.SolverMetrics;
import com.taskgraph.engine.report.GraphResultRenderer;
import com.taskgraph.engine.solver.SolverProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("Run API Tests")
@Timeout(30)
public class RunControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private GracefulShutdownHandler shutdownHandler;
    private DefaultRunService runService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ActionCatalog catalog = new ActionCatalog(objectMapper)
            .register(ActionDefinition.builder(ActionKind.BUILD, "api")
                .description("building the api image")
                .version("v-1")
                .onProcess(ctx -> ctx.ready(Map.of("image", "api:v-1")))
                .build())
            .register(ActionDefinition.builder(ActionKind.DEPLOY, "api")
                .dependsOn("build.api")
                .onProcess(ctx -> TaskStatus.ready())
                .build())
            .register(ActionDefinition.builder(ActionKind.BUILD, "broken")
                .onProcess(ctx -> {
                    throw ActionException.failed(ctx.getKey(), "compiler exited with 1");
                })
                .build())
            .register(ActionDefinition.builder(ActionKind.TEST, "broken")
                .dependsOn("build.broken")
                .onProcess(ctx -> TaskStatus.ready())
                .build())
            .register(ActionDefinition.builder(ActionKind.RUN, "ping")
                .dependsOn("run.pong")
                .onProcess(ctx -> TaskStatus.ready())
                .build())
            .register(ActionDefinition.builder(ActionKind.RUN, "pong")
                .dependsOn("run.ping")
                .onProcess(ctx -> TaskStatus.ready())
                .build());

        SolverProperties properties = SolverProperties.withConcurrency(2);
        shutdownHandler = new GracefulShutdownHandler(properties);
        runService = new DefaultRunService(catalog, properties, SolverMetrics.standalone(), shutdownHandler,
            new SolverConfigProperties());

        mockMvc = MockMvcBuilders.standaloneSetup(
                new RunController(runService, new GraphResultRenderer(objectMapper)),
                new ActionController(catalog))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @AfterEach
    void tearDown() {
        shutdownHandler.shutdown();
        runService.stop();
    }

    // ========== Run Tests ==========

    @Test
    @DisplayName("Starting a run returns 201 with the run's batch")
    void startRun_shouldReturnCreated() throws Exception {
        mockMvc.perform(post("/api/v1/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"actions\": [\"deploy.api\"]}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.runId").exists())
            .andExpect(jsonPath("$.batchId").exists())
            .andExpect(jsonPath("$.actions[0]").value("deploy.api"))
            .andExpect(jsonPath("$.force").value(false));
    }

    @Test
    @DisplayName("Results are rendered with a summary once the run settles")
    void getResults_shouldRenderSummaryAndResults() throws Exception {
        UUID runId = startAndSettle("deploy.api");

        mockMvc.perform(get("/api/v1/runs/{runId}", runId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("SETTLED"))
            .andExpect(jsonPath("$.remainingTasks").value(0));

        mockMvc.perform(get("/api/v1/runs/{runId}/results", runId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.summary.total").value(2))
            .andExpect(jsonPath("$.summary.done").value(2))
            .andExpect(jsonPath("$.results['build.api'].outputs.image").value("api:v-1"))
            .andExpect(jsonPath("$.results['deploy.api'].processed").value(true));
    }

    @Test
    @DisplayName("Failures show up in results with their cascade chain")
    void getResults_shouldShowFailureCascade() throws Exception {
        UUID runId = startAndSettle("test.broken");

        mockMvc.perform(get("/api/v1/runs/{runId}/results", runId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.summary.failed").value(1))
            .andExpect(jsonPath("$.summary.cancelled").value(1))
            .andExpect(jsonPath("$.results['build.broken'].error.code").value(ActionException.ERROR_CODE))
            .andExpect(jsonPath("$.results['test.broken'].error.code").value("DEPENDENCY_FAILED"))
            .andExpect(jsonPath("$.results['test.broken'].error.chain[1]").value("build.broken"));
    }

    @Test
    @DisplayName("Cancelling a settled run leaves it settled")
    void cancelRun_shouldReturnRun() throws Exception {
        UUID runId = startAndSettle("build.api");

        mockMvc.perform(post("/api/v1/runs/{runId}/cancel", runId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("SETTLED"));
    }

    @Test
    void listRuns_shouldReturnStartedRuns() throws Exception {
        startAndSettle("build.api");

        mockMvc.perform(get("/api/v1/runs"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1));
    }

    // ========== Error Mapping Tests ==========

    @Test
    @DisplayName("Unknown run maps to 404")
    void getRun_shouldReturnNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/runs/{runId}", UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("Unknown action maps to 404")
    void startRun_shouldReturnNotFoundForUnknownAction() throws Exception {
        mockMvc.perform(post("/api/v1/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"actions\": [\"deploy.worker\"]}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("Action not found: deploy.worker"));
    }

    @Test
    @DisplayName("Cycles map to 422")
    void startRun_shouldRejectCycle() throws Exception {
        mockMvc.perform(post("/api/v1/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"actions\": [\"run.ping\"]}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value("CIRCULAR_DEPENDENCIES"));
    }

    @Test
    @DisplayName("Empty requests map to 400")
    void startRun_shouldRejectEmptyActions() throws Exception {
        mockMvc.perform(post("/api/v1/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"actions\": []}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(ApiExceptionHandler.BAD_REQUEST_CODE));
    }

    @Test
    @DisplayName("Starting runs during shutdown maps to 503")
    void startRun_shouldReturnUnavailableDuringShutdown() throws Exception {
        shutdownHandler.shutdown();

        mockMvc.perform(post("/api/v1/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"actions\": [\"build.api\"]}"))
            .andExpect(status().isServiceUnavailable());
    }

    // ========== Action Tests ==========

    @Test
    void listActions_shouldReturnCatalogInKeyOrder() throws Exception {
        mockMvc.perform(get("/api/v1/actions"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(6))
            .andExpect(jsonPath("$[0].key").value("build.api"))
            .andExpect(jsonPath("$[0].description").value("building the api image"))
            .andExpect(jsonPath("$[0].hasStatusCheck").value(false));
    }

    @Test
    void listActions_shouldFilterByKind() throws Exception {
        mockMvc.perform(get("/api/v1/actions").param("kind", "build"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[1].key").value("build.broken"));
    }

    @Test
    void listActions_shouldRejectUnknownKind() throws Exception {
        mockMvc.perform(get("/api/v1/actions").param("kind", "publish"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(ApiExceptionHandler.BAD_REQUEST_CODE));
    }

    @Test
    void getAction_shouldReturnDependencies() throws Exception {
        mockMvc.perform(get("/api/v1/actions/{key}", "deploy.api"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.kind").value("DEPLOY"))
            .andExpect(jsonPath("$.dependencies[0]").value("build.api"));
    }

    private UUID startAndSettle(String action) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("actions", List.of(action)))))
            .andExpect(status().isCreated())
            .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        UUID runId = UUID.fromString(body.get("runId").asText());

        long deadline = System.currentTimeMillis() + 10_000;
        RunSnapshot run = runService.getRun(runId);
        while (!run.batch().isSettled() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            run = runService.getRun(runId);
        }
        assertThat(run.batch().isSettled()).isTrue();
        return runId;
    }
}
