package com.taskgraph.api.rest;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskgraph.api.service.RunService;
import com.taskgraph.api.service.RunService.RunSnapshot;
import com.taskgraph.api.service.RunService.StartRunRequest;
import com.taskgraph.core.model.Batch;
import com.taskgraph.core.model.BatchStatus;
import com.taskgraph.core.model.GraphResults;
import com.taskgraph.engine.report.GraphResultRenderer;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST API for runs: solve catalog actions, watch them settle, cancel them.
 */
@RestController
@RequestMapping("/api/v1/runs")
public class RunController {

    private final RunService runService;
    private final GraphResultRenderer renderer;

    public RunController(RunService runService, GraphResultRenderer renderer) {
        this.runService = runService;
        this.renderer = renderer;
    }

    /**
     * Start a run for the requested actions.
     */
    @PostMapping
    public ResponseEntity<RunResponse> startRun(@RequestBody StartRunRequestDto request) {
        RunSnapshot run = runService.startRun(new StartRunRequest(
            request.actions(),
            request.force(),
            request.forceBuild(),
            request.deadline()
        ));

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(RunResponse.from(run));
    }

    @GetMapping
    public ResponseEntity<List<RunResponse>> listRuns() {
        List<RunResponse> responses = runService.listRuns().stream()
            .map(RunResponse::from)
            .toList();
        return ResponseEntity.ok(responses);
    }

    /**
     * Get run by ID.
     */
    @GetMapping("/{runId}")
    public ResponseEntity<RunResponse> getRun(@PathVariable UUID runId) {
        return ResponseEntity.ok(RunResponse.from(runService.getRun(runId)));
    }

    /**
     * Results of a run, with a summary. Partial while the run is still going.
     */
    @GetMapping("/{runId}/results")
    public ResponseEntity<ObjectNode> getResults(@PathVariable UUID runId) {
        GraphResults results = runService.getResults(runId);

        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.set("summary", renderer.summarize(results));
        body.set("results", renderer.toJson(results));
        return ResponseEntity.ok(body);
    }

    /**
     * Cancel a run.
     */
    @PostMapping("/{runId}/cancel")
    public ResponseEntity<RunResponse> cancelRun(@PathVariable UUID runId) {
        return ResponseEntity.ok(RunResponse.from(runService.cancelRun(runId)));
    }

    // ========== DTOs ==========

    public record StartRunRequestDto(
        List<String> actions,
        boolean force,
        boolean forceBuild,
        Duration deadline
    ) {}

    public record RunResponse(
        UUID runId,
        UUID batchId,
        List<String> actions,
        boolean force,
        boolean forceBuild,
        BatchStatus status,
        int trackedTasks,
        int remainingTasks,
        Instant submittedAt,
        Instant settledAt
    ) {
        public static RunResponse from(RunSnapshot run) {
            Batch batch = run.batch();
            return new RunResponse(
                run.runId(),
                batch.batchId(),
                run.actions(),
                run.force(),
                run.forceBuild(),
                batch.status(),
                batch.trackedTasks(),
                batch.remainingTasks(),
                run.submittedAt(),
                batch.settledAt()
            );
        }
    }
}
