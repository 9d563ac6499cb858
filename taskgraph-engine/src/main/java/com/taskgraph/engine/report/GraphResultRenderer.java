package com.taskgraph.engine.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskgraph.core.exception.TaskCascadeException;
import com.taskgraph.core.exception.TaskGraphException;
import com.taskgraph.core.model.GraphResult;
import com.taskgraph.core.model.GraphResults;
import com.taskgraph.core.model.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Renders graph results as JSON trees for logs, reports and the REST API.
 */
public class GraphResultRenderer {

    private static final Logger log = LoggerFactory.getLogger(GraphResultRenderer.class);

    private final ObjectMapper objectMapper;

    public GraphResultRenderer() {
        this(new ObjectMapper());
    }

    public GraphResultRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Render a single result.
     *
     * @param includeDependencies also render the dependency results the task was handed
     */
    public ObjectNode toJson(GraphResult result, boolean includeDependencies) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("key", result.key());
        node.put("type", result.type());
        node.put("name", result.name());
        node.put("description", result.description());
        node.put("state", result.state().name());
        node.put("processed", result.processed());
        if (result.inputVersion() != null) {
            node.put("inputVersion", result.inputVersion());
        }
        if (result.startedAt() != null) {
            node.put("startedAt", result.startedAt().toString());
        }
        if (result.completedAt() != null) {
            node.put("completedAt", result.completedAt().toString());
        }
        if (result.startedAt() != null && result.completedAt() != null) {
            node.put("durationMs", Duration.between(result.startedAt(), result.completedAt()).toMillis());
        }

        if (result.result() != null) {
            node.put("actionState", result.result().state().value());
            node.set("outputs", outputs(result.outputs()));
        }
        if (result.error() != null) {
            node.set("error", error(result.error()));
        }
        if (includeDependencies && result.dependencyResults() != null && !result.dependencyResults().isEmpty()) {
            ObjectNode dependencies = node.putObject("dependencies");
            for (GraphResult dependency : result.dependencyResults()) {
                dependencies.set(dependency.key(), toJson(dependency, false));
            }
        }
        return node;
    }

    /**
     * Render a result set keyed by task key.
     */
    public ObjectNode toJson(GraphResults results) {
        ObjectNode node = objectMapper.createObjectNode();
        for (GraphResult result : results) {
            node.set(result.key(), toJson(result, false));
        }
        return node;
    }

    /**
     * Counts per state plus the keys of unsuccessful tasks.
     */
    public ObjectNode summarize(GraphResults results) {
        Map<TaskState, Integer> counts = new EnumMap<>(TaskState.class);
        int processed = 0;
        for (GraphResult result : results) {
            counts.merge(result.state(), 1, Integer::sum);
            if (result.processed()) {
                processed++;
            }
        }

        ObjectNode summary = objectMapper.createObjectNode();
        summary.put("total", results.size());
        summary.put("processed", processed);
        summary.put("done", counts.getOrDefault(TaskState.DONE, 0));
        summary.put("failed", counts.getOrDefault(TaskState.FAILED, 0));
        summary.put("cancelled", counts.getOrDefault(TaskState.CANCELLED, 0));

        ArrayNode failedKeys = summary.putArray("unsuccessful");
        results.failed().forEach(r -> failedKeys.add(r.key()));
        return summary;
    }

    /**
     * Pretty-printed summary and results, for logs and the console.
     */
    public String render(GraphResults results) {
        ObjectNode report = objectMapper.createObjectNode();
        report.set("summary", summarize(results));
        report.set("results", toJson(results));
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            log.warn("Failed to render results: {}", e.getMessage());
            return results.toString();
        }
    }

    private ObjectNode error(TaskGraphException error) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("code", error.getErrorCode());
        node.put("message", error.getMessage());
        if (error instanceof TaskCascadeException cascade) {
            ArrayNode chain = node.putArray("chain");
            cascade.getChain().forEach(chain::add);
            node.put("failedTask", cascade.getFailedTaskKey());
            if (cascade.getRootError() != null) {
                node.put("rootCode", cascade.getRootError().getErrorCode());
            }
        }
        Throwable cause = error.getCause();
        if (cause != null && cause != error) {
            node.put("cause", cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
        return node;
    }

    private JsonNode outputs(Map<String, Object> outputs) {
        ObjectNode node = objectMapper.createObjectNode();
        outputs.forEach((name, value) -> {
            try {
                node.set(name, objectMapper.valueToTree(value));
            } catch (IllegalArgumentException e) {
                log.debug("Output {} is not serializable, rendering as string: {}", name, e.getMessage());
                node.put(name, String.valueOf(value));
            }
        });
        return node;
    }
}
