package com.taskgraph.actions;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.core.model.GraphResult;
import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.core.task.SolvePhase;
import com.taskgraph.core.task.TaskContext;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Context provided to action handlers during a status check or processing.
 */
public class ActionContext {

    private static final TypeReference<Map<String, Object>> OUTPUTS_TYPE = new TypeReference<>() {};

    private final ActionTask action;
    private final TaskContext taskContext;
    private final ObjectMapper objectMapper;

    public ActionContext(ActionTask action, TaskContext taskContext, ObjectMapper objectMapper) {
        this.action = action;
        this.taskContext = taskContext;
        this.objectMapper = objectMapper;
    }

    public ActionTask getAction() {
        return action;
    }

    public String getKey() {
        return action.getKey();
    }

    public ActionKind getKind() {
        return action.getKind();
    }

    public String getVersion() {
        return action.getInputVersion();
    }

    public boolean isForce() {
        return action.isForce();
    }

    public SolvePhase getPhase() {
        return taskContext.getPhase();
    }

    public UUID getRunId() {
        return taskContext.getRunId();
    }

    public TaskContext getTaskContext() {
        return taskContext;
    }

    public boolean hasDependencyResult(String key) {
        return taskContext.getDependencyResult(key).isPresent();
    }

    public Optional<GraphResult> getDependencyResult(String key) {
        return taskContext.getDependencyResult(key);
    }

    /**
     * Get an output of a dependency converted to the given type.
     *
     * @throws ActionException if the dependency has no result or no such output
     */
    public <T> T getDependencyOutput(String dependencyKey, String outputName, Class<T> type) {
        Object value = taskContext.getDependencyResult(dependencyKey)
            .map(result -> result.outputs().get(outputName))
            .orElse(null);
        if (value == null) {
            throw ActionException.missingOutput(getKey(), dependencyKey, outputName);
        }
        return objectMapper.convertValue(value, type);
    }

    /**
     * Get all outputs of a dependency as a JSON tree, or an empty object.
     */
    public JsonNode getDependencyOutputs(String dependencyKey) {
        Map<String, Object> outputs = taskContext.getDependencyResult(dependencyKey)
            .map(GraphResult::outputs)
            .orElse(Map.of());
        return objectMapper.valueToTree(outputs);
    }

    public boolean isCancelled() {
        return taskContext.isCancelled();
    }

    public void throwIfCancelled() {
        taskContext.throwIfCancelled();
    }

    /**
     * Convert a bean or map into a ready status carrying its properties as outputs.
     */
    public TaskStatus ready(Object outputs) {
        return TaskStatus.ready(toOutputs(outputs));
    }

    public TaskStatus notReady() {
        return TaskStatus.notReady();
    }

    public Map<String, Object> toOutputs(Object value) {
        if (value == null) {
            return Map.of();
        }
        return objectMapper.convertValue(value, OUTPUTS_TYPE);
    }
}
