package com.taskgraph.api.rest;

import com.taskgraph.actions.ActionCatalog;
import com.taskgraph.actions.ActionDefinition;
import com.taskgraph.actions.ActionKind;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API listing the actions runs can be started for.
 */
@RestController
@RequestMapping("/api/v1/actions")
public class ActionController {

    private final ActionCatalog catalog;

    public ActionController(ActionCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * All actions in key order, optionally only those of one kind ({@code build}, {@code deploy}, ...).
     */
    @GetMapping
    public ResponseEntity<List<ActionResponse>> listActions(@RequestParam(required = false) String kind) {
        ActionKind filter = kind != null ? ActionKind.fromType(kind) : null;
        List<ActionResponse> responses = catalog.definitions().stream()
            .filter(definition -> filter == null || definition.kind() == filter)
            .map(ActionResponse::from)
            .toList();
        return ResponseEntity.ok(responses);
    }

    @GetMapping("/{key}")
    public ResponseEntity<ActionResponse> getAction(@PathVariable String key) {
        return ResponseEntity.ok(ActionResponse.from(catalog.get(key)));
    }

    public record ActionResponse(
        String key,
        ActionKind kind,
        String name,
        String description,
        String version,
        List<String> dependencies,
        List<String> statusDependencies,
        boolean hasStatusCheck
    ) {
        public static ActionResponse from(ActionDefinition definition) {
            return new ActionResponse(
                definition.key(),
                definition.kind(),
                definition.name(),
                definition.description(),
                definition.version(),
                definition.dependencies(),
                definition.statusDependencies(),
                definition.hasStatusHandler()
            );
        }
    }
}
