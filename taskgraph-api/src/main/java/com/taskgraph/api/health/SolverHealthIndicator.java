package com.taskgraph.api.health;

import com.taskgraph.actions.ActionCatalog;
import com.taskgraph.engine.lifecycle.GracefulShutdownHandler;
import com.taskgraph.engine.metrics.SolverMetrics;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of the solver service.
 * Reports down while shutting down, otherwise up with run and queue counts.
 */
@Component
public class SolverHealthIndicator implements HealthIndicator {

    private final GracefulShutdownHandler shutdownHandler;
    private final SolverMetrics metrics;
    private final ActionCatalog catalog;

    public SolverHealthIndicator(
            GracefulShutdownHandler shutdownHandler,
            SolverMetrics metrics,
            ActionCatalog catalog) {
        this.shutdownHandler = shutdownHandler;
        this.metrics = metrics;
        this.catalog = catalog;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("registeredRuns", shutdownHandler.getRegisteredRunCount());
        details.put("activeRuns", shutdownHandler.getActiveRunCount());
        details.put("tasksInProgress", metrics.getInProgress());
        details.put("tasksQueued", metrics.getQueued());
        details.put("actions", catalog.size());

        if (shutdownHandler.isShuttingDown()) {
            return Health.down()
                .withDetail("reason", "shutting down")
                .withDetails(details)
                .build();
        }
        return Health.up()
            .withDetails(details)
            .build();
    }
}
