package com.taskgraph.api.config;

import com.taskgraph.engine.solver.SolverProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Solver settings bound from {@code taskgraph.solver.*}.
 *
 * <pre>
 * taskgraph:
 *   solver:
 *     concurrency: 8
 *     type-limits:
 *       deploy: 2
 *     shutdown-timeout: 30s
 *     default-deadline: 30m
 * </pre>
 */
@ConfigurationProperties(prefix = "taskgraph.solver")
public class SolverConfigProperties {

    /**
     * Global limit on tasks checking status or processing. Falls back to the
     * {@value SolverProperties#CONCURRENCY_ENV} environment variable, then to the default.
     */
    private Integer concurrency;

    private Map<String, Integer> typeLimits = new LinkedHashMap<>();

    private Duration shutdownTimeout = SolverProperties.DEFAULT_SHUTDOWN_TIMEOUT;

    /**
     * Deadline applied to runs that do not ask for one. Unset means no deadline.
     */
    private Duration defaultDeadline;

    public SolverProperties toSolverProperties() {
        int effective = concurrency != null ? concurrency : SolverProperties.defaults().concurrency();
        return new SolverProperties(effective, typeLimits, shutdownTimeout);
    }

    public Integer getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(Integer concurrency) {
        this.concurrency = concurrency;
    }

    public Map<String, Integer> getTypeLimits() {
        return typeLimits;
    }

    public void setTypeLimits(Map<String, Integer> typeLimits) {
        this.typeLimits = typeLimits;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Duration getDefaultDeadline() {
        return defaultDeadline;
    }

    public void setDefaultDeadline(Duration defaultDeadline) {
        this.defaultDeadline = defaultDeadline;
    }
}
