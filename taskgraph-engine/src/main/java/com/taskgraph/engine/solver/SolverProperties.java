package com.taskgraph.engine.solver;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Tuning for one solver run.
 *
 * @param concurrency maximum number of tasks checking status or processing at once
 * @param typeConcurrencyLimits optional tighter limits per task type
 * @param shutdownTimeout how long {@link GraphSolver#close()} waits for running tasks
 */
public record SolverProperties(
    int concurrency,
    Map<String, Integer> typeConcurrencyLimits,
    Duration shutdownTimeout
) {
    public static final String CONCURRENCY_ENV = "TASKGRAPH_TASK_CONCURRENCY_LIMIT";
    public static final int DEFAULT_CONCURRENCY = 6;
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    public SolverProperties {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1: " + concurrency);
        }
        typeConcurrencyLimits = typeConcurrencyLimits == null ? Map.of() : Map.copyOf(typeConcurrencyLimits);
        typeConcurrencyLimits.forEach((type, limit) -> {
            if (limit == null || limit < 1) {
                throw new IllegalArgumentException("concurrency limit for type " + type + " must be at least 1: " + limit);
            }
        });
        shutdownTimeout = shutdownTimeout == null ? DEFAULT_SHUTDOWN_TIMEOUT : shutdownTimeout;
    }

    /**
     * Defaults, with the global limit taken from {@value #CONCURRENCY_ENV} when set.
     */
    public static SolverProperties defaults() {
        return new SolverProperties(concurrencyFromEnvironment(System.getenv()), Map.of(), DEFAULT_SHUTDOWN_TIMEOUT);
    }

    public static SolverProperties withConcurrency(int concurrency) {
        return new SolverProperties(concurrency, Map.of(), DEFAULT_SHUTDOWN_TIMEOUT);
    }

    /**
     * Copy with a per-type limit added.
     */
    public SolverProperties withTypeLimit(String type, int limit) {
        Map<String, Integer> limits = new HashMap<>(typeConcurrencyLimits);
        limits.put(type, limit);
        return new SolverProperties(concurrency, limits, shutdownTimeout);
    }

    public SolverProperties withShutdownTimeout(Duration timeout) {
        return new SolverProperties(concurrency, typeConcurrencyLimits, timeout);
    }

    /**
     * Limit for a task type, unbounded when none is configured.
     */
    public int typeLimit(String type) {
        return typeConcurrencyLimits.getOrDefault(type, Integer.MAX_VALUE);
    }

    static int concurrencyFromEnvironment(Map<String, String> environment) {
        String value = environment.get(CONCURRENCY_ENV);
        if (value == null || value.isBlank()) {
            return DEFAULT_CONCURRENCY;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 1) {
                throw new IllegalArgumentException(CONCURRENCY_ENV + " must be at least 1, got " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(CONCURRENCY_ENV + " must be an integer, got " + value, e);
        }
    }
}
