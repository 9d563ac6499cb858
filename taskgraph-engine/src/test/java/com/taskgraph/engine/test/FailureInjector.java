package com.taskgraph.engine.test;

import com.taskgraph.core.exception.TaskFailureException;
import com.taskgraph.core.task.TaskContext;

import java.time.Duration;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Seeded chaos for solver tests: random latency and random task failures.
 * Remembers which keys it failed so results can be checked against it.
 *
 * <pre>{@code
 * FailureInjector injector = FailureInjector.builder()
 *     .failureRate(0.3)
 *     .latency(Duration.ofMillis(1), Duration.ofMillis(20))
 *     .seed(42)
 *     .build();
 *
 * task.onProcess(context -> {
 *     injector.maybeDelay();
 *     injector.maybeFail(context);
 *     return TaskStatus.ready();
 * });
 * }</pre>
 */
public class FailureInjector {

    private final double failureRate;
    private final long minLatencyMs;
    private final long maxLatencyMs;
    private final Random random;
    private final Set<String> failedKeys = ConcurrentHashMap.newKeySet();

    private FailureInjector(Builder builder) {
        this.failureRate = builder.failureRate;
        this.minLatencyMs = builder.minLatency.toMillis();
        this.maxLatencyMs = builder.maxLatency.toMillis();
        this.random = new Random(builder.seed);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fail the invoking task with a domain error, at the configured rate.
     */
    public void maybeFail(TaskContext context) {
        boolean fail;
        synchronized (random) {
            fail = random.nextDouble() < failureRate;
        }
        if (fail) {
            failedKeys.add(context.getKey());
            throw new TaskFailureException("injected failure in " + context.getKey());
        }
    }

    public void maybeDelay() throws InterruptedException {
        if (maxLatencyMs <= 0) {
            return;
        }
        long delayMs;
        synchronized (random) {
            delayMs = minLatencyMs + random.nextInt((int) Math.max(1, maxLatencyMs - minLatencyMs));
        }
        Thread.sleep(delayMs);
    }

    public Set<String> failedKeys() {
        return Set.copyOf(failedKeys);
    }

    public static class Builder {
        private double failureRate;
        private Duration minLatency = Duration.ZERO;
        private Duration maxLatency = Duration.ZERO;
        private long seed = 42;

        public Builder failureRate(double rate) {
            if (rate < 0.0 || rate > 1.0) {
                throw new IllegalArgumentException("Failure rate must be between 0.0 and 1.0");
            }
            this.failureRate = rate;
            return this;
        }

        public Builder latency(Duration min, Duration max) {
            this.minLatency = min;
            this.maxLatency = max;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public FailureInjector build() {
            return new FailureInjector(this);
        }
    }
}
