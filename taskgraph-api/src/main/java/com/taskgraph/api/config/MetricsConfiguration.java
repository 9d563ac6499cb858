package com.taskgraph.api.config;

import com.taskgraph.engine.metrics.SolverMetrics;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Metric export settings for the solver service.
 * {@link SolverMetrics} registers itself as a meter binder; this adds common tags
 * and latency histograms for task and batch durations.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> solverCommonTags(
            @Value("${spring.application.name:taskgraph}") String application) {
        return registry -> registry.config()
            .commonTags("application", application);
    }

    @Bean
    public MeterFilter solverDurationHistograms() {
        return new MeterFilter() {
            @Override
            public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                if (id.getName().equals(SolverMetrics.TASK_DURATION)) {
                    return histogram(Duration.ofMillis(5), Duration.ofMinutes(10)).merge(config);
                }
                if (id.getName().equals(SolverMetrics.BATCH_DURATION)) {
                    return histogram(Duration.ofMillis(50), Duration.ofHours(1)).merge(config);
                }
                return config;
            }
        };
    }

    private static DistributionStatisticConfig histogram(Duration min, Duration max) {
        return DistributionStatisticConfig.builder()
            .percentilesHistogram(true)
            .percentiles(0.5, 0.95, 0.99)
            .minimumExpectedValue((double) min.toNanos())
            .maximumExpectedValue((double) max.toNanos())
            .build();
    }
}
