package com.taskgraph.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.actions.ActionCatalog;
import com.taskgraph.actions.ActionDefinition;
import com.taskgraph.engine.report.GraphResultRenderer;
import com.taskgraph.engine.solver.SolverProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires solver settings, the action catalog and result rendering.
 * Actions are contributed as {@link ActionDefinition} beans.
 */
@Configuration
@EnableConfigurationProperties(SolverConfigProperties.class)
public class SolverConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SolverConfiguration.class);

    @Bean
    public SolverProperties solverProperties(SolverConfigProperties config) {
        SolverProperties properties = config.toSolverProperties();
        log.info("Solver concurrency {} with type limits {}", properties.concurrency(),
            properties.typeConcurrencyLimits());
        return properties;
    }

    @Bean
    public ActionCatalog actionCatalog(ObjectMapper objectMapper, ObjectProvider<ActionDefinition> definitions) {
        ActionCatalog catalog = new ActionCatalog(objectMapper);
        definitions.orderedStream().forEach(catalog::register);
        log.info("Action catalog loaded with {} action(s)", catalog.size());
        return catalog;
    }

    @Bean
    public GraphResultRenderer graphResultRenderer(ObjectMapper objectMapper) {
        return new GraphResultRenderer(objectMapper);
    }
}
