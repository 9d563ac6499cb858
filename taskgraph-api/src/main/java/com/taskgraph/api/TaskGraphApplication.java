package com.taskgraph.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for the Task Graph service.
 */
@SpringBootApplication
@ComponentScan(basePackages = {
    "com.taskgraph.api",
    "com.taskgraph.engine"
})
public class TaskGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskGraphApplication.class, args);
    }
}
