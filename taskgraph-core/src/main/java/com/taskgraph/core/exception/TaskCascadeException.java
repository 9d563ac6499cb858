package com.taskgraph.core.exception;

import java.util.ArrayList;
import java.util.List;

/**
 * Recorded on a task that was cancelled because one of its dependencies failed.
 *
 * <p>The cause is always the error of the task that originally failed, never another
 * cascade error. The chain lists the cancelled task first and the failing task last.</p>
 */
public class TaskCascadeException extends TaskGraphException {
    
    public static final String ERROR_CODE = "DEPENDENCY_FAILED";
    
    private final List<String> chain;
    
    private TaskCascadeException(List<String> chain, TaskGraphException rootError) {
        super(ERROR_CODE, String.format(
            "Task %s was cancelled because dependency %s failed: %s",
            chain.get(0), chain.get(chain.size() - 1), rootError.getMessage()
        ), rootError);
        this.chain = List.copyOf(chain);
    }
    
    /**
     * Build the cascade error for {@code taskKey}, whose dependency {@code dependencyKey}
     * ended with {@code dependencyError}. Cascades are flattened so the root cause is kept.
     */
    public static TaskCascadeException of(String taskKey, String dependencyKey, TaskGraphException dependencyError) {
        List<String> chain = new ArrayList<>();
        chain.add(taskKey);
        if (dependencyError instanceof TaskCascadeException cascade) {
            chain.addAll(cascade.getChain());
            return new TaskCascadeException(chain, cascade.getRootError());
        }
        chain.add(dependencyKey);
        return new TaskCascadeException(chain, dependencyError);
    }
    
    /**
     * Keys from the cancelled task down to the task that failed.
     */
    public List<String> getChain() {
        return chain;
    }
    
    public String getFailedTaskKey() {
        return chain.get(chain.size() - 1);
    }
    
    public TaskGraphException getRootError() {
        return (TaskGraphException) getCause();
    }
}
