package com.trellis.core.scheduler;

import com.trellis.core.CoordinationException;

import java.util.List;

/**
 * Thrown when registering a task would close a cycle in the dependency graph.
 * The registry is left untouched.
 */
public class DependencyCycleException extends CoordinationException {

    private final String taskId;
    private final List<String> cycle;

    public DependencyCycleException(String taskId, List<String> cycle) {
        super("Circular dependency detected for task " + taskId + ": " + String.join(" -> ", cycle));
        this.taskId = taskId;
        this.cycle = List.copyOf(cycle);
    }

    public String getTaskId() {
        return taskId;
    }

    /** The offending path, starting and ending at the task being registered. */
    public List<String> getCycle() {
        return cycle;
    }
}
