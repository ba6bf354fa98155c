package com.trellis.core.model;

import java.util.List;

/**
 * Transitive closure of a task's dependencies, for visualization and debugging.
 *
 * @param taskId     the task the chain was computed for
 * @param entries    the task itself at depth 0 followed by its transitive dependencies
 * @param totalDepth deepest level reached
 */
public record DependencyChain(String taskId, List<Entry> entries, int totalDepth) {

    /**
     * One node of the chain. Dependencies that were referenced but never registered
     * are reported with {@code registered = false} and a null status.
     */
    public record Entry(String taskId, TaskStatus status, int depth,
                        List<String> dependencies, boolean registered) {}
}
