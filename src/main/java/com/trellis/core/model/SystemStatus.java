package com.trellis.core.model;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time summary of the dependency registry. Carries no wall-clock field,
 * so two snapshots of an unchanged registry are equal.
 *
 * @param totalTasks          number of registered tasks
 * @param runningTasks        number of tasks currently RUNNING
 * @param statusCounts        count per status; every status is present
 * @param dependencyGraphSize number of ids that have at least one dependent
 * @param tasks               all tasks in registration order
 */
public record SystemStatus(
    int totalTasks,
    int runningTasks,
    Map<TaskStatus, Long> statusCounts,
    int dependencyGraphSize,
    List<TaskSnapshot> tasks
) {
    public long count(TaskStatus status) {
        return statusCounts.getOrDefault(status, 0L);
    }
}
