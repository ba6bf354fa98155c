package com.trellis.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of a registered task, as handed out to callers and the dashboard.
 *
 * @param id           caller-assigned task identifier
 * @param status       current lifecycle status
 * @param agentId      agent that owns (or is running) the task; may be null
 * @param dependencies ids this task depends on, in registration order
 * @param dependents   ids of tasks that directly depend on this one
 * @param metadata     arbitrary caller-supplied data
 * @param result       result payload once COMPLETED, otherwise null
 * @param error        failure message once FAILED, otherwise null
 * @param registeredAt when the task was (re-)registered
 * @param startedAt    when the task entered RUNNING
 * @param completedAt  when the task entered COMPLETED
 * @param failedAt     when the task entered FAILED
 */
public record TaskSnapshot(
    String id,
    TaskStatus status,
    String agentId,
    List<String> dependencies,
    List<String> dependents,
    Map<String, Object> metadata,
    Object result,
    String error,
    Instant registeredAt,
    Instant startedAt,
    Instant completedAt,
    Instant failedAt
) implements Serializable {

    public boolean hasResult() {
        return result != null;
    }

    public boolean hasError() {
        return error != null;
    }
}
