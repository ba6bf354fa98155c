package com.trellis.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A logical execution context under which checkpoints and approvals are grouped.
 *
 * @param threadId  unique identifier
 * @param namespace grouping namespace (e.g. {@code agent_specialist})
 * @param metadata  caller-supplied metadata
 * @param status    ACTIVE until explicitly closed
 * @param createdAt creation time
 * @param closedAt  close time, null while active
 */
public record ExecutionThread(
    String threadId,
    String namespace,
    Map<String, Object> metadata,
    ThreadStatus status,
    Instant createdAt,
    Instant closedAt
) implements Serializable {

    public boolean isActive() {
        return status == ThreadStatus.ACTIVE;
    }

    public ExecutionThread closed(Instant at) {
        return new ExecutionThread(threadId, namespace, metadata, ThreadStatus.CLOSED, createdAt, at);
    }
}
