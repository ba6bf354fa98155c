package com.trellis.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregate statistics over the threads known to the checkpointer.
 *
 * @param activeThreads    threads still open
 * @param totalCheckpoints checkpoints across all listed threads
 * @param pendingApprovals approval requests still awaiting a decision
 * @param threads          per-thread detail
 */
public record ThreadStats(
    int activeThreads,
    long totalCheckpoints,
    int pendingApprovals,
    List<ThreadSummary> threads
) {
    public record ThreadSummary(
        String threadId,
        ThreadStatus status,
        long checkpoints,
        Instant createdAt,
        Map<String, Object> metadata
    ) {}
}
