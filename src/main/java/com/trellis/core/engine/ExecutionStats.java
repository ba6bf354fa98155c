package com.trellis.core.engine;

/**
 * Point-in-time view of an {@link ExecutionSession}.
 *
 * @param threadId         the session's thread
 * @param agentType        agent type the session runs for
 * @param state            current execution state
 * @param lastCheckpointId id of the last checkpoint this session wrote, null if none
 * @param historySize      number of operations executed in this session
 * @param retryCount       failed attempts of the most recent operation
 */
public record ExecutionStats(
    String threadId,
    String agentType,
    ExecutionState state,
    String lastCheckpointId,
    int historySize,
    int retryCount
) {}
