package com.trellis.core.engine;

import com.trellis.core.config.TrellisProperties;

import java.time.Duration;

/**
 * Retry, checkpoint and approval knobs applied by an {@link ExecutionSession}.
 *
 * @param maxRetries           extra attempts after the first failure
 * @param retryDelay           base backoff; attempt {@code n} waits {@code retryDelay * n}
 * @param checkpointingEnabled write pre/post/failure checkpoints
 * @param approvalGatesEnabled consult the approval policy before executing
 * @param approvalTimeout      how long an approval may stay pending
 */
public record ExecutionSettings(
    int maxRetries,
    Duration retryDelay,
    boolean checkpointingEnabled,
    boolean approvalGatesEnabled,
    Duration approvalTimeout
) {

    public static ExecutionSettings from(TrellisProperties.Execution execution) {
        return new ExecutionSettings(
                execution.getMaxRetries(),
                Duration.ofMillis(execution.getRetryDelayMs()),
                execution.isCheckpointingEnabled(),
                execution.isApprovalGatesEnabled(),
                Duration.ofMillis(execution.getApprovalTimeoutMs()));
    }

    public ExecutionSettings withMaxRetries(int retries) {
        return new ExecutionSettings(retries, retryDelay, checkpointingEnabled, approvalGatesEnabled, approvalTimeout);
    }

    public ExecutionSettings withRetryDelay(Duration delay) {
        return new ExecutionSettings(maxRetries, delay, checkpointingEnabled, approvalGatesEnabled, approvalTimeout);
    }
}
