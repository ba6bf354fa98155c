package com.trellis.core.engine;

import com.trellis.core.CoordinationException;

/**
 * Thrown when the approval gate denies (or times out on) a guarded operation.
 * Terminal: the operation is never invoked and never retried.
 */
public class ExecutionRejectedException extends CoordinationException {

    private final String operation;
    private final String reason;

    public ExecutionRejectedException(String operation, String reason) {
        super("Execution rejected: " + (reason != null && !reason.isBlank() ? reason : "No reason provided"));
        this.operation = operation;
        this.reason = reason;
    }

    public String getOperation() {
        return operation;
    }

    public String getReason() {
        return reason;
    }
}
