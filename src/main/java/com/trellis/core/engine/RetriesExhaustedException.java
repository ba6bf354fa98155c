package com.trellis.core.engine;

import com.trellis.core.CoordinationException;

/**
 * Thrown once every attempt of an operation has failed. The last underlying error is the cause.
 */
public class RetriesExhaustedException extends CoordinationException {

    private final String operation;
    private final int attempts;

    public RetriesExhaustedException(String operation, int attempts, Throwable lastError) {
        super("Operation " + operation + " failed after " + attempts + " attempt"
                + (attempts != 1 ? "s" : "") + ": " + describe(lastError), lastError);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }

    private static String describe(Throwable error) {
        if (error == null) return "unknown error";
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
