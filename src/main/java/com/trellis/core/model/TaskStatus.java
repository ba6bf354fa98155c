package com.trellis.core.model;

/**
 * Lifecycle status of a task in the dependency registry.
 */
public enum TaskStatus {
    PENDING,
    READY,
    RUNNING,
    COMPLETED,
    FAILED,
    BLOCKED;  // a transitive dependency failed

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
