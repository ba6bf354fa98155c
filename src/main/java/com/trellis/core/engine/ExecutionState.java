package com.trellis.core.engine;

public enum ExecutionState {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED
}
