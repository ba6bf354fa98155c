package com.trellis.core.model;

public enum ThreadStatus {
    ACTIVE,
    CLOSED
}
