package com.trellis.core.model;

import java.util.Arrays;

/**
 * Phase tag recorded with each checkpoint. The wire form is the lower-case tag.
 */
public enum CheckpointPhase {
    PRE_EXECUTION("pre_execution"),
    POST_EXECUTION("post_execution"),
    EXECUTION_FAILURE("execution_failure"),
    EXECUTION_FAILED("execution_failed"),
    THREAD_CLOSED("thread_closed"),
    MANUAL("manual");

    private final String tag;

    CheckpointPhase(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Resolves a tag (or enum name) to a phase, falling back to {@link #MANUAL}.
     */
    public static CheckpointPhase fromTag(String value) {
        if (value == null || value.isBlank()) {
            return MANUAL;
        }
        return Arrays.stream(values())
                .filter(p -> p.tag.equalsIgnoreCase(value) || p.name().equalsIgnoreCase(value))
                .findFirst()
                .orElse(MANUAL);
    }
}
