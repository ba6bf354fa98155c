package com.trellis.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An immutable, sequence-numbered snapshot of a thread's state.
 *
 * @param checkpointId unique identifier
 * @param threadId     owning thread
 * @param sequence     strictly increasing per thread; the ordering key
 * @param phase        phase tag
 * @param payload      the snapshot itself
 * @param metadata     descriptive metadata
 * @param superseded   true once hidden by a revert to an earlier checkpoint
 * @param createdAt    write time (informational only, never used for ordering)
 */
public record Checkpoint(
    String checkpointId,
    String threadId,
    long sequence,
    CheckpointPhase phase,
    Map<String, Object> payload,
    Map<String, Object> metadata,
    boolean superseded,
    Instant createdAt
) implements Serializable {
}
