package com.trellis.core.persistence;

import com.trellis.core.CoordinationException;

/**
 * Thrown when a revert targets a checkpoint that does not exist in the thread's
 * visible history.
 */
public class CheckpointNotFoundException extends CoordinationException {

    public CheckpointNotFoundException(String threadId, String checkpointId) {
        super("Checkpoint " + checkpointId + " not found in thread " + threadId);
    }
}
