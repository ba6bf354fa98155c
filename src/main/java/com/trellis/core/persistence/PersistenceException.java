package com.trellis.core.persistence;

import com.trellis.core.CoordinationException;

/**
 * Thrown when the checkpoint store cannot read or write.
 */
public class PersistenceException extends CoordinationException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
