package com.trellis.core.persistence;

import com.trellis.core.CoordinationException;

public class ThreadNotFoundException extends CoordinationException {

    public ThreadNotFoundException(String threadId) {
        super("Thread " + threadId + " not found");
    }
}
