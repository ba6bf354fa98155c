package com.trellis.core.engine;

import com.trellis.core.CoordinationException;

public class ExecutionCancelledException extends CoordinationException {

    public ExecutionCancelledException(String operation, int attempt) {
        super("Operation " + operation + " cancelled before attempt " + attempt);
    }
}
