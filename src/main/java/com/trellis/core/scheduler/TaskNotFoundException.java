package com.trellis.core.scheduler;

import com.trellis.core.CoordinationException;

public class TaskNotFoundException extends CoordinationException {

    public TaskNotFoundException(String taskId) {
        super("Task " + taskId + " not found");
    }
}
