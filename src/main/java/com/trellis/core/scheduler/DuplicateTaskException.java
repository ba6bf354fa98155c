package com.trellis.core.scheduler;

import com.trellis.core.CoordinationException;

/**
 * Thrown when a task id is registered while a live (non-failed) task with the same id exists.
 */
public class DuplicateTaskException extends CoordinationException {

    private final String taskId;

    public DuplicateTaskException(String taskId) {
        super("Task " + taskId + " is already registered");
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
