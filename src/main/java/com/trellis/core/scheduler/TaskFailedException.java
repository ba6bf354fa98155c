package com.trellis.core.scheduler;

import com.trellis.core.CoordinationException;

/**
 * Completes a task's future exceptionally when the task is marked FAILED.
 * The original error, when there is one, is the cause.
 */
public class TaskFailedException extends CoordinationException {

    private final String taskId;

    public TaskFailedException(String taskId, String message, Throwable cause) {
        super("Task " + taskId + " failed: " + message, cause);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
