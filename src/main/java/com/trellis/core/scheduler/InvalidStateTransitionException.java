package com.trellis.core.scheduler;

import com.trellis.core.CoordinationException;
import com.trellis.core.model.TaskStatus;

/**
 * Thrown when a lifecycle call does not match the task's current status,
 * e.g. starting a task that is not READY.
 */
public class InvalidStateTransitionException extends CoordinationException {

    private final String taskId;
    private final TaskStatus currentStatus;
    private final TaskStatus requestedStatus;

    public InvalidStateTransitionException(String taskId, TaskStatus currentStatus, TaskStatus requestedStatus) {
        super("Task " + taskId + " cannot move from " + currentStatus + " to " + requestedStatus);
        this.taskId = taskId;
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskStatus getCurrentStatus() {
        return currentStatus;
    }

    public TaskStatus getRequestedStatus() {
        return requestedStatus;
    }
}
