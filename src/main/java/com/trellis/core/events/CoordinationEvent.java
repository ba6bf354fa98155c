package com.trellis.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A state-transition notification broadcast to the dashboard and other subscribers.
 *
 * @param eventType      event type (e.g. "task.status_changed", "checkpoint.saved", "approval.timed_out")
 * @param taskId         the task this event relates to (null for thread-level events)
 * @param threadId       the thread this event relates to (null for task-level events)
 * @param previousStatus status before the transition (null when there is none)
 * @param newStatus      status after the transition (null when there is none)
 * @param payload        arbitrary key-value data associated with the event
 * @param timestamp      when the transition happened
 */
public record CoordinationEvent(
    String eventType,
    String taskId,
    String threadId,
    String previousStatus,
    String newStatus,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static CoordinationEvent forTask(String eventType, String taskId, Object previousStatus,
                                            Object newStatus, Map<String, Object> payload) {
        return new CoordinationEvent(eventType, taskId, null, asString(previousStatus), asString(newStatus),
                payload, Instant.now());
    }

    public static CoordinationEvent forThread(String eventType, String threadId, Object previousStatus,
                                              Object newStatus, Map<String, Object> payload) {
        return new CoordinationEvent(eventType, null, threadId, asString(previousStatus), asString(newStatus),
                payload, Instant.now());
    }

    /** The id subscribers are keyed by: the task id, or the thread id for thread events. */
    public String scopeId() {
        return taskId != null ? taskId : threadId;
    }

    private static String asString(Object status) {
        return status != null ? status.toString() : null;
    }
}
