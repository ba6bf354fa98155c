package com.trellis.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Trellis-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String THREAD_ID = "threadId";
    public static final String TASK_ID = "taskId";
    public static final String AGENT_ID = "agentId";
    public static final String OPERATION = "operation";

    private MdcContext() {}

    public static void setThread(String threadId) {
        MDC.put(THREAD_ID, threadId);
    }

    public static void setTask(String taskId, String agentId) {
        MDC.put(TASK_ID, taskId);
        if (agentId != null) {
            MDC.put(AGENT_ID, agentId);
        }
    }

    public static void setOperation(String threadId, String operation) {
        MDC.put(THREAD_ID, threadId);
        MDC.put(OPERATION, operation);
    }

    public static void clearOperation() {
        MDC.remove(OPERATION);
    }

    public static void clear() {
        MDC.remove(THREAD_ID);
        MDC.remove(TASK_ID);
        MDC.remove(AGENT_ID);
        MDC.remove(OPERATION);
    }
}
