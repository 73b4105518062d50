package com.cohort.core.logging;

import org.slf4j.MDC;

/**
 * Cohort MDC keys for structured logging. Callers clear in a {@code finally} block.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setAgent(String agentId) {
        MDC.put("agentId", agentId);
    }

    public static void setThread(String agentId, String threadId) {
        MDC.put("agentId", agentId);
        MDC.put("threadId", threadId);
    }

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void clearTask() {
        MDC.remove("taskId");
    }

    public static void clear() {
        MDC.remove("agentId");
        MDC.remove("threadId");
        MDC.remove("taskId");
    }
}
