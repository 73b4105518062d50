package com.cohort.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("setThread populates agent and thread keys")
    void setThread() {
        MdcContext.setThread("agent-1", "thread-1");

        assertEquals("agent-1", MDC.get("agentId"));
        assertEquals("thread-1", MDC.get("threadId"));
    }

    @Test
    @DisplayName("clearTask keeps the session keys")
    void clearTask() {
        MdcContext.setThread("agent-1", "thread-1");
        MdcContext.setTask("task-1");
        assertEquals("task-1", MDC.get("taskId"));

        MdcContext.clearTask();

        assertNull(MDC.get("taskId"));
        assertEquals("thread-1", MDC.get("threadId"));
    }

    @Test
    @DisplayName("clear removes only cohort keys")
    void clear() {
        MDC.put("requestId", "r-1");
        MdcContext.setAgent("agent-1");
        MdcContext.setTask("task-1");

        MdcContext.clear();

        assertNull(MDC.get("agentId"));
        assertNull(MDC.get("taskId"));
        assertEquals("r-1", MDC.get("requestId"));
    }
}
