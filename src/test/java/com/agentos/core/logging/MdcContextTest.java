package com.agentos.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setTask puts goalId and taskId in MDC")
    void setTask() {
        MdcContext.setTask("g1", "g1-task-1");
        assertEquals("g1", MDC.get("goalId"));
        assertEquals("g1-task-1", MDC.get("taskId"));
    }

    @Test
    @DisplayName("clearTask keeps the goal but drops task and worker")
    void clearTask() {
        MdcContext.setTask("g1", "g1-task-1");
        MdcContext.setWorker("builder");

        MdcContext.clearTask();

        assertEquals("g1", MDC.get("goalId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("workerId"));
    }

    @Test
    @DisplayName("clear removes every key")
    void clear() {
        MdcContext.setGoal("g1");
        MdcContext.setWorker("builder");
        MdcContext.clear();
        assertNull(MDC.get("goalId"));
        assertNull(MDC.get("workerId"));
    }
}
