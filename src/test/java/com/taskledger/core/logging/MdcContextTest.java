package com.taskledger.core.logging;

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
    @DisplayName("setPlan sets plan and thread ids")
    void setPlan() {
        MdcContext.setPlan("p1", "worker-1");

        assertEquals("p1", MDC.get("planId"));
        assertEquals("worker-1", MDC.get("threadId"));
    }

    @Test
    @DisplayName("setTask sets plan, batch and task")
    void setTask() {
        MdcContext.setTask("p1", 2, "p1-2-1");

        assertEquals("p1", MDC.get("planId"));
        assertEquals("2", MDC.get("batchIndex"));
        assertEquals("p1-2-1", MDC.get("taskId"));
    }

    @Test
    @DisplayName("clear removes only the ledger keys")
    void clear() {
        MDC.put("requestId", "r-1");
        MdcContext.setPlan("p1", "worker-1");
        MdcContext.setTask("p1", 0, "t");

        MdcContext.clear();

        assertNull(MDC.get("planId"));
        assertNull(MDC.get("threadId"));
        assertNull(MDC.get("batchIndex"));
        assertNull(MDC.get("taskId"));
        assertEquals("r-1", MDC.get("requestId"));
    }
}
