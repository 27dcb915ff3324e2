package com.taskledger.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing ledger MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPlan(String planId, String threadId) {
        MDC.put("planId", planId);
        if (threadId != null) {
            MDC.put("threadId", threadId);
        }
    }

    public static void setBatch(String planId, int batchIndex) {
        MDC.put("planId", planId);
        MDC.put("batchIndex", String.valueOf(batchIndex));
    }

    public static void setTask(String planId, int batchIndex, String taskId) {
        setBatch(planId, batchIndex);
        MDC.put("taskId", taskId);
    }

    public static void clear() {
        MDC.remove("planId");
        MDC.remove("threadId");
        MDC.remove("batchIndex");
        MDC.remove("taskId");
    }
}
