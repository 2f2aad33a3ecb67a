package com.tandem.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Tandem-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId, int attempt) {
        MDC.put("taskId", taskId);
        MDC.put("attempt", String.valueOf(attempt));
    }

    public static void setExecution(String executionId) {
        MDC.put("executionId", executionId);
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("attempt");
        MDC.remove("executionId");
    }
}
