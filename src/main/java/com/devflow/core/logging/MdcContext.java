package com.devflow.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing devflow-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setExecution(String executionId, String action, String project) {
        MDC.put("executionId", executionId);
        MDC.put("action", action);
        if (project != null) {
            MDC.put("project", project);
        } else {
            MDC.remove("project");
        }
    }

    public static void setBatch(String batchId) {
        MDC.put("batchId", batchId);
    }

    public static void clear() {
        MDC.remove("executionId");
        MDC.remove("action");
        MDC.remove("project");
        MDC.remove("batchId");
    }
}
