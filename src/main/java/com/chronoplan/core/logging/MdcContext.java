package com.chronoplan.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Chronoplan-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setOperation(String operation) {
        MDC.put("operation", operation);
    }

    public static void setProject(String operation, String projectId) {
        MDC.put("operation", operation);
        MDC.put("projectId", projectId);
    }

    public static void setOptimization(String projectId, String strategy) {
        MDC.put("operation", "optimize");
        MDC.put("projectId", projectId);
        MDC.put("strategy", strategy);
    }

    public static void clear() {
        MDC.remove("operation");
        MDC.remove("projectId");
        MDC.remove("strategy");
    }
}
