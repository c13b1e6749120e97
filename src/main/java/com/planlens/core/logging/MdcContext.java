package com.planlens.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Planlens-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPlan(String planId) {
        if (planId != null) {
            MDC.put("planId", planId);
        }
    }

    public static void setOperation(String planId, String operation) {
        setPlan(planId);
        MDC.put("operation", operation);
    }

    public static void clear() {
        MDC.remove("planId");
        MDC.remove("operation");
    }
}
