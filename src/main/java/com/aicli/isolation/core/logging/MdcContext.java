package com.aicli.isolation.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing isolation-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setWorkspace(String workspaceId) {
        MDC.put("workspaceId", workspaceId);
    }

    public static void setBreach(String workspaceId, String breachType) {
        MDC.put("workspaceId", workspaceId);
        MDC.put("breachType", breachType);
    }

    public static void setCheck(String checkName) {
        MDC.put("monitorCheck", checkName);
    }

    /** Removes the keys set by {@link #setBreach}; an enclosing check name stays in place. */
    public static void clearBreach() {
        MDC.remove("workspaceId");
        MDC.remove("breachType");
    }

    public static void clear() {
        MDC.remove("workspaceId");
        MDC.remove("breachType");
        MDC.remove("monitorCheck");
    }
}
