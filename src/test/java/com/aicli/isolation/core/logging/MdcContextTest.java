package com.aicli.isolation.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void breachSetsWorkspaceAndType() {
        MdcContext.setBreach("ws-1", "privilege_escalation");

        assertEquals("ws-1", MDC.get("workspaceId"));
        assertEquals("privilege_escalation", MDC.get("breachType"));
    }

    @Test
    void clearRemovesOnlyIsolationKeys() {
        MDC.put("requestId", "r-1");
        MdcContext.setWorkspace("ws-1");
        MdcContext.setCheck("network");

        MdcContext.clear();

        assertNull(MDC.get("workspaceId"));
        assertNull(MDC.get("monitorCheck"));
        assertEquals("r-1", MDC.get("requestId"));
    }

    @Test
    void clearBreachKeepsEnclosingCheck() {
        MdcContext.setCheck("process");
        MdcContext.setBreach("ws-1", "privilege_escalation");

        MdcContext.clearBreach();

        assertNull(MDC.get("workspaceId"));
        assertNull(MDC.get("breachType"));
        assertEquals("process", MDC.get("monitorCheck"));
    }
}
