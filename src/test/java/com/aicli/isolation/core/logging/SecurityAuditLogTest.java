package com.aicli.isolation.core.logging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SecurityAuditLogTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void writesSingleLineJson() throws Exception {
        var auditLog = new SecurityAuditLog();

        String line = auditLog.record("ws-1", "privilege_escalation", Map.of("pid", 42));

        assertNotNull(line);
        assertFalse(line.contains("\n"));
        JsonNode json = mapper.readTree(line);
        assertEquals("ws-1", json.get("workspaceId").asText());
        assertEquals("privilege_escalation", json.get("event").asText());
        assertEquals(42, json.get("details").get("pid").asInt());
        assertTrue(json.get("timestamp").isTextual(), "timestamps are ISO-8601 strings");
    }

    @Test
    void disabledAuditWritesNothing() {
        var auditLog = new SecurityAuditLog();
        auditLog.setEnabled(false);

        assertFalse(auditLog.isEnabled());
        assertNull(auditLog.record("ws-1", "alert", Map.of()));
    }

    @Test
    void unserialisableDetailsFallBackToPlainForm() {
        var auditLog = new SecurityAuditLog();

        String line = auditLog.record("ws-1", "alert", new Object());

        assertNotNull(line);
        assertTrue(line.contains("workspaceId=ws-1"));
    }
}
