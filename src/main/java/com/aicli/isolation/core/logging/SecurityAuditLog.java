package com.aicli.isolation.core.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes security audit events as single-line JSON to the {@code aicli.security.audit} logger,
 * which logback routes to its own appender.
 */
public class SecurityAuditLog {

    public static final String LOGGER_NAME = "aicli.security.audit";

    private static final Logger audit = LoggerFactory.getLogger(LOGGER_NAME);
    private static final Logger log = LoggerFactory.getLogger(SecurityAuditLog.class);

    private final ObjectMapper mapper;
    private volatile boolean enabled = true;

    public SecurityAuditLog() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
    }

    public SecurityAuditLog(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Records one audit event.
     *
     * @return the JSON line written, or {@code null} when auditing is disabled
     */
    public String record(String workspaceId, String event, Object details) {
        if (!enabled) {
            return null;
        }
        var entry = new LinkedHashMap<String, Object>();
        entry.put("timestamp", Instant.now());
        entry.put("workspaceId", workspaceId);
        entry.put("event", event);
        entry.put("details", details);
        String line = toJson(entry);
        audit.info(line);
        return line;
    }

    String toJson(Map<String, Object> entry) {
        try {
            return mapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            log.warn("Audit entry for {} not serialisable, writing plain form: {}",
                    entry.get("workspaceId"), e.getMessage());
            return entry.toString();
        }
    }
}
