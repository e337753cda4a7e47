package com.aicli.isolation.monitor.detect;

import com.aicli.isolation.core.model.Severity;
import com.aicli.isolation.monitor.AlertType;
import com.aicli.isolation.monitor.BreachType;

import java.util.Map;

/**
 * Result of one detector hit. A finding with a {@code breachType} is escalated as a security
 * breach; otherwise it becomes a plain alert of {@code alertType}.
 */
public record AnomalyFinding(
    String workspaceId,
    AlertType alertType,
    BreachType breachType,
    Severity severity,
    String message,
    Map<String, Object> evidence
) {

    public AnomalyFinding {
        evidence = evidence == null ? Map.of() : Map.copyOf(evidence);
    }

    public static AnomalyFinding anomaly(String workspaceId, AlertType type, Severity severity,
                                         String message, Map<String, Object> evidence) {
        return new AnomalyFinding(workspaceId, type, null, severity, message, evidence);
    }

    public static AnomalyFinding breach(String workspaceId, BreachType type, Severity severity,
                                        String message, Map<String, Object> evidence) {
        return new AnomalyFinding(workspaceId, AlertType.SECURITY_BREACH, type, severity, message, evidence);
    }

    public boolean isBreach() {
        return breachType != null;
    }
}
