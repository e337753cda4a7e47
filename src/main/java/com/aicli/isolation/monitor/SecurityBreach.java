package com.aicli.isolation.monitor;

import com.aicli.isolation.core.model.Severity;

import java.time.Instant;

/**
 * A detected security incident.
 *
 * @param type        e.g. {@code privilege_escalation}; unknown types get the generic response
 * @param description human readable summary
 * @param evidence    detector payload
 * @param riskLevel   severity of the resulting alert
 * @param timestamp   when the breach was detected
 */
public record SecurityBreach(
    String type,
    String description,
    Object evidence,
    Severity riskLevel,
    Instant timestamp
) {

    public static SecurityBreach of(BreachType type, String description, Object evidence, Severity riskLevel) {
        return new SecurityBreach(type.value(), description, evidence, riskLevel, Instant.now());
    }

    public BreachType breachType() {
        return BreachType.fromValue(type);
    }
}
