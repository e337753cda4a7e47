package com.aicli.isolation.monitor;

import com.aicli.isolation.core.model.Severity;

import java.time.Instant;

/**
 * Unified notification emitted for violations, breaches and anomalies.
 *
 * @param data the violation, breach or detector evidence behind the alert; may be {@code null}
 */
public record SecurityAlert(
    AlertType type,
    String workspaceId,
    Severity severity,
    String message,
    Instant timestamp,
    Object data
) {}
