package com.aicli.isolation.monitor;

/**
 * Policy changes a breach response can call for. The first three are enforced through
 * {@link ContainerRemediator}; the rest are handled by the monitor itself.
 */
public enum RemediationAction {
    PAUSE_CONTAINER,
    RESTRICT_NETWORK,
    TIGHTEN_RESOURCE_LIMITS,
    CRITICAL_ALERT,
    AUDIT_LOG,
    HEIGHTEN_MONITORING,
    HEIGHTEN_FILESYSTEM_AUDIT,
    HEIGHTEN_PROCESS_MONITORING
}
