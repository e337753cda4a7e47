package com.aicli.isolation.monitor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Operator view of the monitor.
 *
 * @param totalAlerts      alerts accepted onto the alert channel since start-up
 * @param criticalAlerts   accepted alerts with critical severity
 * @param warningAlerts    accepted alerts with warning severity
 * @param droppedAlerts    alerts dropped because the channel was full or closed
 * @param pendingAlerts    alerts waiting on the channel
 * @param violationSummary recorded violations by type
 * @param monitoringStatus {@code active} or {@code stopped}
 * @param activeWorkspaces workspaces with recorded violations, sorted
 */
public record SecurityDashboard(
    long totalAlerts,
    long criticalAlerts,
    long warningAlerts,
    long droppedAlerts,
    int pendingAlerts,
    Map<String, Integer> violationSummary,
    Instant lastUpdated,
    String monitoringStatus,
    List<String> activeWorkspaces
) {}
