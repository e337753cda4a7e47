package com.aicli.isolation.monitor;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Actuator health for the security monitor. DOWN while stopped; includes alert and violation
 * counts from the dashboard.
 */
public class SecurityMonitorHealthIndicator implements HealthIndicator {

    private final SecurityMonitor monitor;

    public SecurityMonitorHealthIndicator(SecurityMonitor monitor) {
        this.monitor = monitor;
    }

    @Override
    public Health health() {
        SecurityDashboard dashboard = monitor.getSecurityDashboard();
        var builder = monitor.isRunning() ? Health.up() : Health.down();
        return builder
                .withDetail("status", dashboard.monitoringStatus())
                .withDetail("totalAlerts", dashboard.totalAlerts())
                .withDetail("criticalAlerts", dashboard.criticalAlerts())
                .withDetail("droppedAlerts", dashboard.droppedAlerts())
                .withDetail("pendingAlerts", dashboard.pendingAlerts())
                .withDetail("workspacesWithViolations", dashboard.activeWorkspaces().size())
                .build();
    }
}
