package com.aicli.isolation.monitor;

import com.aicli.isolation.config.IsolationPolicy;
import com.aicli.isolation.core.model.Severity;
import com.aicli.isolation.resource.ResourceViolation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SecurityMonitorHealthIndicatorTest {

    private final SecurityMonitor monitor = new SecurityMonitor(IsolationPolicy.defaults());
    private final SecurityMonitorHealthIndicator indicator = new SecurityMonitorHealthIndicator(monitor);

    @AfterEach
    void tearDown() {
        monitor.close();
    }

    @Test
    void downWhileStopped() {
        var health = indicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("stopped", health.getDetails().get("status"));
    }

    @Test
    void upWithCountsWhileRunning() {
        monitor.startMonitoring();
        monitor.reportViolation("ws-1", new ResourceViolation(ResourceViolation.DISK_HIGH_IO, 50, 60,
                "Disk I/O exceeded 50MB/s", Severity.INFO, Instant.now()));

        var health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("active", health.getDetails().get("status"));
        assertEquals(1L, health.getDetails().get("totalAlerts"));
        assertEquals(0L, health.getDetails().get("droppedAlerts"));
        assertEquals(1, health.getDetails().get("workspacesWithViolations"));
    }
}
