package com.aicli.isolation.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class IsolationMetricsTest {

    private SimpleMeterRegistry registry;
    private IsolationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new IsolationMetrics(registry);
    }

    @Test
    void alertsTaggedByTypeAndSeverity() {
        metrics.recordAlert("resource_violation", "warning");
        metrics.recordAlert("resource_violation", "warning");
        metrics.recordAlert("security_breach", "critical");

        assertEquals(2.0, registry.get("aicli.isolation.alerts")
                .tag("type", "resource_violation").tag("severity", "warning").counter().count());
        assertEquals(1.0, registry.get("aicli.isolation.alerts")
                .tag("type", "security_breach").counter().count());
    }

    @Test
    void droppedAlertsTaggedByReason() {
        metrics.recordAlertDropped("channel_full");
        metrics.recordAlertDropped("dispatch_rejected");

        assertEquals(1.0, registry.get("aicli.isolation.alerts.dropped").tag("reason", "channel_full").counter().count());
        assertEquals(1.0, registry.get("aicli.isolation.alerts.dropped").tag("reason", "dispatch_rejected").counter().count());
    }

    @Test
    void violationsBreachesAndProfiles() {
        metrics.recordViolation("cpu_high_usage");
        metrics.recordBreach("privilege_escalation");
        metrics.recordProfileCreated("standard");

        assertEquals(1.0, registry.get("aicli.isolation.violations").tag("type", "cpu_high_usage").counter().count());
        assertEquals(1.0, registry.get("aicli.isolation.breaches").tag("type", "privilege_escalation").counter().count());
        assertEquals(1.0, registry.get("aicli.isolation.profiles.created").tag("level", "standard").counter().count());
    }

    @Test
    void monitorTickTimer() {
        metrics.recordMonitorTick(120);

        var timer = registry.get("aicli.isolation.monitor.tick").timer();
        assertEquals(1, timer.count());
        assertEquals(120.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
    }
}
