package com.aicli.isolation.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for workspace isolation and security monitoring.
 */
public class IsolationMetrics {

    private final MeterRegistry registry;

    public IsolationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordProfileCreated(String isolationLevel) {
        Counter.builder("aicli.isolation.profiles.created")
                .tag("level", isolationLevel)
                .register(registry)
                .increment();
    }

    public void recordAlert(String type, String severity) {
        Counter.builder("aicli.isolation.alerts")
                .description("Security alerts emitted by the monitor")
                .tag("type", type)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    /**
     * @param reason "channel_full" or "dispatch_rejected"
     */
    public void recordAlertDropped(String reason) {
        Counter.builder("aicli.isolation.alerts.dropped")
                .description("Alerts dropped under backpressure")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordViolation(String type) {
        Counter.builder("aicli.isolation.violations")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    public void recordBreach(String type) {
        Counter.builder("aicli.isolation.breaches")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    public void recordMonitorTick(long ms) {
        Timer.builder("aicli.isolation.monitor.tick")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
