package com.aicli.isolation.monitor;

import com.aicli.isolation.core.logging.SecurityAuditLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;

/**
 * Starts the {@link SecurityMonitor} with the application context and drains its alert channel
 * into the security audit log until the monitor is stopped.
 */
public class MonitoringLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(MonitoringLifecycle.class);

    static final Duration POLL_TIMEOUT = Duration.ofSeconds(1);

    private final SecurityMonitor monitor;
    private final SecurityAuditLog auditLog;
    private Thread drainThread;

    public MonitoringLifecycle(SecurityMonitor monitor, SecurityAuditLog auditLog) {
        this.monitor = monitor;
        this.auditLog = auditLog;
    }

    @Override
    public synchronized void start() {
        if (monitor.isRunning()) {
            return;
        }
        AlertChannel channel = monitor.startMonitoring();
        drainThread = new Thread(() -> drain(channel), "alert-drain");
        drainThread.setDaemon(true);
        drainThread.start();
    }

    @Override
    public synchronized void stop() {
        monitor.stopMonitoring();
        if (drainThread != null) {
            try {
                drainThread.join(POLL_TIMEOUT.multipliedBy(2).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            drainThread = null;
        }
    }

    @Override
    public boolean isRunning() {
        return monitor.isRunning();
    }

    void drain(AlertChannel channel) {
        while (!channel.isDrained()) {
            try {
                SecurityAlert alert = channel.poll(POLL_TIMEOUT);
                if (alert != null) {
                    auditLog.record(alert.workspaceId(), "alert", alert);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Alert drain interrupted with {} alert(s) pending", channel.size());
                return;
            }
        }
        log.debug("Alert channel closed and drained");
    }
}
