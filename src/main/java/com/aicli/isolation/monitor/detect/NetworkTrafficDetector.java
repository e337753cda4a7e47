package com.aicli.isolation.monitor.detect;

import com.aicli.isolation.core.model.Severity;
import com.aicli.isolation.core.model.WorkspaceMetrics;
import com.aicli.isolation.isolation.MonitoringConfig;
import com.aicli.isolation.monitor.AlertType;
import com.aicli.isolation.monitor.BreachType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Flags outbound traffic above the pre-warning network threshold. Sustained egress at
 * {@code breachFactor} times the threshold is reported as suspicious network activity.
 */
public class NetworkTrafficDetector implements AnomalyDetector {

    static final int DEFAULT_BREACH_FACTOR = 4;

    private final long thresholdBytesPerSecond;
    private final int breachFactor;

    public NetworkTrafficDetector() {
        this(MonitoringConfig.AlertThresholds.defaults().networkThreshold(), DEFAULT_BREACH_FACTOR);
    }

    public NetworkTrafficDetector(long thresholdBytesPerSecond, int breachFactor) {
        if (thresholdBytesPerSecond <= 0 || breachFactor < 1) {
            throw new IllegalArgumentException("threshold must be positive and breach factor at least 1");
        }
        this.thresholdBytesPerSecond = thresholdBytesPerSecond;
        this.breachFactor = breachFactor;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.NETWORK;
    }

    @Override
    public String name() {
        return "network-traffic";
    }

    @Override
    public List<AnomalyFinding> detect(List<WorkspaceMetrics> samples) {
        var findings = new ArrayList<AnomalyFinding>();
        for (WorkspaceMetrics sample : samples) {
            long tx = sample.networkTx();
            if (tx <= thresholdBytesPerSecond) {
                continue;
            }
            Map<String, Object> evidence = Map.of(
                    "networkTx", tx,
                    "networkRx", sample.networkRx(),
                    "threshold", thresholdBytesPerSecond);
            if (tx > thresholdBytesPerSecond * breachFactor) {
                findings.add(AnomalyFinding.breach(sample.workspaceId(),
                        BreachType.SUSPICIOUS_NETWORK_ACTIVITY, Severity.ERROR,
                        "Outbound traffic of " + tx + " B/s far above threshold", evidence));
            } else {
                findings.add(AnomalyFinding.anomaly(sample.workspaceId(),
                        AlertType.NETWORK_ANOMALY, Severity.WARNING,
                        "Outbound traffic of " + tx + " B/s above threshold", evidence));
            }
        }
        return findings;
    }
}
