package com.aicli.isolation.monitor.detect;

import com.aicli.isolation.core.model.Severity;
import com.aicli.isolation.core.model.WorkspaceMetrics;
import com.aicli.isolation.monitor.AlertType;
import com.aicli.isolation.monitor.BreachType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Watches process counts against each workspace's PID ceiling. Samples without a ceiling are
 * skipped.
 */
public class ProcessAnomalyDetector implements AnomalyDetector {

    static final double WARNING_RATIO = 0.8;

    @Override
    public DetectorKind kind() {
        return DetectorKind.PROCESS;
    }

    @Override
    public String name() {
        return "process-count";
    }

    @Override
    public List<AnomalyFinding> detect(List<WorkspaceMetrics> samples) {
        var findings = new ArrayList<AnomalyFinding>();
        for (WorkspaceMetrics sample : samples) {
            long limit = sample.pidsLimit();
            if (limit <= 0) {
                continue;
            }
            int count = sample.processCount();
            Map<String, Object> evidence = Map.of("processCount", count, "pidsLimit", limit);
            if (count >= limit) {
                findings.add(AnomalyFinding.breach(sample.workspaceId(),
                        BreachType.RESOURCE_EXHAUSTION, Severity.ERROR,
                        "Process ceiling reached (" + count + "/" + limit + ")", evidence));
            } else if (count > limit * WARNING_RATIO) {
                findings.add(AnomalyFinding.anomaly(sample.workspaceId(),
                        AlertType.PROCESS_ANOMALY, Severity.WARNING,
                        "Process count close to ceiling (" + count + "/" + limit + ")", evidence));
            }
        }
        return findings;
    }
}
