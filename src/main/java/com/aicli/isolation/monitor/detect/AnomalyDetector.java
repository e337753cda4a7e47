package com.aicli.isolation.monitor.detect;

import com.aicli.isolation.core.model.WorkspaceMetrics;

import java.util.List;

/**
 * A behavioural check run by the security monitor once per tick.
 */
public interface AnomalyDetector {

    DetectorKind kind();

    /** Short name used in logs and MDC. */
    String name();

    /**
     * @param samples the usage samples collected for this tick, possibly empty
     * @return findings for this tick, empty when nothing stands out
     */
    List<AnomalyFinding> detect(List<WorkspaceMetrics> samples);
}
