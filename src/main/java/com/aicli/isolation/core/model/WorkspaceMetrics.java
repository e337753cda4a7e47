package com.aicli.isolation.core.model;

import java.time.Instant;

/**
 * One resource usage sample of a workspace container. Network and disk figures are bytes per
 * second; memory figures are bytes.
 *
 * @param workspaceId  the sampled workspace
 * @param cpuPercent   CPU usage, 100 = one full core
 * @param memoryUsage  resident memory
 * @param memoryLimit  memory ceiling, 0 when unlimited
 * @param networkRx    receive rate
 * @param networkTx    transmit rate
 * @param diskRead     block read rate
 * @param diskWrite    block write rate
 * @param processCount processes running in the container
 * @param pidsLimit    process ceiling, 0 when unlimited
 * @param timestamp    when the sample was taken
 */
public record WorkspaceMetrics(
    String workspaceId,
    double cpuPercent,
    long memoryUsage,
    long memoryLimit,
    long networkRx,
    long networkTx,
    long diskRead,
    long diskWrite,
    int processCount,
    long pidsLimit,
    Instant timestamp
) {

    public WorkspaceMetrics {
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static WorkspaceMetrics ofUsage(String workspaceId, double cpuPercent, long memoryUsage) {
        return new WorkspaceMetrics(workspaceId, cpuPercent, memoryUsage, 0, 0, 0, 0, 0, 0, 0, Instant.now());
    }
}
