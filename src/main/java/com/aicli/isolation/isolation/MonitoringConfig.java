package com.aicli.isolation.isolation;

/**
 * Monitoring switches and pre-warning thresholds for one workspace.
 */
public record MonitoringConfig(
    boolean enableResourceMonitoring,
    boolean enableNetworkMonitoring,
    boolean enableFileSystemAudit,
    String logLevel,
    AlertThresholds alertThresholds
) {

    /**
     * Pre-warning band. Deliberately different from the violation thresholds used by
     * {@link com.aicli.isolation.resource.ResourceManager#validateResourceUsage}.
     *
     * @param cpuThreshold     CPU percent
     * @param memoryThreshold  memory percent of the limit
     * @param networkThreshold network bytes per second
     * @param diskThreshold    disk bytes per second
     */
    public record AlertThresholds(
        double cpuThreshold,
        double memoryThreshold,
        long networkThreshold,
        long diskThreshold
    ) {

        public static AlertThresholds defaults() {
            return new AlertThresholds(85.0, 90.0, 100L * 1024 * 1024, 50L * 1024 * 1024);
        }
    }
}
