package com.aicli.isolation.resource;

import java.util.Locale;

/**
 * Named, pre-tuned resource tiers.
 */
public enum ResourcePreset {
    MINIMAL(512, 0.5, 256, 50, "50m", 500),
    SMALL(1024, 1, 512, 100, "100m", 1000),
    MEDIUM(2048, 2, 1024, 200, "200m", 2000),
    LARGE(4096, 4, 2048, 500, "500m", 5000);

    private final long cpuShares;
    private final double cpuCores;
    private final long memoryMb;
    private final long pidsLimit;
    private final String ioBandwidth;
    private final long iops;

    ResourcePreset(long cpuShares, double cpuCores, long memoryMb, long pidsLimit, String ioBandwidth, long iops) {
        this.cpuShares = cpuShares;
        this.cpuCores = cpuCores;
        this.memoryMb = memoryMb;
        this.pidsLimit = pidsLimit;
        this.ioBandwidth = ioBandwidth;
        this.iops = iops;
    }

    public ResourceLimits toLimits() {
        long memory = memoryMb * 1024 * 1024;
        return new ResourceLimits(
                cpuShares,
                (long) (cpuCores * ResourceLimits.DEFAULT_CPU_PERIOD),
                ResourceLimits.DEFAULT_CPU_PERIOD,
                memory,
                memory,
                pidsLimit,
                ioBandwidth,
                iops);
    }

    /**
     * @return the matching preset, or {@code null} for unknown names
     */
    public static ResourcePreset fromName(String name) {
        if (name == null) {
            return null;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
