package com.aicli.isolation.resource;

import com.github.dockerjava.api.model.HostConfig;

import java.util.List;

/**
 * Resource constraints in the container runtime's vocabulary.
 *
 * @param pidsLimit process ceiling, {@code null} when the limits carry none
 */
public record RuntimeResourceSpec(
    int cpuShares,
    long cpuQuota,
    long cpuPeriod,
    long memory,
    long memorySwap,
    int blkioWeight,
    List<String> deviceCgroupRules,
    Long pidsLimit
) {

    public static final int DEFAULT_BLKIO_WEIGHT = 500;

    /** /dev/null, /dev/zero, /dev/urandom and pseudo-terminals. */
    public static final List<String> DEFAULT_DEVICE_RULES = List.of(
        "c 1:3 rmw",
        "c 1:5 rmw",
        "c 1:9 rmw",
        "c 136:* rmw"
    );

    public RuntimeResourceSpec {
        deviceCgroupRules = deviceCgroupRules != null ? List.copyOf(deviceCgroupRules) : List.of();
    }

    /**
     * Writes the CPU, memory, PID and block I/O constraints into a host configuration.
     */
    public HostConfig applyTo(HostConfig hostConfig) {
        hostConfig.withCpuShares(cpuShares)
                .withCpuQuota(cpuQuota)
                .withCpuPeriod(cpuPeriod)
                .withMemory(memory)
                .withMemorySwap(memorySwap)
                .withBlkioWeight(blkioWeight);
        if (pidsLimit != null) {
            hostConfig.withPidsLimit(pidsLimit);
        }
        return hostConfig;
    }
}
