package com.aicli.isolation.resource;

/**
 * Caller overrides for the default limits. Zero or blank fields keep the default.
 *
 * @param cpuLimit    CPU cores
 * @param memoryLimit memory in bytes
 * @param pidsLimit   process ceiling
 * @param ioBandwidth block I/O bandwidth, e.g. "100m"
 * @param ioOps       IOPS ceiling
 */
public record ResourceLimitRequest(
    double cpuLimit,
    long memoryLimit,
    long pidsLimit,
    String ioBandwidth,
    long ioOps
) {}
