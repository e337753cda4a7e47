package com.aicli.isolation.resource;

/**
 * CPU, memory, process and I/O ceilings for one workspace container.
 *
 * @param cpuShares      relative CPU weight
 * @param cpuQuota       CPU time per period in microseconds
 * @param cpuPeriod      CFS period in microseconds
 * @param memory         memory ceiling in bytes
 * @param memorySwap     memory+swap ceiling in bytes, {@link #UNLIMITED_SWAP} for unlimited
 * @param pidsLimit      process ceiling, 0 for no ceiling
 * @param ioMaxBandwidth block I/O bandwidth, e.g. "100m"
 * @param ioMaxIops      block I/O operations per second
 */
public record ResourceLimits(
    long cpuShares,
    long cpuQuota,
    long cpuPeriod,
    long memory,
    long memorySwap,
    long pidsLimit,
    String ioMaxBandwidth,
    long ioMaxIops
) {

    public static final long UNLIMITED_SWAP = -1L;
    public static final long DEFAULT_CPU_PERIOD = 100_000L;
    public static final long MIN_MEMORY = 4L * 1024 * 1024;

    /** CPU ceiling expressed in cores. */
    public double cpuCores() {
        return cpuPeriod > 0 ? (double) cpuQuota / cpuPeriod : 0;
    }

    public ResourceLimits withCpuCores(double cores) {
        return new ResourceLimits(cpuShares, (long) (cores * DEFAULT_CPU_PERIOD), cpuPeriod,
                memory, memorySwap, pidsLimit, ioMaxBandwidth, ioMaxIops);
    }

    /** Sets memory and memory+swap to the same value, which disables swap. */
    public ResourceLimits withMemoryNoSwap(long bytes) {
        return new ResourceLimits(cpuShares, cpuQuota, cpuPeriod, bytes, bytes,
                pidsLimit, ioMaxBandwidth, ioMaxIops);
    }

    public ResourceLimits withMemory(long bytes, long swapBytes) {
        return new ResourceLimits(cpuShares, cpuQuota, cpuPeriod, bytes, swapBytes,
                pidsLimit, ioMaxBandwidth, ioMaxIops);
    }

    public ResourceLimits withPidsLimit(long pids) {
        return new ResourceLimits(cpuShares, cpuQuota, cpuPeriod, memory, memorySwap,
                pids, ioMaxBandwidth, ioMaxIops);
    }

    public ResourceLimits withIo(String bandwidth, long iops) {
        return new ResourceLimits(cpuShares, cpuQuota, cpuPeriod, memory, memorySwap,
                pidsLimit, bandwidth, iops);
    }
}
