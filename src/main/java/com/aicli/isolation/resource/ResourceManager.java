package com.aicli.isolation.resource;

import com.aicli.isolation.IsolationException;
import com.aicli.isolation.config.IsolationConfig;
import com.aicli.isolation.config.IsolationPolicy;
import com.aicli.isolation.core.model.Severity;
import com.aicli.isolation.core.model.WorkspaceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes, validates and converts workspace resource limits, and evaluates live usage samples
 * against the hard violation thresholds.
 *
 * <p>The thresholds here (CPU 90%, memory 85%, network 100 MiB/s, disk 50 MiB/s) are the
 * violation band. The per-workspace {@code AlertThresholds} built by the isolation manager are a
 * separate pre-warning band and are not used for evaluation here.
 */
public class ResourceManager {

    private static final Logger log = LoggerFactory.getLogger(ResourceManager.class);

    static final double CPU_THRESHOLD_PERCENT = 90.0;
    static final double MEMORY_THRESHOLD_PERCENT = 85.0;
    static final double NETWORK_THRESHOLD_BYTES = 100.0 * 1024 * 1024;
    static final double DISK_THRESHOLD_BYTES = 50.0 * 1024 * 1024;

    private static final long DEFAULT_CPU_SHARES = 1024;
    private static final long DEFAULT_PIDS_LIMIT = 100;
    private static final String DEFAULT_IO_BANDWIDTH = "100m";
    private static final long DEFAULT_IOPS = 1000;
    private static final long MIB = 1024L * 1024L;

    private final IsolationPolicy policy;

    public ResourceManager(IsolationPolicy policy) {
        this.policy = policy != null ? policy : IsolationPolicy.defaults();
    }

    public ResourceManager(IsolationConfig config) {
        this(new IsolationPolicy(config));
    }

    /**
     * Default limits derived from the current policy. Swap is disabled (memory+swap = memory).
     */
    public ResourceLimits createResourceLimits() {
        IsolationConfig config = policy.current();
        return new ResourceLimits(
                DEFAULT_CPU_SHARES,
                (long) (config.defaultCpuLimit() * ResourceLimits.DEFAULT_CPU_PERIOD),
                ResourceLimits.DEFAULT_CPU_PERIOD,
                config.defaultMemoryLimit(),
                config.defaultMemoryLimit(),
                DEFAULT_PIDS_LIMIT,
                DEFAULT_IO_BANDWIDTH,
                DEFAULT_IOPS);
    }

    /**
     * Default limits with every positive (or non-blank) request field applied on top.
     */
    public ResourceLimits createCustomResourceLimits(ResourceLimitRequest request) {
        ResourceLimits limits = createResourceLimits();
        if (request == null) {
            return limits;
        }
        if (request.cpuLimit() > 0) {
            limits = limits.withCpuCores(request.cpuLimit());
        }
        if (request.memoryLimit() > 0) {
            limits = limits.withMemoryNoSwap(request.memoryLimit());
        }
        if (request.pidsLimit() > 0) {
            limits = limits.withPidsLimit(request.pidsLimit());
        }
        String bandwidth = request.ioBandwidth() != null && !request.ioBandwidth().isBlank()
                ? request.ioBandwidth() : limits.ioMaxBandwidth();
        long iops = request.ioOps() > 0 ? request.ioOps() : limits.ioMaxIops();
        return limits.withIo(bandwidth, iops);
    }

    public RuntimeResourceSpec toRuntimeResources(ResourceLimits limits) {
        if (limits == null) {
            throw IsolationException.invalidInput("resource limits cannot be nil");
        }
        requireIntRange("CPU shares", limits.cpuShares());
        return new RuntimeResourceSpec(
                (int) limits.cpuShares(),
                limits.cpuQuota(),
                limits.cpuPeriod(),
                limits.memory(),
                limits.memorySwap(),
                RuntimeResourceSpec.DEFAULT_BLKIO_WEIGHT,
                RuntimeResourceSpec.DEFAULT_DEVICE_RULES,
                limits.pidsLimit() > 0 ? limits.pidsLimit() : null);
    }

    /**
     * @throws IsolationException when a limit is missing, negative, or below the allowed floor
     */
    public void validateResourceLimits(ResourceLimits limits) {
        if (limits == null) {
            throw IsolationException.invalidInput("resource limits cannot be nil");
        }
        if (limits.cpuQuota() < 0) {
            throw IsolationException.invalidInput("CPU quota cannot be negative");
        }
        if (limits.cpuPeriod() <= 0) {
            throw IsolationException.invalidInput("CPU period must be positive");
        }
        if (limits.cpuShares() < 0) {
            throw IsolationException.invalidInput("CPU shares cannot be negative");
        }
        requireIntRange("CPU shares", limits.cpuShares());
        requireIntRange("CPU quota", limits.cpuQuota());
        requireIntRange("CPU period", limits.cpuPeriod());
        if (limits.memory() < 0) {
            throw IsolationException.invalidInput("memory limit cannot be negative");
        }
        if (limits.memory() > 0 && limits.memory() < ResourceLimits.MIN_MEMORY) {
            throw IsolationException.policyViolation("memory limit too small (minimum 4MB)");
        }
        if (limits.memorySwap() != ResourceLimits.UNLIMITED_SWAP && limits.memorySwap() < limits.memory()) {
            throw IsolationException.policyViolation("memory+swap limit must be >= memory limit");
        }
        if (limits.pidsLimit() < 0) {
            throw IsolationException.invalidInput("PIDs limit cannot be negative");
        }
    }

    /** The runtime takes CPU shares, quota and period as 32-bit values. */
    public static void requireIntRange(String field, long value) {
        if (value > Integer.MAX_VALUE) {
            throw IsolationException.invalidInput(field + " out of range: " + value);
        }
    }

    /**
     * Evaluates one usage sample against the fixed thresholds. Never fails; an empty list is the
     * common result.
     */
    public List<ResourceViolation> validateResourceUsage(WorkspaceMetrics metrics) {
        var violations = new ArrayList<ResourceViolation>();
        if (metrics == null) {
            return violations;
        }

        if (metrics.cpuPercent() > CPU_THRESHOLD_PERCENT) {
            violations.add(new ResourceViolation(
                    ResourceViolation.CPU_HIGH_USAGE,
                    CPU_THRESHOLD_PERCENT,
                    metrics.cpuPercent(),
                    "CPU usage exceeded 90%",
                    Severity.WARNING,
                    Instant.now()));
        }

        if (metrics.memoryLimit() > 0) {
            double memoryPercent = (double) metrics.memoryUsage() / metrics.memoryLimit() * 100;
            if (memoryPercent > MEMORY_THRESHOLD_PERCENT) {
                violations.add(new ResourceViolation(
                        ResourceViolation.MEMORY_HIGH_USAGE,
                        MEMORY_THRESHOLD_PERCENT,
                        memoryPercent,
                        "Memory usage exceeded 85%",
                        Severity.WARNING,
                        Instant.now()));
            }
        }

        double networkIo = (double) metrics.networkRx() + metrics.networkTx();
        if (networkIo > NETWORK_THRESHOLD_BYTES) {
            violations.add(new ResourceViolation(
                    ResourceViolation.NETWORK_HIGH_IO,
                    NETWORK_THRESHOLD_BYTES,
                    networkIo,
                    "Network I/O exceeded 100MB/s",
                    Severity.INFO,
                    Instant.now()));
        }

        double diskIo = (double) metrics.diskRead() + metrics.diskWrite();
        if (diskIo > DISK_THRESHOLD_BYTES) {
            violations.add(new ResourceViolation(
                    ResourceViolation.DISK_HIGH_IO,
                    DISK_THRESHOLD_BYTES,
                    diskIo,
                    "Disk I/O exceeded 50MB/s",
                    Severity.INFO,
                    Instant.now()));
        }

        if (!violations.isEmpty()) {
            log.debug("Workspace {} sample produced {} violation(s)", metrics.workspaceId(), violations.size());
        }
        return violations;
    }

    /**
     * Baseline limits for a workload type, raised (never lowered) to 1.5x the mean CPU and 1.2x
     * the mean memory of the supplied history.
     *
     * @param workloadType baseline selector; {@code null} keeps the policy defaults
     * @param history      past samples, may be empty
     */
    public ResourceLimits calculateOptimalLimits(WorkloadType workloadType, List<WorkspaceMetrics> history) {
        ResourceLimits limits = createResourceLimits();

        if (workloadType != null) {
            limits = switch (workloadType) {
                case DEVELOPMENT -> limits.withCpuCores(2.0).withMemoryNoSwap(1024 * MIB).withPidsLimit(200);
                case BUILD -> limits.withCpuCores(4.0).withMemoryNoSwap(2048 * MIB).withPidsLimit(500)
                        .withIo(limits.ioMaxBandwidth(), 2000);
                case TEST -> limits.withCpuCores(1.0).withMemoryNoSwap(512 * MIB).withPidsLimit(100);
                case PRODUCTION -> limits.withCpuCores(1.5).withMemoryNoSwap(1024 * MIB).withPidsLimit(300)
                        .withIo(limits.ioMaxBandwidth(), 1500);
            };
        }

        if (history == null || history.isEmpty()) {
            return limits;
        }

        double totalCpuCores = 0;
        double totalMemory = 0;
        for (WorkspaceMetrics sample : history) {
            totalCpuCores += sample.cpuPercent() / 100.0;
            totalMemory += sample.memoryUsage();
        }
        double avgCpuCores = totalCpuCores / history.size();
        double avgMemory = totalMemory / history.size();

        if (avgCpuCores > 0) {
            double recommendedCores = avgCpuCores * 1.5;
            if (recommendedCores > limits.cpuCores()) {
                limits = limits.withCpuCores(recommendedCores);
            }
        }
        if (avgMemory > 0) {
            long recommendedMemory = (long) (avgMemory * 1.2);
            if (recommendedMemory > limits.memory()) {
                limits = limits.withMemoryNoSwap(recommendedMemory);
            }
        }

        log.debug("Optimal limits for {} over {} sample(s): {} cores, {} bytes",
                workloadType, history.size(), limits.cpuCores(), limits.memory());
        return limits;
    }

    /**
     * @return the named preset, or {@link #createResourceLimits()} for unknown names
     */
    public ResourceLimits getResourceLimitPreset(String name) {
        ResourcePreset preset = ResourcePreset.fromName(name);
        return getResourceLimitPreset(preset);
    }

    public ResourceLimits getResourceLimitPreset(ResourcePreset preset) {
        return preset != null ? preset.toLimits() : createResourceLimits();
    }
}
