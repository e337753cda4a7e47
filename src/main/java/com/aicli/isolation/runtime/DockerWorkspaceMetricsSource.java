package com.aicli.isolation.runtime;

import com.aicli.isolation.core.model.WorkspaceMetrics;
import com.aicli.isolation.monitor.WorkspaceMetricsSource;
import com.aicli.isolation.network.NetworkManager;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.model.BlkioStatEntry;
import com.github.dockerjava.api.model.BlkioStatsConfig;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.CpuStatsConfig;
import com.github.dockerjava.api.model.MemoryStatsConfig;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.PidsStatsConfig;
import com.github.dockerjava.api.model.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.ToLongFunction;

import static com.aicli.isolation.runtime.DockerStats.orZero;

/**
 * Samples every running workspace container once per call. Network and disk rates are derived
 * from the counters seen on the previous call; the first sample of a container reports zero
 * rates. The PID ceiling is not part of the stats payload and is read once per container from
 * its host config.
 */
public class DockerWorkspaceMetricsSource implements WorkspaceMetricsSource {

    private static final Logger log = LoggerFactory.getLogger(DockerWorkspaceMetricsSource.class);

    private final DockerClient dockerClient;
    private final Map<String, Counters> previous = new ConcurrentHashMap<>();
    private final Map<String, Long> pidsLimits = new ConcurrentHashMap<>();

    public DockerWorkspaceMetricsSource(DockerClient dockerClient) {
        this.dockerClient = dockerClient;
    }

    /** Cumulative I/O counters of one container at one instant. */
    record Counters(long rxBytes, long txBytes, long readBytes, long writeBytes, Instant at) {}

    @Override
    public List<WorkspaceMetrics> collect() {
        List<Container> containers;
        try {
            containers = dockerClient.listContainersCmd()
                    .withLabelFilter(List.of(NetworkManager.LABEL_WORKSPACE_ID))
                    .exec();
        } catch (DockerException e) {
            throw new RuntimeOperationException("list-containers", "all workspaces", e);
        }

        var samples = new ArrayList<WorkspaceMetrics>();
        Set<String> seen = new HashSet<>();
        for (Container container : containers) {
            String workspaceId = container.getLabels() != null
                    ? container.getLabels().get(NetworkManager.LABEL_WORKSPACE_ID) : null;
            if (workspaceId == null || workspaceId.isBlank()) {
                continue;
            }
            seen.add(container.getId());
            try {
                Statistics stats = DockerStats.read(dockerClient, container.getId());
                long pidsLimit = pidsLimit(container.getId());
                samples.add(sample(workspaceId, container.getId(), stats, pidsLimit, Instant.now()));
            } catch (RuntimeOperationException e) {
                log.warn("Could not sample container {} of workspace {}: {}",
                        container.getId(), workspaceId, e.getMessage());
            }
        }
        previous.keySet().retainAll(seen);
        pidsLimits.keySet().retainAll(seen);
        return samples;
    }

    /**
     * @return the container's PID ceiling, 0 when it has none or cannot be inspected
     */
    long pidsLimit(String containerId) {
        Long cached = pidsLimits.get(containerId);
        if (cached != null) {
            return cached;
        }
        try {
            HostConfig hostConfig = dockerClient.inspectContainerCmd(containerId).exec().getHostConfig();
            long limit = hostConfig != null ? Math.max(0, orZero(hostConfig.getPidsLimit())) : 0;
            pidsLimits.put(containerId, limit);
            return limit;
        } catch (DockerException e) {
            log.debug("Could not inspect container {} for its PID ceiling: {}", containerId, e.getMessage());
            return 0;
        }
    }

    WorkspaceMetrics sample(String workspaceId, String containerId, Statistics stats, long pidsLimit, Instant now) {
        long[] network = DockerStats.networkTotals(stats);
        long[] disk = diskTotals(stats.getBlkioStats());
        var current = new Counters(network[0], network[1], disk[0], disk[1], now);
        Counters last = previous.put(containerId, current);

        MemoryStatsConfig memory = stats.getMemoryStats();
        PidsStatsConfig pids = stats.getPidsStats();
        return new WorkspaceMetrics(
                workspaceId,
                cpuPercent(stats.getCpuStats(), stats.getPreCpuStats()),
                memory != null ? orZero(memory.getUsage()) : 0,
                memory != null ? orZero(memory.getLimit()) : 0,
                rate(last, current, Counters::rxBytes),
                rate(last, current, Counters::txBytes),
                rate(last, current, Counters::readBytes),
                rate(last, current, Counters::writeBytes),
                pids != null ? Math.toIntExact(orZero(pids.getCurrent())) : 0,
                pidsLimit,
                now);
    }

    /**
     * Docker's CPU percentage: container CPU delta over system CPU delta, scaled by online CPUs.
     * 100 means one full core.
     */
    static double cpuPercent(CpuStatsConfig cpu, CpuStatsConfig preCpu) {
        if (cpu == null || preCpu == null || cpu.getCpuUsage() == null || preCpu.getCpuUsage() == null) {
            return 0.0;
        }
        long cpuDelta = orZero(cpu.getCpuUsage().getTotalUsage()) - orZero(preCpu.getCpuUsage().getTotalUsage());
        long systemDelta = orZero(cpu.getSystemCpuUsage()) - orZero(preCpu.getSystemCpuUsage());
        if (cpuDelta <= 0 || systemDelta <= 0) {
            return 0.0;
        }
        long online = orZero(cpu.getOnlineCpus());
        if (online == 0) {
            List<Long> perCpu = cpu.getCpuUsage().getPercpuUsage();
            online = perCpu != null && !perCpu.isEmpty() ? perCpu.size() : 1;
        }
        return (double) cpuDelta / systemDelta * online * 100.0;
    }

    /** Bytes per second between two counter snapshots; zero without a usable previous one. */
    static long rate(Counters last, Counters current, ToLongFunction<Counters> field) {
        if (last == null) {
            return 0;
        }
        long millis = Duration.between(last.at(), current.at()).toMillis();
        long delta = field.applyAsLong(current) - field.applyAsLong(last);
        if (millis <= 0 || delta <= 0) {
            return 0;
        }
        return delta * 1000 / millis;
    }

    /** {readBytes, writeBytes} summed over all block devices. */
    static long[] diskTotals(BlkioStatsConfig blkio) {
        long[] totals = new long[2];
        if (blkio == null || blkio.getIoServiceBytesRecursive() == null) {
            return totals;
        }
        for (BlkioStatEntry entry : blkio.getIoServiceBytesRecursive()) {
            String op = entry.getOp();
            if ("read".equalsIgnoreCase(op)) {
                totals[0] += orZero(entry.getValue());
            } else if ("write".equalsIgnoreCase(op)) {
                totals[1] += orZero(entry.getValue());
            }
        }
        return totals;
    }
}
