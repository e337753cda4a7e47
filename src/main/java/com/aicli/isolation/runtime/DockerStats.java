package com.aicli.isolation.runtime;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.model.Statistics;
import com.github.dockerjava.api.model.StatisticNetworksConfig;
import com.github.dockerjava.core.InvocationBuilder;

import java.io.IOException;
import java.util.Map;

/**
 * One-shot stats reads shared by the Docker adapters.
 */
final class DockerStats {

    private DockerStats() {}

    static Statistics read(DockerClient dockerClient, String containerId) {
        try (var callback = dockerClient.statsCmd(containerId)
                .withNoStream(true)
                .exec(new InvocationBuilder.AsyncResultCallback<Statistics>())) {
            return callback.awaitResult();
        } catch (IOException | DockerException e) {
            throw new RuntimeOperationException("stats", containerId, e);
        }
    }

    /** Sums rx/tx bytes and packets over every interface: {rxBytes, txBytes, rxPackets, txPackets}. */
    static long[] networkTotals(Statistics stats) {
        long[] totals = new long[4];
        Map<String, StatisticNetworksConfig> networks = stats.getNetworks();
        if (networks == null) {
            return totals;
        }
        for (StatisticNetworksConfig nic : networks.values()) {
            totals[0] += orZero(nic.getRxBytes());
            totals[1] += orZero(nic.getTxBytes());
            totals[2] += orZero(nic.getRxPackets());
            totals[3] += orZero(nic.getTxPackets());
        }
        return totals;
    }

    static long orZero(Long value) {
        return value != null ? value : 0L;
    }
}
