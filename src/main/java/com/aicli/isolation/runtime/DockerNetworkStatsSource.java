package com.aicli.isolation.runtime;

import com.aicli.isolation.network.NetworkManager;
import com.aicli.isolation.network.NetworkStats;
import com.aicli.isolation.network.NetworkStatsSource;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.model.Network;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregates the traffic counters of every container attached to a network.
 * {@code connectionCount} is the number of attached containers.
 */
public class DockerNetworkStatsSource implements NetworkStatsSource {

    private static final Logger log = LoggerFactory.getLogger(DockerNetworkStatsSource.class);

    static final String LOGICAL_ID_PREFIX = "net_";

    private final DockerClient dockerClient;

    public DockerNetworkStatsSource(DockerClient dockerClient) {
        this.dockerClient = dockerClient;
    }

    @Override
    public NetworkStats sample(String networkId) {
        String dockerName = resolveName(networkId);
        Network network;
        try {
            network = dockerClient.inspectNetworkCmd().withNetworkId(dockerName).exec();
        } catch (DockerException e) {
            throw new RuntimeOperationException("inspect-network", dockerName, e);
        }

        Map<String, Network.ContainerNetworkConfig> attached = network.getContainers();
        if (attached == null || attached.isEmpty()) {
            return NetworkStats.empty(networkId);
        }

        long[] totals = new long[4];
        for (String containerId : attached.keySet()) {
            try {
                long[] nic = DockerStats.networkTotals(DockerStats.read(dockerClient, containerId));
                for (int i = 0; i < totals.length; i++) {
                    totals[i] += nic[i];
                }
            } catch (RuntimeOperationException e) {
                log.debug("Skipping container {} on {}: {}", containerId, dockerName, e.getMessage());
            }
        }
        return new NetworkStats(networkId, totals[0], totals[1], totals[2], totals[3],
                attached.size(), Instant.now());
    }

    /** Maps the logical {@code net_<workspace>} ID onto the Docker network name. */
    static String resolveName(String networkId) {
        if (networkId.startsWith(LOGICAL_ID_PREFIX)) {
            return NetworkManager.networkName(networkId.substring(LOGICAL_ID_PREFIX.length()));
        }
        return networkId;
    }
}
