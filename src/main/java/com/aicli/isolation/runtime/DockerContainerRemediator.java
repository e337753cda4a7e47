package com.aicli.isolation.runtime;

import com.aicli.isolation.monitor.ContainerRemediator;
import com.aicli.isolation.network.NetworkManager;
import com.aicli.isolation.resource.ResourceLimits;
import com.aicli.isolation.resource.ResourceManager;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.Container;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Enforces breach responses on every container labelled with the workspace ID.
 */
public class DockerContainerRemediator implements ContainerRemediator {

    private static final Logger log = LoggerFactory.getLogger(DockerContainerRemediator.class);

    private final DockerClient dockerClient;

    public DockerContainerRemediator(DockerClient dockerClient) {
        this.dockerClient = dockerClient;
    }

    @Override
    public void pauseWorkspace(String workspaceId) {
        for (Container container : containersFor(workspaceId, "pause")) {
            try {
                dockerClient.pauseContainerCmd(container.getId()).exec();
                log.warn("Paused container {} of workspace {}", container.getId(), workspaceId);
            } catch (DockerException e) {
                throw new RuntimeOperationException("pause", workspaceId, e);
            }
        }
    }

    @Override
    public void restrictNetwork(String workspaceId) {
        String network = NetworkManager.networkName(workspaceId);
        for (Container container : containersFor(workspaceId, "restrict-network")) {
            try {
                dockerClient.disconnectFromNetworkCmd()
                        .withNetworkId(network)
                        .withContainerId(container.getId())
                        .withForce(true)
                        .exec();
                log.warn("Disconnected container {} from {}", container.getId(), network);
            } catch (NotFoundException e) {
                log.debug("Container {} not attached to {}: {}", container.getId(), network, e.getMessage());
            } catch (DockerException e) {
                throw new RuntimeOperationException("restrict-network", workspaceId, e);
            }
        }
    }

    @Override
    public void applyResourceLimits(String workspaceId, ResourceLimits limits) {
        ResourceManager.requireIntRange("CPU shares", limits.cpuShares());
        ResourceManager.requireIntRange("CPU period", limits.cpuPeriod());
        ResourceManager.requireIntRange("CPU quota", limits.cpuQuota());
        for (Container container : containersFor(workspaceId, "update-limits")) {
            try {
                dockerClient.updateContainerCmd(container.getId())
                        .withCpuShares((int) limits.cpuShares())
                        .withCpuPeriod((int) limits.cpuPeriod())
                        .withCpuQuota((int) limits.cpuQuota())
                        .withMemory(limits.memory())
                        .withMemorySwap(limits.memorySwap())
                        .exec();
                log.info("Tightened limits of container {} (quota {}, memory {})",
                        container.getId(), limits.cpuQuota(), limits.memory());
            } catch (DockerException e) {
                throw new RuntimeOperationException("update-limits", workspaceId, e);
            }
        }
    }

    List<Container> containersFor(String workspaceId, String operation) {
        List<Container> containers;
        try {
            containers = dockerClient.listContainersCmd()
                    .withShowAll(true)
                    .withLabelFilter(Map.of(NetworkManager.LABEL_WORKSPACE_ID, workspaceId))
                    .exec();
        } catch (DockerException e) {
            throw new RuntimeOperationException(operation, workspaceId, e);
        }
        if (containers == null || containers.isEmpty()) {
            throw new RuntimeOperationException(operation, workspaceId, "no containers labelled for workspace");
        }
        return containers;
    }
}
