package com.aicli.isolation.runtime;

import com.aicli.isolation.network.NetworkInfo;
import com.aicli.isolation.network.NetworkManager;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.Network;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates and removes the Docker networks described by {@link NetworkInfo}.
 */
public class DockerNetworkProvisioner {

    private static final Logger log = LoggerFactory.getLogger(DockerNetworkProvisioner.class);

    private final DockerClient dockerClient;
    private final NetworkManager networkManager;

    public DockerNetworkProvisioner(DockerClient dockerClient, NetworkManager networkManager) {
        this.dockerClient = dockerClient;
        this.networkManager = networkManager;
    }

    /**
     * Creates the network unless one with the same name already exists.
     *
     * @return the Docker network ID
     */
    public String provision(NetworkInfo info) {
        try {
            for (Network existing : dockerClient.listNetworksCmd().withNameFilter(info.name()).exec()) {
                if (info.name().equals(existing.getName())) {
                    log.debug("Network {} already exists ({})", info.name(), existing.getId());
                    return existing.getId();
                }
            }
            var response = networkManager.applyToNetworkCreate(info, dockerClient.createNetworkCmd()).exec();
            log.info("Created network {} ({}) with subnet {}", info.name(), response.getId(), info.subnet());
            return response.getId();
        } catch (DockerException e) {
            throw new RuntimeOperationException("create-network", info.name(), e);
        }
    }

    /**
     * @return false when the network did not exist
     */
    public boolean remove(NetworkInfo info) {
        try {
            dockerClient.removeNetworkCmd(info.name()).exec();
            log.info("Removed network {}", info.name());
            return true;
        } catch (NotFoundException e) {
            log.debug("Network {} already removed", info.name());
            return false;
        } catch (DockerException e) {
            throw new RuntimeOperationException("remove-network", info.name(), e);
        }
    }
}
