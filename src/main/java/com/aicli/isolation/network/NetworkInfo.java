package com.aicli.isolation.network;

import java.time.Instant;
import java.util.Map;

/**
 * Identity of a workspace's dedicated network.
 *
 * @param id          network identifier
 * @param name        {@code aicli-workspace-<workspaceId>}
 * @param workspaceId owning workspace
 * @param subnet      CIDR block derived from the workspace ID
 * @param gateway     first host address of the subnet
 * @param driver      network driver, always {@code bridge}
 * @param isolated    whether the network is dedicated to one workspace
 * @param internal    whether external access is cut off
 * @param labels      runtime labels, including {@code aicli.workspace.id}
 * @param options     driver options
 * @param createdAt   provisioning time
 */
public record NetworkInfo(
    String id,
    String name,
    String workspaceId,
    String subnet,
    String gateway,
    String driver,
    boolean isolated,
    boolean internal,
    Map<String, String> labels,
    Map<String, String> options,
    Instant createdAt
) {

    public NetworkInfo {
        labels = labels != null ? Map.copyOf(labels) : Map.of();
        options = options != null ? Map.copyOf(options) : Map.of();
    }
}
