package com.aicli.isolation.network;

import java.util.List;

/**
 * Traffic ceilings and firewall rules for a workspace network.
 *
 * @param maxBandwidth   bytes per second, 0 for no ceiling
 * @param maxConnections concurrent connections, 0 for no ceiling
 * @param enableDpi      request deep packet inspection
 * @param logTraffic     request traffic logging
 */
public record NetworkSecurityPolicy(
    String networkId,
    long maxBandwidth,
    int maxConnections,
    List<FirewallRule> allowRules,
    List<FirewallRule> blockRules,
    boolean enableDpi,
    boolean logTraffic
) {

    public NetworkSecurityPolicy {
        allowRules = allowRules != null ? List.copyOf(allowRules) : List.of();
        blockRules = blockRules != null ? List.copyOf(blockRules) : List.of();
    }
}
