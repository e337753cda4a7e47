package com.aicli.isolation.network;

import java.time.Instant;

/**
 * Cumulative traffic counters of one network at a point in time.
 */
public record NetworkStats(
    String networkId,
    long rxBytes,
    long txBytes,
    long rxPackets,
    long txPackets,
    int connectionCount,
    Instant timestamp
) {

    public static NetworkStats empty(String networkId) {
        return new NetworkStats(networkId, 0, 0, 0, 0, 0, Instant.now());
    }
}
