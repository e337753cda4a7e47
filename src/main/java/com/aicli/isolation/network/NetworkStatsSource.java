package com.aicli.isolation.network;

/**
 * Supplies traffic counters for a network. Implemented by the container runtime adapter.
 */
@FunctionalInterface
public interface NetworkStatsSource {

    /** Source used when no runtime is available: all counters zero. */
    NetworkStatsSource NONE = NetworkStats::empty;

    NetworkStats sample(String networkId);
}
