package com.aicli.isolation.config;

import java.time.Duration;

/**
 * Tuning for {@link com.aicli.isolation.monitor.SecurityMonitor} and the network usage stream.
 *
 * @param interval                  delay between monitor ticks
 * @param alertCapacity             capacity of the alert channel; alerts beyond it are dropped
 * @param dispatchThreads           worker threads delivering alerts to subscribers
 * @param dispatchQueueCapacity     pending subscriber deliveries before new ones are rejected
 * @param maxViolationsPerWorkspace violation history kept per workspace (oldest dropped first)
 * @param networkStatsInterval      sampling interval for network usage streams
 */
public record MonitorOptions(
    Duration interval,
    int alertCapacity,
    int dispatchThreads,
    int dispatchQueueCapacity,
    int maxViolationsPerWorkspace,
    Duration networkStatsInterval
) {

    public static MonitorOptions defaults() {
        return new MonitorOptions(Duration.ofSeconds(30), 100, 4, 1000, 1000, Duration.ofSeconds(5));
    }

    public MonitorOptions withInterval(Duration newInterval) {
        return new MonitorOptions(newInterval, alertCapacity, dispatchThreads,
                dispatchQueueCapacity, maxViolationsPerWorkspace, networkStatsInterval);
    }

    public MonitorOptions withAlertCapacity(int capacity) {
        return new MonitorOptions(interval, capacity, dispatchThreads,
                dispatchQueueCapacity, maxViolationsPerWorkspace, networkStatsInterval);
    }

    public MonitorOptions withMaxViolationsPerWorkspace(int max) {
        return new MonitorOptions(interval, alertCapacity, dispatchThreads,
                dispatchQueueCapacity, max, networkStatsInterval);
    }
}
