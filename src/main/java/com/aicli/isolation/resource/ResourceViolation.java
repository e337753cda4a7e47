package com.aicli.isolation.resource;

import com.aicli.isolation.core.model.Severity;

import java.time.Instant;

/**
 * A live usage sample crossing one of the fixed thresholds.
 *
 * @param type        e.g. {@code cpu_high_usage}, {@code memory_high_usage}
 * @param threshold   the threshold that was crossed
 * @param current     the observed value, in the threshold's unit
 * @param description human readable summary
 * @param severity    violation severity
 * @param timestamp   when the violation was evaluated
 */
public record ResourceViolation(
    String type,
    double threshold,
    double current,
    String description,
    Severity severity,
    Instant timestamp
) {

    public static final String CPU_HIGH_USAGE = "cpu_high_usage";
    public static final String MEMORY_HIGH_USAGE = "memory_high_usage";
    public static final String NETWORK_HIGH_IO = "network_high_io";
    public static final String DISK_HIGH_IO = "disk_high_io";
}
