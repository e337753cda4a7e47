package com.aicli.isolation.monitor.detect;

import java.time.Instant;

/**
 * One file access observed inside a workspace container.
 *
 * @param operation e.g. {@code read}, {@code write}, {@code open}
 */
public record FileAccessEvent(
    String workspaceId,
    String path,
    String operation,
    String process,
    Instant timestamp
) {}
