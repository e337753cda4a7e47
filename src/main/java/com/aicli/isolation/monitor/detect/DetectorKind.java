package com.aicli.isolation.monitor.detect;

/**
 * Check slot a detector runs in. Slots run in declaration order on every monitor tick.
 */
public enum DetectorKind {
    NETWORK,
    PROCESS,
    FILESYSTEM
}
