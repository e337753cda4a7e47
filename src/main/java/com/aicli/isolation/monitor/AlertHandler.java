package com.aicli.isolation.monitor;

/**
 * Push-delivery callback for alerts. Runs on a shared dispatch pool and must not block for long.
 */
@FunctionalInterface
public interface AlertHandler {

    void onAlert(SecurityAlert alert);
}
