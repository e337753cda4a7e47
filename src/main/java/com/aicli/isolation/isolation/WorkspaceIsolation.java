package com.aicli.isolation.isolation;

import com.aicli.isolation.resource.ResourceLimits;

import java.time.Instant;

/**
 * Complete isolation profile of one workspace. Not persisted by this subsystem; callers keep it
 * with their workspace record when it must outlive a call.
 *
 * @param networkMode {@value #NETWORK_MODE_CUSTOM} to attach the container to {@code networkName}
 */
public record WorkspaceIsolation(
    String workspaceId,
    String networkMode,
    String networkName,
    IsolationLevel isolationLevel,
    ResourceLimits resourceLimits,
    SecurityOptions securityOptions,
    MonitoringConfig monitoringConfig,
    Instant createdAt
) {

    public static final String NETWORK_MODE_CUSTOM = "custom";
}
