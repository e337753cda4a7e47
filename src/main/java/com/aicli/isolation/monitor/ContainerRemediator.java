package com.aicli.isolation.monitor;

import com.aicli.isolation.resource.ResourceLimits;

/**
 * Enforcement hooks into the container runtime used by breach responses. Implementations throw
 * unchecked exceptions when the runtime rejects an action.
 */
public interface ContainerRemediator {

    /** Used when no runtime is wired; every call is a logged no-op in the monitor. */
    ContainerRemediator NONE = new ContainerRemediator() {
        @Override
        public void pauseWorkspace(String workspaceId) {
        }

        @Override
        public void restrictNetwork(String workspaceId) {
        }

        @Override
        public void applyResourceLimits(String workspaceId, ResourceLimits limits) {
        }
    };

    void pauseWorkspace(String workspaceId);

    /** Cuts the workspace off from its network. */
    void restrictNetwork(String workspaceId);

    void applyResourceLimits(String workspaceId, ResourceLimits limits);
}
