package com.aicli.isolation.isolation;

/**
 * Minimal view of a workspace owned by the workspace-management layer.
 */
public interface WorkspaceHandle {

    /** Stable, non-empty workspace identifier. */
    String workspaceId();

    static WorkspaceHandle of(String workspaceId) {
        return new SimpleWorkspace(workspaceId);
    }

    record SimpleWorkspace(String workspaceId) implements WorkspaceHandle {}
}
