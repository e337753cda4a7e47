package com.aicli.isolation.monitor;

import com.aicli.isolation.core.model.WorkspaceMetrics;

import java.util.List;

/**
 * Supplies one usage sample per live workspace on every monitor tick.
 */
@FunctionalInterface
public interface WorkspaceMetricsSource {

    WorkspaceMetricsSource NONE = List::of;

    List<WorkspaceMetrics> collect();
}
