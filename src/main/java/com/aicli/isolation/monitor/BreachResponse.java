package com.aicli.isolation.monitor;

import java.util.Set;

/**
 * Outcome of handling one breach.
 *
 * @param actions       everything the response called for
 * @param failedActions enforcement actions the runtime could not carry out
 */
public record BreachResponse(
    String workspaceId,
    BreachType breachType,
    Set<RemediationAction> actions,
    Set<RemediationAction> failedActions
) {

    public BreachResponse {
        actions = Set.copyOf(actions);
        failedActions = Set.copyOf(failedActions);
    }

    public boolean isFullyApplied() {
        return failedActions.isEmpty();
    }
}
