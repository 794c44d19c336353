package com.guardrails.core.model;

import java.util.List;

/**
 * Fully resolved, immutable plan carried from matching into orchestration.
 * Never persisted on its own.
 */
public record ActionPlan(
    boolean matched,
    String eventId,
    String policyId,
    ExecutionMode mode,
    List<TargetPrincipal> targets,
    List<GuardrailAction> actions,
    int ttlMinutes,
    NotificationRoute notification
) {
    public ActionPlan {
        targets = targets == null ? List.of() : List.copyOf(targets);
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public static ActionPlan noMatch(String eventId) {
        return new ActionPlan(false, eventId, null, null, List.of(), List.of(), 0, null);
    }

    public boolean schedulesRollback() {
        return ttlMinutes > 0;
    }
}
