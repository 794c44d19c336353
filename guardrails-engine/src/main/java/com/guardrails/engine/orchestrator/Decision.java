package com.guardrails.engine.orchestrator;

import com.guardrails.core.model.ExecutionMode;

import java.util.List;

/**
 * Result of evaluating one cost event.
 */
public record Decision(
    String eventId,
    DecisionOutcome outcome,
    String policyId,
    ExecutionMode mode,
    List<TargetResult> targets,
    String message
) {
    public Decision {
        targets = targets == null ? List.of() : List.copyOf(targets);
    }

    public static Decision noMatch(String eventId) {
        return new Decision(eventId, DecisionOutcome.NO_MATCH, null, null, List.of(), "No policy matched");
    }

    public static Decision invalid(String eventId, String message) {
        return new Decision(eventId, DecisionOutcome.INVALID_EVENT, null, null, List.of(), message);
    }

    public static Decision error(String eventId, String policyId, String message) {
        return new Decision(eventId, DecisionOutcome.ERROR, policyId, null, List.of(), message);
    }

    public boolean createdExecution() {
        return targets.stream().anyMatch(t -> t.executionId() != null && t.outcome() != TargetOutcome.DUPLICATE);
    }
}
