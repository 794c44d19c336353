package com.guardrails.engine.orchestrator;

import com.guardrails.core.model.ExecutionStatus;

import java.util.UUID;

/**
 * Per-target part of a decision. Execution id and status are null for simulated targets.
 */
public record TargetResult(
    String target,
    UUID executionId,
    ExecutionStatus status,
    TargetOutcome outcome
) {
    public static TargetResult simulated(String target) {
        return new TargetResult(target, null, null, TargetOutcome.SIMULATED);
    }
}
