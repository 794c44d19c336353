package com.guardrails.engine.approval;

import com.guardrails.core.model.ExecutionStatus;

import java.util.UUID;

/**
 * Result of an approval callback. Status is the execution's status after the call, when known.
 */
public record ApprovalResult(ApprovalOutcome outcome, UUID executionId, ExecutionStatus status) {

    public static ApprovalResult denied(UUID executionId) {
        return new ApprovalResult(ApprovalOutcome.DENIED, executionId, null);
    }
}
