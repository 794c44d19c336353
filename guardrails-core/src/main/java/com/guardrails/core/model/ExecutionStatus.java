package com.guardrails.core.model;

/**
 * Lifecycle states for an action execution.
 * Transitions follow a strict state machine, see {@link #canTransitionTo(ExecutionStatus)}.
 */
public enum ExecutionStatus {
    /**
     * Created, nothing applied yet.
     * Transitions: -> APPROVED, REJECTED, EXPIRED, EXECUTED, FAILED
     */
    PLANNED,

    /**
     * A valid approval claimed the execution; the executor is being invoked.
     * Transitions: -> EXECUTED, FAILED
     */
    APPROVED,

    /**
     * Approver declined. Terminal state, nothing applied.
     */
    REJECTED,

    /**
     * Approval window elapsed. Terminal state, nothing applied.
     */
    EXPIRED,

    /**
     * Guardrail applied and diff captured.
     * Transitions: -> ROLLED_BACK, FAILED
     */
    EXECUTED,

    /**
     * Guardrail reverted from its stored diff. Terminal state.
     */
    ROLLED_BACK,

    /**
     * Executor failed, or the rollback basis is unusable. Terminal state, requires human attention.
     */
    FAILED;

    /**
     * Check if this status is terminal (no further transitions possible).
     */
    public boolean isTerminal() {
        return this == REJECTED || this == EXPIRED || this == ROLLED_BACK || this == FAILED;
    }

    /**
     * Check if an execution in this status occupies its (policy, target) slot.
     */
    public boolean isActive() {
        return !isTerminal();
    }

    /**
     * Check if a guardrail may currently be in effect on the target.
     */
    public boolean isApplied() {
        return this == EXECUTED;
    }

    /**
     * Check if this status can transition to the target status.
     */
    public boolean canTransitionTo(ExecutionStatus target) {
        return switch (this) {
            case PLANNED -> target == APPROVED || target == REJECTED || target == EXPIRED ||
                           target == EXECUTED || target == FAILED;
            case APPROVED -> target == EXECUTED || target == FAILED;
            case EXECUTED -> target == ROLLED_BACK || target == FAILED;
            case REJECTED, EXPIRED, ROLLED_BACK, FAILED -> false;
        };
    }
}
