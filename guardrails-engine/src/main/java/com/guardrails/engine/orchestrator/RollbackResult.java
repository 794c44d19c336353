package com.guardrails.engine.orchestrator;

/**
 * Outcome of one rollback attempt.
 */
public enum RollbackResult {
    /** Every stored diff was reverted; the execution is ROLLED_BACK. */
    ROLLED_BACK,
    /** Revert failed; the execution stays EXECUTED and the next sweep retries. */
    RETRY_SCHEDULED,
    /** Revert failed and the consecutive failure count just crossed the escalation threshold. */
    ESCALATED,
    /** No usable diff was stored; the execution was moved to FAILED for manual handling. */
    ABANDONED,
    /** Not due, already claimed, or another caller advanced the record first. */
    SKIPPED;

    public boolean isFailure() {
        return this == RETRY_SCHEDULED || this == ESCALATED || this == ABANDONED;
    }
}
