package com.guardrails.engine.approval;

public enum ApprovalOutcome {
    /** Approved and the guardrail was applied. */
    EXECUTED,
    /** Rejected; nothing was applied. */
    REJECTED,
    /** The execution was no longer PLANNED. Not an error. */
    ALREADY_RESOLVED,
    /** Token malformed, forged or stale. The reason is deliberately not exposed. */
    DENIED,
    /** Approved, but the executor failed; the execution is FAILED. */
    FAILED,
    /** Authentic token for an execution the ledger does not know. */
    NOT_FOUND
}
