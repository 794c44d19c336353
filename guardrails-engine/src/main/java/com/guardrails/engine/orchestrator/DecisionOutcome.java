package com.guardrails.engine.orchestrator;

/**
 * What {@link ExecutionOrchestrator#evaluate} did with a cost event.
 */
public enum DecisionOutcome {
    /** No enabled, non-exempt policy matched. */
    NO_MATCH,
    /** Simulate mode: decision recorded and notified, nothing persisted or applied. */
    SIMULATED,
    /** Approve mode: at least one PLANNED execution created and an approval requested. */
    APPROVAL_REQUESTED,
    /** Automatic mode: every new execution reached EXECUTED. */
    EXECUTED,
    /** At least one new execution ended in FAILED: an automatic apply failed or an approval request could not be sent. */
    FAILED,
    /** Every target already had an active execution or had seen this event before. */
    DUPLICATE,
    /** The event was malformed. */
    INVALID_EVENT,
    /** Processing failed unexpectedly; a failure record was written. */
    ERROR
}
