package com.guardrails.core.model;

/**
 * Types of entries in the append-only audit log.
 */
public enum AuditRecordType {
    // Decisions
    DECISION_SIMULATED,
    DUPLICATE_SUPPRESSED,

    // Execution lifecycle
    EXECUTION_PLANNED,
    APPROVAL_REQUESTED,
    EXECUTION_APPROVED,
    EXECUTION_REJECTED,
    EXECUTION_EXPIRED,
    EXECUTION_APPLIED,
    EXECUTION_FAILED,

    // Rollback
    ROLLBACK_COMPLETED,
    ROLLBACK_FAILED,
    ROLLBACK_ESCALATED,

    // Durable failure record for an event that could not be processed
    EVENT_PROCESSING_FAILED
}
