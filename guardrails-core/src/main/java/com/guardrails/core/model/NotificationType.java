package com.guardrails.core.model;

public enum NotificationType {
    DRY_RUN,
    APPROVAL_REQUEST,
    EXECUTION_CONFIRMED,
    EXECUTION_FAILED,
    APPROVAL_REJECTED,
    APPROVAL_EXPIRED,
    ROLLBACK_CONFIRMED,
    ROLLBACK_ESCALATION
}
