package com.guardrails.engine.orchestrator;

public enum TargetOutcome {
    SIMULATED,
    APPROVAL_REQUESTED,
    EXECUTED,
    FAILED,
    DUPLICATE
}
