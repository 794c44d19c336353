package com.guardrails.engine.approval;

/**
 * Internal verification result. Only {@link #VALID} lets a callback through; callers outside
 * the gateway never see which of the other two applied.
 */
public enum TokenVerification {
    VALID,
    INVALID,
    STALE
}
