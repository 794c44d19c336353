package com.guardrails.engine.approval;

import java.time.Instant;

/**
 * A signed approval token and the window it is valid for.
 */
public record ApprovalToken(String value, Instant issuedAt, Instant expiresAt) {
}
