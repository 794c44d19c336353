package com.guardrails.engine.orchestrator;

import com.guardrails.core.model.NotificationRoute;

import java.time.Duration;

/**
 * Tunables of the execution lifecycle.
 *
 * @param approvalWindow       how long a PLANNED execution waits for a decision
 * @param approvalBaseUrl      base URL the approve/reject links in approval requests point at
 * @param escalationThreshold  consecutive rollback failures tolerated before a human is paged
 * @param rollbackClaim        how long a rollback claim keeps other sweeps away; renewed before each
 *                             revert, so it must exceed the executor timeout
 * @param fallbackRoute        notification route for executions whose policy is no longer loaded
 */
public record OrchestratorSettings(
    Duration approvalWindow,
    String approvalBaseUrl,
    int escalationThreshold,
    Duration rollbackClaim,
    NotificationRoute fallbackRoute
) {
    public static final Duration DEFAULT_APPROVAL_WINDOW = Duration.ofHours(1);
    public static final int DEFAULT_ESCALATION_THRESHOLD = 3;
    public static final Duration DEFAULT_ROLLBACK_CLAIM = Duration.ofMinutes(2);

    public OrchestratorSettings {
        if (approvalWindow == null || approvalWindow.isNegative() || approvalWindow.isZero()) {
            throw new IllegalArgumentException("approvalWindow must be positive");
        }
        if (escalationThreshold < 0) {
            throw new IllegalArgumentException("escalationThreshold must be >= 0");
        }
        if (rollbackClaim == null || rollbackClaim.isNegative() || rollbackClaim.isZero()) {
            throw new IllegalArgumentException("rollbackClaim must be positive");
        }
        approvalBaseUrl = approvalBaseUrl == null ? "" : stripTrailingSlash(approvalBaseUrl);
        fallbackRoute = fallbackRoute == null ? NotificationRoute.to("default") : fallbackRoute;
    }

    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings(
            DEFAULT_APPROVAL_WINDOW,
            "http://localhost:8080",
            DEFAULT_ESCALATION_THRESHOLD,
            DEFAULT_ROLLBACK_CLAIM,
            NotificationRoute.to("default")
        );
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
