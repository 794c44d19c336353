package com.guardrails.engine.policy;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one policy load: what was accepted and why the rest was rejected.
 */
public record PolicyLoadReport(
    String source,
    Instant loadedAt,
    List<String> accepted,
    List<Rejection> rejected
) {
    public PolicyLoadReport {
        accepted = List.copyOf(accepted);
        rejected = List.copyOf(rejected);
    }

    public boolean isClean() {
        return rejected.isEmpty();
    }

    /**
     * A policy document that did not make it into the set.
     */
    public record Rejection(String origin, String policyId, List<String> reasons) {
        public Rejection {
            reasons = List.copyOf(reasons);
        }
    }
}
