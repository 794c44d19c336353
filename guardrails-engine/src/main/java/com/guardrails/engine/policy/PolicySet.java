package com.guardrails.engine.policy;

import com.guardrails.core.model.GuardrailPolicy;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, ordered snapshot of valid policies. Order is the matcher's evaluation order.
 */
public record PolicySet(List<GuardrailPolicy> policies, Instant loadedAt) {

    public static final PolicySet EMPTY = new PolicySet(List.of(), Instant.EPOCH);

    public PolicySet {
        policies = List.copyOf(policies);
    }

    public Optional<GuardrailPolicy> find(String policyId) {
        return policies.stream().filter(p -> p.policyId().equals(policyId)).findFirst();
    }

    public int size() {
        return policies.size();
    }
}
