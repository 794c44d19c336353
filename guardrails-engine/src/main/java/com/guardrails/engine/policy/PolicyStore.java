package com.guardrails.engine.policy;

import com.guardrails.core.exception.PolicyValidationException;
import com.guardrails.core.model.GuardrailPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads, validates and holds the current ordered policy set.
 *
 * Lenient mode keeps every valid policy and reports the rest; strict mode refuses the whole
 * load if anything is rejected and keeps the previous snapshot. A failed reload never
 * clears a snapshot that is already serving.
 */
public class PolicyStore {

    private static final Logger log = LoggerFactory.getLogger(PolicyStore.class);

    private final PolicySource source;
    private final PolicyValidator validator;
    private final boolean strict;
    private final Clock clock;

    private final AtomicReference<PolicySet> current = new AtomicReference<>(PolicySet.EMPTY);
    private final AtomicReference<PolicyLoadReport> lastReport = new AtomicReference<>();

    public PolicyStore(PolicySource source, PolicyValidator validator, boolean strict, Clock clock) {
        this.source = source;
        this.validator = validator;
        this.strict = strict;
        this.clock = clock;
    }

    /**
     * Convenience for a fixed list: loads it immediately in strict mode.
     */
    public static PolicyStore of(List<GuardrailPolicy> policies, Clock clock) {
        PolicyStore store = new PolicyStore(new StaticPolicySource(policies), new PolicyValidator(), true, clock);
        store.reload();
        return store;
    }

    /**
     * The policy set the engine evaluates against right now.
     */
    public PolicySet snapshot() {
        return current.get();
    }

    public PolicyLoadReport lastReport() {
        return lastReport.get();
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * Re-read the source and swap in the new set.
     *
     * @throws PolicyValidationException in strict mode when any document is rejected
     */
    public PolicyLoadReport reload() {
        Instant now = clock.instant();
        List<PolicyDocument> documents = source.read();

        List<GuardrailPolicy> accepted = new ArrayList<>();
        List<PolicyLoadReport.Rejection> rejected = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        for (PolicyDocument document : documents) {
            if (!document.isParsed()) {
                rejected.add(new PolicyLoadReport.Rejection(document.origin(), null,
                    List.of("unreadable: " + document.parseError())));
                continue;
            }
            GuardrailPolicy policy = document.policy();
            List<String> violations = new ArrayList<>(validator.violations(policy));
            if (policy.policyId() != null && !seenIds.add(policy.policyId())) {
                violations.add("duplicate policy_id " + policy.policyId());
            }
            if (violations.isEmpty()) {
                accepted.add(policy);
            } else {
                rejected.add(new PolicyLoadReport.Rejection(document.origin(), policy.policyId(), violations));
            }
        }

        for (PolicyLoadReport.Rejection rejection : rejected) {
            log.error("Rejected policy {} from {}: {}", rejection.policyId(), rejection.origin(),
                String.join("; ", rejection.reasons()));
        }

        PolicyLoadReport report = new PolicyLoadReport(
            source.describe(),
            now,
            accepted.stream().map(GuardrailPolicy::policyId).toList(),
            rejected
        );
        lastReport.set(report);

        if (strict && !rejected.isEmpty()) {
            List<String> reasons = rejected.stream()
                .map(r -> r.origin() + ": " + String.join(", ", r.reasons()))
                .toList();
            throw new PolicyValidationException(reasons);
        }

        current.set(new PolicySet(accepted, now));
        log.info("Loaded {} policies from {} ({} rejected)", accepted.size(), source.describe(), rejected.size());
        return report;
    }
}
