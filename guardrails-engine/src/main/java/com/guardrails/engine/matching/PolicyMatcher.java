package com.guardrails.engine.matching;

import com.guardrails.core.model.CostEvent;
import com.guardrails.core.model.GuardrailPolicy;
import com.guardrails.core.model.MatchCriteria;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Maps a cost event and an ordered policy set to at most one policy.
 *
 * The first enabled policy whose predicate holds and which is not exempted wins; evaluation
 * stops there. Deterministic and side-effect free apart from debug logging.
 */
public class PolicyMatcher {

    private static final Logger log = LoggerFactory.getLogger(PolicyMatcher.class);

    private final ExemptionEvaluator exemptions;

    public PolicyMatcher(ExemptionEvaluator exemptions) {
        this.exemptions = exemptions;
    }

    public PolicyMatcher() {
        this(new ExemptionEvaluator());
    }

    public Optional<GuardrailPolicy> match(CostEvent event, List<GuardrailPolicy> policies, Instant evaluatedAt) {
        for (GuardrailPolicy policy : policies) {
            if (!policy.active()) {
                log.debug("Skipping disabled policy {}", policy.policyId());
                continue;
            }
            if (!satisfies(policy.match(), event)) {
                continue;
            }
            Optional<String> exemption = exemptions.exemption(policy, event, evaluatedAt);
            if (exemption.isPresent()) {
                log.debug("Policy {} exempted for event {}: {}", policy.policyId(), event.eventId(), exemption.get());
                continue;
            }
            return Optional.of(policy);
        }
        return Optional.empty();
    }

    /**
     * Logical AND across source, account, amount range and the optional service/region filters.
     * A service or region filter with the detail absent from the event does not match.
     */
    public boolean satisfies(MatchCriteria criteria, CostEvent event) {
        if (criteria == null) {
            return false;
        }
        if (!criteria.sources().contains(event.source())) {
            log.debug("Source mismatch: {} not in {}", event.source(), criteria.sources());
            return false;
        }
        if (!criteria.accountIds().contains(event.accountId())) {
            log.debug("Account mismatch: {} not in {}", event.accountId(), criteria.accountIds());
            return false;
        }
        BigDecimal amount = event.amount();
        if (criteria.minAmount() != null && amount.compareTo(criteria.minAmount()) < 0) {
            log.debug("Amount below threshold: {} < {}", amount, criteria.minAmount());
            return false;
        }
        if (criteria.maxAmount() != null && amount.compareTo(criteria.maxAmount()) > 0) {
            log.debug("Amount above threshold: {} > {}", amount, criteria.maxAmount());
            return false;
        }
        if (!criteria.services().isEmpty()) {
            Optional<String> service = event.detail(CostEvent.DETAIL_SERVICE);
            if (service.isEmpty() || !criteria.services().contains(service.get())) {
                log.debug("Service mismatch: {} not in {}", service.orElse(null), criteria.services());
                return false;
            }
        }
        if (!criteria.regions().isEmpty()) {
            Optional<String> region = event.detail(CostEvent.DETAIL_REGION);
            if (region.isEmpty() || !criteria.regions().contains(region.get())) {
                log.debug("Region mismatch: {} not in {}", region.orElse(null), criteria.regions());
                return false;
            }
        }
        return true;
    }
}
