package com.guardrails.testsupport;

import com.guardrails.core.model.CostEvent;
import com.guardrails.core.model.ExecutionMode;
import com.guardrails.core.model.GuardrailAction;
import com.guardrails.core.model.GuardrailPolicy;
import com.guardrails.core.model.MatchCriteria;
import com.guardrails.core.model.NotificationRoute;
import com.guardrails.core.model.SourceKind;
import com.guardrails.core.model.TargetPrincipal;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical events and policies used across module tests.
 */
public final class GuardrailFixtures {

    public static final String ACCOUNT = "A1";
    public static final String ROLE_R1 = "arn:aws:iam::123456789012:role/R1";
    public static final String ROLE_R2 = "arn:aws:iam::123456789012:role/R2";

    private GuardrailFixtures() {
    }

    public static CostEvent budgetEvent(String eventId, String amount) {
        return budgetEvent(eventId, ACCOUNT, amount, Map.of());
    }

    public static CostEvent budgetEvent(String eventId, String accountId, String amount, Map<String, Object> details) {
        return new CostEvent(eventId, SourceKind.BUDGET_THRESHOLD, accountId,
            new BigDecimal(amount), "2025-01", new LinkedHashMap<>(details));
    }

    public static MatchCriteria budgetsAbove(String minAmount) {
        return new MatchCriteria(List.of(SourceKind.BUDGET_THRESHOLD), List.of(ACCOUNT),
            new BigDecimal(minAmount), null, null, null);
    }

    /**
     * Policy {min_amount: 200, mode, ttl} targeting role R1 in account A1.
     */
    public static GuardrailPolicy policy(String policyId, ExecutionMode mode, int ttlMinutes) {
        return GuardrailPolicy.builder(policyId)
            .mode(mode)
            .ttlMinutes(ttlMinutes)
            .match(budgetsAbove("200"))
            .principal(TargetPrincipal.role(ROLE_R1))
            .action(GuardrailAction.denying("ec2:RunInstances", "ec2:CreateNatGateway"))
            .notification(NotificationRoute.to("/guardrails/slack_webhook"))
            .build();
    }
}
