package com.guardrails.engine.plan;

import com.guardrails.core.model.ActionPlan;
import com.guardrails.core.model.CostEvent;
import com.guardrails.core.model.ExecutionMode;
import com.guardrails.core.model.GuardrailPolicy;
import com.guardrails.core.model.TargetPrincipal;
import com.guardrails.engine.matching.PrincipalPatterns;

import java.util.List;

/**
 * Turns a matched policy and its event into an immutable action plan.
 * Scope principals on the policy's principal allowlist are dropped from the targets.
 */
public class ActionPlanBuilder {

    private final boolean forceSimulate;

    /**
     * @param forceSimulate when true every plan resolves to {@link ExecutionMode#SIMULATE}
     */
    public ActionPlanBuilder(boolean forceSimulate) {
        this.forceSimulate = forceSimulate;
    }

    public ActionPlan build(CostEvent event, GuardrailPolicy policy) {
        List<String> allowlist = policy.exemptions().principals();
        List<TargetPrincipal> targets = policy.targets().stream()
            .filter(target -> !PrincipalPatterns.matchesAny(allowlist, target.arn()))
            .toList();

        ExecutionMode mode = forceSimulate ? ExecutionMode.SIMULATE : policy.mode();

        return new ActionPlan(
            true,
            event.eventId(),
            policy.policyId(),
            mode,
            targets,
            policy.actions(),
            policy.ttl(),
            policy.notification()
        );
    }

    public boolean isForceSimulate() {
        return forceSimulate;
    }
}
