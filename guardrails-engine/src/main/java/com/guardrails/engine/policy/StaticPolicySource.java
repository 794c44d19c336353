package com.guardrails.engine.policy;

import com.guardrails.core.model.GuardrailPolicy;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed, in-code list of policies. Declared order is list order.
 */
public class StaticPolicySource implements PolicySource {

    private final List<GuardrailPolicy> policies;

    public StaticPolicySource(List<GuardrailPolicy> policies) {
        this.policies = List.copyOf(policies);
    }

    @Override
    public List<PolicyDocument> read() {
        List<PolicyDocument> documents = new ArrayList<>();
        for (int i = 0; i < policies.size(); i++) {
            documents.add(PolicyDocument.parsed("static#" + i, policies.get(i)));
        }
        return documents;
    }

    @Override
    public String describe() {
        return "static(" + policies.size() + ")";
    }
}
