package com.guardrails.engine.policy;

import com.guardrails.core.model.GuardrailPolicy;

/**
 * One policy as read from a source, or the reason it could not be read.
 *
 * @param origin Where it came from, e.g. {@code 10-ci.yaml#0}
 * @param policy The parsed policy, null if parsing failed
 * @param parseError Parse failure message, null on success
 */
public record PolicyDocument(String origin, GuardrailPolicy policy, String parseError) {

    public static PolicyDocument parsed(String origin, GuardrailPolicy policy) {
        return new PolicyDocument(origin, policy, null);
    }

    public static PolicyDocument unreadable(String origin, String parseError) {
        return new PolicyDocument(origin, null, parseError);
    }

    public boolean isParsed() {
        return policy != null;
    }
}
