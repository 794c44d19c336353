package com.guardrails.core.exception;

import java.util.List;

/**
 * Thrown when one or more guardrail policies fail validation.
 * Carries every violation found, not just the first.
 */
public class PolicyValidationException extends GuardrailException {

    public static final String ERROR_CODE = "POLICY_VALIDATION_FAILED";

    private final List<String> violations;

    public PolicyValidationException(String policyId, List<String> violations) {
        super(ERROR_CODE, String.format(
            "Policy %s is invalid: %s",
            policyId, String.join("; ", violations)
        ));
        this.violations = List.copyOf(violations);
    }

    public PolicyValidationException(List<String> violations) {
        super(ERROR_CODE, "Policy load rejected: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
