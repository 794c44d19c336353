package com.guardrails.core.exception;

import java.util.List;

/**
 * Thrown when an incoming cost event is malformed.
 */
public class EventValidationException extends GuardrailException {

    public static final String ERROR_CODE = "INVALID_EVENT";

    private final List<String> violations;

    public EventValidationException(String eventId, List<String> violations) {
        super(ERROR_CODE, String.format(
            "Cost event %s is invalid: %s",
            eventId, String.join("; ", violations)
        ));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
