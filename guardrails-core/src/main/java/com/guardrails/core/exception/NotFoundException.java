package com.guardrails.core.exception;

/**
 * Thrown when an execution or policy is not found.
 */
public class NotFoundException extends GuardrailException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
