package com.guardrails.core.exception;

/**
 * Base exception for all guardrail errors.
 */
public class GuardrailException extends RuntimeException {

    private final String errorCode;

    public GuardrailException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public GuardrailException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
