package com.guardrails.core.exception;

/**
 * Thrown when the audit ledger cannot be read or written.
 */
public class LedgerException extends GuardrailException {

    public static final String ERROR_CODE = "LEDGER_UNAVAILABLE";

    public LedgerException(String message) {
        super(ERROR_CODE, message);
    }

    public LedgerException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
