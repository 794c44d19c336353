package com.guardrails.core.exception;

/**
 * Thrown when a compare-and-swap write finds a different version than expected.
 * Callers treat this as "someone else already advanced the record".
 */
public class OptimisticLockException extends GuardrailException {

    public static final String ERROR_CODE = "OPTIMISTIC_LOCK_CONFLICT";

    public OptimisticLockException(String entityType, String entityId, long expectedVersion, long actualVersion) {
        super(ERROR_CODE, String.format(
            "Optimistic lock conflict on %s[%s]: expected version %d, actual version %d",
            entityType, entityId, expectedVersion, actualVersion
        ));
    }
}
