package com.guardrails.core.exception;

import com.guardrails.core.model.ExecutionStatus;
import java.util.UUID;

/**
 * Thrown when an execution status transition is not allowed.
 */
public class InvalidStatusTransitionException extends GuardrailException {

    public static final String ERROR_CODE = "INVALID_STATUS_TRANSITION";

    public InvalidStatusTransitionException(UUID executionId, ExecutionStatus from, ExecutionStatus to) {
        super(ERROR_CODE, String.format(
            "Invalid status transition for execution %s: %s -> %s",
            executionId, from, to
        ));
    }
}
