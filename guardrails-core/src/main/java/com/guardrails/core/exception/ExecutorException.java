package com.guardrails.core.exception;

import java.time.Duration;

/**
 * Thrown when the guardrail executor fails or does not answer in time.
 * Always ends the execution in FAILED; never retried within the triggering call.
 */
public class ExecutorException extends GuardrailException {

    public static final String ERROR_CODE = "EXECUTOR_FAILED";
    public static final String TIMEOUT_CODE = "EXECUTOR_TIMEOUT";

    public ExecutorException(String message) {
        super(ERROR_CODE, message);
    }

    public ExecutorException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }

    private ExecutorException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static ExecutorException timeout(String operation, Duration timeout) {
        return new ExecutorException(TIMEOUT_CODE,
            String.format("Executor call %s timed out after %d ms", operation, timeout.toMillis()), null);
    }

    public boolean isTimeout() {
        return TIMEOUT_CODE.equals(getErrorCode());
    }
}
