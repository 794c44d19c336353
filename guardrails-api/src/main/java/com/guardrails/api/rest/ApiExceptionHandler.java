package com.guardrails.api.rest;

import com.guardrails.core.exception.EventValidationException;
import com.guardrails.core.exception.ExecutorException;
import com.guardrails.core.exception.GuardrailException;
import com.guardrails.core.exception.InvalidStatusTransitionException;
import com.guardrails.core.exception.LedgerException;
import com.guardrails.core.exception.NotFoundException;
import com.guardrails.core.exception.OptimisticLockException;
import com.guardrails.core.exception.PolicyValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions to the common error body:
 * <pre>
 * {
 *   "error_code": "NOT_FOUND",
 *   "message": "...",
 *   "timestamp": "2025-01-15T10:00:00Z"
 * }
 * </pre>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(NotFoundException ex) {
        return errorResponse(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(PolicyValidationException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handlePolicyValidation(PolicyValidationException ex) {
        log.warn("Policy load rejected: {}", ex.getMessage());
        Map<String, Object> body = errorResponse(ex.getErrorCode(), ex.getMessage());
        body.put("violations", ex.getViolations());
        return body;
    }

    @ExceptionHandler(EventValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleEventValidation(EventValidationException ex) {
        Map<String, Object> body = errorResponse(ex.getErrorCode(), ex.getMessage());
        body.put("violations", ex.getViolations());
        return body;
    }

    @ExceptionHandler({OptimisticLockException.class, InvalidStatusTransitionException.class})
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleConflict(GuardrailException ex) {
        log.info("Conflicting update: {}", ex.getMessage());
        return errorResponse(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(ExecutorException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, Object> handleExecutor(ExecutorException ex) {
        log.error("Executor failure: {}", ex.getMessage());
        return errorResponse(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(LedgerException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleLedger(LedgerException ex) {
        log.error("Ledger unavailable: {}", ex.getMessage());
        return errorResponse(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return errorResponse("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(GuardrailException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleGuardrail(GuardrailException ex) {
        log.error("Unhandled guardrail error", ex);
        return errorResponse(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
