package com.guardrails.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures every log line of an evaluation, approval or rollback carries its correlation keys.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forEvent(event.eventId())) {
 *     log.info("Evaluating cost event"); // includes eventId and traceId
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2025-01-15 10:30:45.123 [http-nio-8080-exec-1] INFO  c.g.e.o.ExecutionOrchestrator - Execution planned
 *   eventId=evt-abc123 policyId=ci-ec2-spike executionId=5f0c... target=arn:aws:iam::123456789012:role/ci
 */
public final class LoggingContext implements AutoCloseable {

    public static final String EVENT_ID = "eventId";
    public static final String POLICY_ID = "policyId";
    public static final String EXECUTION_ID = "executionId";
    public static final String TARGET = "target";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for the evaluation of one cost event.
     */
    public static LoggingContext forEvent(String eventId) {
        LoggingContext ctx = new LoggingContext();
        if (eventId != null) {
            MDC.put(EVENT_ID, eventId);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for operations on one execution.
     */
    public static LoggingContext forExecution(UUID executionId, String policyId, String targetArn) {
        LoggingContext ctx = new LoggingContext();
        if (executionId != null) {
            MDC.put(EXECUTION_ID, executionId.toString());
        }
        if (policyId != null) {
            MDC.put(POLICY_ID, policyId);
        }
        if (targetArn != null) {
            MDC.put(TARGET, targetArn);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Add the matched policy to the current context.
     */
    public static void setPolicyId(String policyId) {
        if (policyId != null) {
            MDC.put(POLICY_ID, policyId);
        }
    }

    /**
     * Add the execution and its target to the current context.
     */
    public static void setExecution(UUID executionId, String targetArn) {
        if (executionId != null) {
            MDC.put(EXECUTION_ID, executionId.toString());
        }
        if (targetArn != null) {
            MDC.put(TARGET, targetArn);
        }
    }

    /**
     * Get current trace ID from context.
     */
    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(EVENT_ID);
        MDC.remove(POLICY_ID);
        MDC.remove(EXECUTION_ID);
        MDC.remove(TARGET);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request or scheduler tick.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
