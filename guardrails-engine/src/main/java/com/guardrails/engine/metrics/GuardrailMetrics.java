package com.guardrails.engine.metrics;

import com.guardrails.core.model.ExecutionStatus;
import com.guardrails.core.repository.ExecutionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.Map;

/**
 * Operational metrics for the guardrail controller.
 *
 * Metrics exposed:
 * - Event decisions by outcome
 * - Execution transitions by status and mode
 * - Approval resolutions by outcome
 * - Rollback results, escalations and sweep latency
 * - Executions per status (gauges, when bound to a ledger)
 */
public class GuardrailMetrics implements MeterBinder {

    // Metric names
    public static final String EVENTS = "guardrails.events";
    public static final String TRANSITIONS = "guardrails.executions.transitions";
    public static final String EXECUTIONS = "guardrails.executions";
    public static final String APPROVALS = "guardrails.approvals";
    public static final String ROLLBACKS = "guardrails.rollbacks";
    public static final String ESCALATIONS = "guardrails.rollback.escalations";
    public static final String SWEEP_DURATION = "guardrails.sweep.duration";
    public static final String NOTIFICATION_FAILURES = "guardrails.notifications.failed";
    public static final String EXECUTOR_DURATION = "guardrails.executor.duration";

    private final MeterRegistry registry;
    private ExecutionRepository gaugeSource;

    public GuardrailMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Register per-status gauges read from the ledger.
     */
    public GuardrailMetrics withExecutionGauges(ExecutionRepository executions) {
        this.gaugeSource = executions;
        bindTo(registry);
        return this;
    }

    @Override
    public void bindTo(MeterRegistry meterRegistry) {
        if (gaugeSource == null) {
            return;
        }
        for (ExecutionStatus status : ExecutionStatus.values()) {
            Gauge.builder(EXECUTIONS, gaugeSource, repo -> count(repo.countByStatus(), status))
                .tag("status", status.name())
                .description("Number of executions in " + status + " status")
                .register(meterRegistry);
        }
    }

    private static double count(Map<ExecutionStatus, Long> counts, ExecutionStatus status) {
        Long value = counts.get(status);
        return value == null ? 0 : value;
    }

    // ========== Event Metrics ==========

    public void eventEvaluated(String outcome) {
        Counter.builder(EVENTS)
            .tag("outcome", outcome)
            .description("Cost events evaluated")
            .register(registry)
            .increment();
    }

    // ========== Execution Metrics ==========

    public void transition(ExecutionStatus status, String mode) {
        Counter.builder(TRANSITIONS)
            .tag("status", status.name())
            .tag("mode", mode)
            .description("Execution status transitions")
            .register(registry)
            .increment();
    }

    public void executorCall(String operation, Duration duration, boolean success) {
        Timer.builder(EXECUTOR_DURATION)
            .tag("operation", operation)
            .tag("outcome", success ? "success" : "failure")
            .description("Guardrail executor call latency")
            .register(registry)
            .record(duration);
    }

    // ========== Approval Metrics ==========

    public void approvalResolved(String outcome) {
        Counter.builder(APPROVALS)
            .tag("outcome", outcome)
            .description("Approval callbacks by outcome")
            .register(registry)
            .increment();
    }

    // ========== Rollback Metrics ==========

    public void rollback(String result) {
        Counter.builder(ROLLBACKS)
            .tag("result", result)
            .description("Rollback attempts by result")
            .register(registry)
            .increment();
    }

    public void rollbackEscalated() {
        Counter.builder(ESCALATIONS)
            .description("Executions escalated after repeated rollback failures")
            .register(registry)
            .increment();
    }

    public void sweepCompleted(Duration duration) {
        Timer.builder(SWEEP_DURATION)
            .description("Rollback sweep duration")
            .register(registry)
            .record(duration);
    }

    // ========== Notification Metrics ==========

    public void notificationFailed(String type) {
        Counter.builder(NOTIFICATION_FAILURES)
            .tag("type", type)
            .description("Notifications the sink failed to deliver")
            .register(registry)
            .increment();
    }
}
