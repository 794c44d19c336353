package com.guardrails.engine.orchestrator;

import com.guardrails.core.model.ActionExecution;
import com.guardrails.core.model.AuditRecord;
import com.guardrails.core.model.AuditRecordType;
import com.guardrails.core.model.ExecutionMode;
import com.guardrails.core.model.ExecutionStatus;
import com.guardrails.core.model.ExemptionWindow;
import com.guardrails.core.model.Exemptions;
import com.guardrails.core.model.GuardrailAction;
import com.guardrails.core.model.GuardrailPolicy;
import com.guardrails.core.model.Notification;
import com.guardrails.core.model.NotificationType;
import com.guardrails.core.model.StateDiff;
import com.guardrails.core.model.TargetPrincipal;
import com.guardrails.engine.GuardrailHarness;
import com.guardrails.engine.execution.BoundedCalls;
import com.guardrails.engine.metrics.GuardrailMetrics;
import com.guardrails.engine.notification.NotificationDispatcher;
import com.guardrails.engine.persistence.InMemoryAuditLogRepository;
import com.guardrails.testsupport.RecordingGuardrailExecutor;
import io.micrometer.core.instrument.Counter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.guardrails.testsupport.GuardrailFixtures.*;
import static org.assertj.core.api.Assertions.*;

class ExecutionOrchestratorTest {

    private GuardrailHarness harness;

    @AfterEach
    void tearDown() {
        if (harness != null) {
            harness.close();
        }
    }

    private ActionExecution execution(Decision decision) {
        UUID id = decision.targets().get(0).executionId();
        return harness.executions.findById(id).orElseThrow();
    }

    private List<AuditRecordType> auditTypes(UUID executionId) {
        return harness.auditLog.findByExecution(executionId).stream().map(AuditRecord::type).toList();
    }

    // ========== Simulate ==========

    @Test
    @DisplayName("Simulate mode notifies and audits but never persists or applies")
    void evaluate_simulateShouldNotCreateExecution() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.SIMULATE, 180));

        Decision decision = harness.orchestrator.evaluate(budgetEvent("e1", "250"));

        assertThat(decision.outcome()).isEqualTo(DecisionOutcome.SIMULATED);
        assertThat(decision.createdExecution()).isFalse();
        assertThat(decision.targets()).singleElement()
            .satisfies(t -> assertThat(t.outcome()).isEqualTo(TargetOutcome.SIMULATED));
        assertThat(harness.executions.findRecent(10)).isEmpty();
        assertThat(harness.executor.applyCalls()).isEmpty();
        assertThat(harness.sink.ofType(NotificationType.DRY_RUN)).singleElement()
            .satisfies(n -> assertThat(n.target()).isEqualTo(ROLE_R1));
        assertThat(harness.auditLog.findByEvent("e1")).extracting(AuditRecord::type)
            .containsExactly(AuditRecordType.DECISION_SIMULATED);
    }

    @Test
    void evaluate_forcedSimulateShouldOverrideAutomaticPolicy() {
        harness = new GuardrailHarness(true, Duration.ofSeconds(2),
            List.of(policy("p1", ExecutionMode.AUTOMATIC, 60)));

        Decision decision = harness.orchestrator.evaluate(budgetEvent("e1", "250"));

        assertThat(decision.outcome()).isEqualTo(DecisionOutcome.SIMULATED);
        assertThat(decision.mode()).isEqualTo(ExecutionMode.SIMULATE);
        assertThat(harness.executor.applyCalls()).isEmpty();
    }

    @Test
    void evaluate_shouldReturnNoMatchBelowThreshold() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.AUTOMATIC, 60));

        Decision decision = harness.orchestrator.evaluate(budgetEvent("e1", "199.99"));

        assertThat(decision.outcome()).isEqualTo(DecisionOutcome.NO_MATCH);
        assertThat(harness.executions.findRecent(10)).isEmpty();
        assertThat(harness.sink.sent()).isEmpty();
    }

    @Test
    void evaluate_shouldRecordInvalidEvent() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.AUTOMATIC, 60));

        Decision decision = harness.orchestrator.evaluate(budgetEvent("bad", "-5"));

        assertThat(decision.outcome()).isEqualTo(DecisionOutcome.INVALID_EVENT);
        assertThat(harness.auditLog.findByEvent("bad")).extracting(AuditRecord::type)
            .containsExactly(AuditRecordType.EVENT_PROCESSING_FAILED);
        assertThat(harness.executor.applyCalls()).isEmpty();
    }

    // ========== Exemptions ==========

    private void assertExempted(Decision decision) {
        assertThat(decision.outcome()).isEqualTo(DecisionOutcome.NO_MATCH);
        assertThat(decision.createdExecution()).isFalse();
        assertThat(harness.executions.findRecent(10)).isEmpty();
        assertThat(harness.executor.applyCalls()).isEmpty();
        assertThat(harness.sink.sent()).isEmpty();
    }

    @Test
    @DisplayName("An allowlisted account suppresses the policy before anything is planned")
    void evaluate_accountExemptionShouldReturnNoMatch() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.AUTOMATIC, 60).toBuilder()
            .exemptions(new Exemptions(List.of(ACCOUNT), List.of(), List.of()))
            .build());

        assertExempted(harness.orchestrator.evaluate(budgetEvent("e1", "250")));
    }

    @Test
    void evaluate_principalExemptionShouldReturnNoMatch() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.AUTOMATIC, 60).toBuilder()
            .exemptions(new Exemptions(List.of(), List.of("arn:aws:iam::123456789012:role/*"), List.of()))
            .build());

        assertExempted(harness.orchestrator.evaluate(budgetEvent("e1", "250")));
    }

    @Test
    void evaluate_timeWindowExemptionShouldReturnNoMatch() {
        // the harness clock reads Wednesday 10:00 UTC
        ExemptionWindow window = new ExemptionWindow("09:00", "11:00", "UTC", List.of("wed"));
        harness = new GuardrailHarness(policy("p1", ExecutionMode.AUTOMATIC, 60).toBuilder()
            .exemptions(new Exemptions(List.of(), List.of(), List.of(window)))
            .build());

        assertExempted(harness.orchestrator.evaluate(budgetEvent("e1", "250")));

        harness.clock.advanceMinutes(61);
        assertThat(harness.orchestrator.evaluate(budgetEvent("e2", "250")).outcome())
            .isEqualTo(DecisionOutcome.EXECUTED);
    }

    // ========== Approve ==========

    @Test
    void evaluate_approveShouldPlanAndRequestApproval() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.APPROVE, 180));

        Decision decision = harness.orchestrator.evaluate(budgetEvent("e1", "250"));

        assertThat(decision.outcome()).isEqualTo(DecisionOutcome.APPROVAL_REQUESTED);
        ActionExecution planned = execution(decision);
        assertThat(planned.status()).isEqualTo(ExecutionStatus.PLANNED);
        assertThat(planned.approvalDeadline()).isEqualTo(harness.clock.instant().plus(Duration.ofHours(1)));
        assertThat(planned.idempotencyKey()).isEqualTo("e1:p1:" + ROLE_R1);
        assertThat(harness.executor.applyCalls()).isEmpty();

        Notification request = harness.sink.ofType(NotificationType.APPROVAL_REQUEST).get(0);
        assertThat(request.executionId()).isEqualTo(planned.executionId());
        assertThat((String) request.attributes().get("approve_url"))
            .startsWith("http://localhost:8080/api/v1/approvals/" + planned.executionId() + "?token=")
            .endsWith("&decision=approve");
        assertThat((String) request.attributes().get("reject_url")).endsWith("&decision=reject");
        assertThat(auditTypes(planned.executionId()))
            .containsExactly(AuditRecordType.EXECUTION_PLANNED, AuditRecordType.APPROVAL_REQUESTED);
    }

    @Test
    @DisplayName("Approval within the window applies the guardrail and schedules rollback from approval time")
    void approve_shouldApplyAndScheduleRollback() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.APPROVE, 180));
        UUID id = execution(harness.orchestrator.evaluate(budgetEvent("e1", "250"))).executionId();

        harness.clock.advanceMinutes(30);
        ActionExecution executed = harness.orchestrator.approve(id, "alice").orElseThrow();

        assertThat(executed.status()).isEqualTo(ExecutionStatus.EXECUTED);
        assertThat(executed.executedBy()).isEqualTo("user:alice");
        assertThat(executed.resolvedBy()).isEqualTo("alice");
        assertThat(executed.ttlExpiresAt()).isEqualTo(harness.clock.instant().plus(Duration.ofMinutes(180)));
        assertThat(executed.diffs()).hasSize(1);
        assertThat(harness.executor.deniesOn(ROLE_R1)).containsExactly("ec2:RunInstances", "ec2:CreateNatGateway");
        assertThat(harness.sink.ofType(NotificationType.EXECUTION_CONFIRMED)).hasSize(1);
        assertThat(auditTypes(id)).containsExactly(
            AuditRecordType.EXECUTION_PLANNED, AuditRecordType.APPROVAL_REQUESTED,
            AuditRecordType.EXECUTION_APPROVED, AuditRecordType.EXECUTION_APPLIED);
    }

    @Test
    void approve_shouldBeNoOpOnceResolved() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.APPROVE, 180));
        UUID id = execution(harness.orchestrator.evaluate(budgetEvent("e1", "250"))).executionId();

        harness.orchestrator.approve(id, "alice");

        assertThat(harness.orchestrator.approve(id, "bob")).isEmpty();
        assertThat(harness.orchestrator.reject(id, "bob")).isEmpty();
        assertThat(harness.executor.applyCalls()).hasSize(1);
    }

    @Test
    void approve_afterDeadlineShouldExpire() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.APPROVE, 180));
        UUID id = execution(harness.orchestrator.evaluate(budgetEvent("e1", "250"))).executionId();

        harness.clock.advanceMinutes(60);

        assertThat(harness.orchestrator.approve(id, "alice")).isEmpty();
        assertThat(harness.executions.findById(id).orElseThrow().status()).isEqualTo(ExecutionStatus.EXPIRED);
        assertThat(harness.sink.ofType(NotificationType.APPROVAL_EXPIRED)).hasSize(1);
        assertThat(harness.executor.applyCalls()).isEmpty();
    }

    @Test
    void reject_shouldCloseExecutionAndFreeTheSlot() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.APPROVE, 180));
        UUID id = execution(harness.orchestrator.evaluate(budgetEvent("e1", "250"))).executionId();

        ActionExecution rejected = harness.orchestrator.reject(id, "alice").orElseThrow();

        assertThat(rejected.status()).isEqualTo(ExecutionStatus.REJECTED);
        assertThat(harness.sink.ofType(NotificationType.APPROVAL_REJECTED)).hasSize(1);
        assertThat(harness.executor.applyCalls()).isEmpty();

        Decision next = harness.orchestrator.evaluate(budgetEvent("e2", "300"));
        assertThat(next.outcome()).isEqualTo(DecisionOutcome.APPROVAL_REQUESTED);
    }

    @Test
    void failInterrupted_shouldFailApprovedExecution() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.APPROVE, 180));
        ActionExecution planned = execution(harness.orchestrator.evaluate(budgetEvent("e1", "250")));
        ActionExecution approved = planned.withApproved("alice", harness.clock.instant());
        harness.executions.update(approved);

        ActionExecution failed = harness.orchestrator.failInterrupted(approved, harness.clock.instant()).orElseThrow();

        assertThat(failed.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(harness.sink.ofType(NotificationType.EXECUTION_FAILED)).singleElement()
            .satisfies(n -> assertThat(n.attributes()).containsEntry("manual_check_required", true));
        assertThat(harness.orchestrator.failInterrupted(approved, harness.clock.instant())).isEmpty();
    }

    @Test
    @DisplayName("An approval request that cannot be sent fails the execution and frees the slot")
    void evaluate_approvalRequestFailureShouldReleaseSlot() {
        InMemoryAuditLogRepository failingAudit = new InMemoryAuditLogRepository() {
            @Override
            public void append(AuditRecord record) {
                if (record.type() == AuditRecordType.APPROVAL_REQUESTED) {
                    throw new IllegalStateException("audit store unavailable");
                }
                super.append(record);
            }
        };
        harness = new GuardrailHarness(failingAudit, policy("p1", ExecutionMode.APPROVE, 180));

        Decision decision = harness.orchestrator.evaluate(budgetEvent("e1", "250"));

        assertThat(decision.outcome()).isEqualTo(DecisionOutcome.FAILED);
        assertThat(decision.targets()).singleElement()
            .satisfies(t -> assertThat(t.outcome()).isEqualTo(TargetOutcome.FAILED));
        ActionExecution failed = execution(decision);
        assertThat(failed.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(failed.lastError()).startsWith("Approval request not sent");
        assertThat(harness.sink.ofType(NotificationType.APPROVAL_REQUEST)).isEmpty();
        assertThat(harness.executions.findActive("p1", ROLE_R1)).isEmpty();

        Decision next = harness.orchestrator.evaluate(budgetEvent("e2", "300"));
        assertThat(next.targets()).singleElement()
            .satisfies(t -> assertThat(t.executionId()).isNotEqualTo(failed.executionId()));
    }

    @Test
    void failInterrupted_shouldFailAutomaticExecutionStillPlanned() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.AUTOMATIC, 60));
        GuardrailPolicy policy = harness.policies.snapshot().find("p1").orElseThrow();
        ActionExecution planned = ActionExecution.planned("e1", "p1", ExecutionMode.AUTOMATIC,
            TargetPrincipal.role(ROLE_R1), policy.actions(), 60, harness.clock.instant(), Duration.ofMinutes(5));
        assertThat(harness.executions.tryInsert(planned)).isTrue();

        harness.clock.advanceMinutes(61);
        assertThat(harness.orchestrator.expire(planned, harness.clock.instant())).isEmpty();
        assertThat(harness.sink.ofType(NotificationType.APPROVAL_EXPIRED)).isEmpty();

        ActionExecution failed = harness.orchestrator.failInterrupted(planned, harness.clock.instant()).orElseThrow();

        assertThat(failed.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(failed.lastError()).isEqualTo("Automatic execution interrupted before completion");
        assertThat(harness.sink.ofType(NotificationType.EXECUTION_FAILED)).singleElement()
            .satisfies(n -> assertThat(n.attributes()).containsEntry("manual_check_required", true));
    }

    // ========== Idempotency ==========

    @Test
    void evaluate_redeliveredEventShouldBeSuppressed() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.APPROVE, 180));
        Decision first = harness.orchestrator.evaluate(budgetEvent("e1", "250"));

        Decision second = harness.orchestrator.evaluate(budgetEvent("e1", "250"));

        assertThat(second.outcome()).isEqualTo(DecisionOutcome.DUPLICATE);
        assertThat(second.targets()).singleElement().satisfies(t -> {
            assertThat(t.outcome()).isEqualTo(TargetOutcome.DUPLICATE);
            assertThat(t.executionId()).isEqualTo(first.targets().get(0).executionId());
            assertThat(t.status()).isEqualTo(ExecutionStatus.PLANNED);
        });
        assertThat(harness.executions.findRecent(10)).hasSize(1);
        assertThat(harness.sink.ofType(NotificationType.APPROVAL_REQUEST)).hasSize(1);
        assertThat(harness.auditLog.findByEvent("e1")).extracting(AuditRecord::type)
            .contains(AuditRecordType.DUPLICATE_SUPPRESSED);
    }

    @Test
    @DisplayName("A different event cannot open a second active execution on the same policy and target")
    void evaluate_shouldHoldOneActiveExecutionPerSlot() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.AUTOMATIC, 60));
        harness.orchestrator.evaluate(budgetEvent("e1", "250"));

        Decision second = harness.orchestrator.evaluate(budgetEvent("e2", "400"));

        assertThat(second.outcome()).isEqualTo(DecisionOutcome.DUPLICATE);
        assertThat(harness.executor.applyCalls()).hasSize(1);
    }

    @Test
    void evaluate_concurrentIdenticalEventsShouldCreateOneExecution() throws Exception {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.APPROVE, 180));
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Decision>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return harness.orchestrator.evaluate(budgetEvent("e1", "250"));
                }));
            }
            start.countDown();

            List<DecisionOutcome> outcomes = new ArrayList<>();
            for (Future<Decision> future : futures) {
                outcomes.add(future.get(10, TimeUnit.SECONDS).outcome());
            }

            assertThat(outcomes).containsOnly(DecisionOutcome.APPROVAL_REQUESTED, DecisionOutcome.DUPLICATE);
            assertThat(outcomes).filteredOn(o -> o == DecisionOutcome.APPROVAL_REQUESTED).hasSize(1);
            assertThat(harness.executions.findRecent(100)).hasSize(1);
            assertThat(harness.sink.ofType(NotificationType.APPROVAL_REQUEST)).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }

    // ========== Automatic ==========

    @Test
    void evaluate_automaticShouldApplyImmediately() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.AUTOMATIC, 60));

        Decision decision = harness.orchestrator.evaluate(budgetEvent("e1", "250"));

        assertThat(decision.outcome()).isEqualTo(DecisionOutcome.EXECUTED);
        ActionExecution executed = execution(decision);
        assertThat(executed.executedBy()).isEqualTo(ActionExecution.EXECUTED_BY_SYSTEM);
        assertThat(executed.ttlExpiresAt()).isEqualTo(harness.clock.instant().plus(Duration.ofMinutes(60)));
        assertThat(executed.diffs()).singleElement().satisfies(d -> {
            assertThat(d.before()).isEmpty();
            assertThat(d.after()).containsExactly("ec2:RunInstances", "ec2:CreateNatGateway");
        });

        Counter executedEvents = harness.registry.find(GuardrailMetrics.EVENTS).tag("outcome", "executed").counter();
        assertThat(executedEvents).isNotNull();
        assertThat(executedEvents.count()).isEqualTo(1.0);
    }

    @Test
    void evaluate_notifyOnlyActionShouldNotCallExecutor() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.AUTOMATIC, 0).toBuilder()
            .actions(List.of(GuardrailAction.notifyOnly()))
            .build());

        Decision decision = harness.orchestrator.evaluate(budgetEvent("e1", "250"));

        assertThat(decision.outcome()).isEqualTo(DecisionOutcome.EXECUTED);
        assertThat(execution(decision).diffs()).isEmpty();
        assertThat(harness.executor.applyCalls()).isEmpty();
        assertThat(harness.sink.ofType(NotificationType.EXECUTION_CONFIRMED)).hasSize(1);
    }

    @Test
    @DisplayName("Executor failure ends in FAILED and a redelivery does not retry")
    void evaluate_automaticFailureShouldNotRetryOnRedelivery() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.AUTOMATIC, 60));
        harness.executor.failApplyOn(ROLE_R1);

        Decision decision = harness.orchestrator.evaluate(budgetEvent("e1", "250"));

        assertThat(decision.outcome()).isEqualTo(DecisionOutcome.FAILED);
        ActionExecution failed = execution(decision);
        assertThat(failed.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(failed.lastError()).contains("AccessDenied");
        assertThat(harness.sink.ofType(NotificationType.EXECUTION_FAILED)).hasSize(1);

        Decision redelivered = harness.orchestrator.evaluate(budgetEvent("e1", "250"));

        assertThat(redelivered.outcome()).isEqualTo(DecisionOutcome.DUPLICATE);
        assertThat(harness.executor.applyCalls()).hasSize(1);
    }

    @Test
    void evaluate_partialApplyShouldBeCompensated() {
        RecordingGuardrailExecutor secondApplyFails = new RecordingGuardrailExecutor() {
            private final AtomicInteger calls = new AtomicInteger();

            @Override
            public StateDiff apply(TargetPrincipal target, GuardrailAction action) {
                if (calls.incrementAndGet() == 2) {
                    throw new IllegalStateException("LimitExceeded: too many inline policies");
                }
                return super.apply(target, action);
            }
        };
        GuardrailPolicy twoActions = policy("p1", ExecutionMode.AUTOMATIC, 60).toBuilder()
            .actions(List.of(
                GuardrailAction.denying("ec2:RunInstances"),
                GuardrailAction.denying("ec2:CreateNatGateway")))
            .build();
        harness = new GuardrailHarness(secondApplyFails, false, Duration.ofSeconds(2), List.of(twoActions));

        Decision decision = harness.orchestrator.evaluate(budgetEvent("e1", "250"));

        assertThat(decision.outcome()).isEqualTo(DecisionOutcome.FAILED);
        assertThat(harness.executor.revertCalls()).hasSize(1);
        assertThat(harness.executor.deniesOn(ROLE_R1)).isEmpty();
        assertThat(execution(decision).lastError()).contains("LimitExceeded").doesNotContain("not reverted");
    }

    @Test
    void evaluate_executorTimeoutShouldFailExecution() {
        harness = new GuardrailHarness(false, Duration.ofMillis(100),
            List.of(policy("p1", ExecutionMode.AUTOMATIC, 60)));
        harness.executor.applyFailures().delayEachCall(Duration.ofMillis(1_000));

        Decision decision = harness.orchestrator.evaluate(budgetEvent("e1", "250"));

        assertThat(decision.outcome()).isEqualTo(DecisionOutcome.FAILED);
        assertThat(execution(decision).lastError()).contains("timed out after 100 ms");
    }

    @Test
    void evaluate_sinkFailuresShouldNotChangeOutcome() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.AUTOMATIC, 60));
        harness.sink.failures().setFailAlways(true);

        Decision decision = harness.orchestrator.evaluate(budgetEvent("e1", "250"));

        assertThat(decision.outcome()).isEqualTo(DecisionOutcome.EXECUTED);
        assertThat(harness.sink.sent()).isEmpty();
        Counter failures = harness.registry.find(GuardrailMetrics.NOTIFICATION_FAILURES)
            .tag("type", "EXECUTION_CONFIRMED").counter();
        assertThat(failures).isNotNull();
        assertThat(failures.count()).isEqualTo(1.0);
    }

    // ========== Rollback ==========

    @Test
    void rollback_shouldRevertOnlyOnceTtlHasExpired() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.AUTOMATIC, 60));
        UUID id = execution(harness.orchestrator.evaluate(budgetEvent("e1", "250"))).executionId();

        harness.clock.advanceMinutes(59);
        ActionExecution executed = harness.executions.findById(id).orElseThrow();
        assertThat(harness.orchestrator.rollback(executed, harness.clock.instant())).isEqualTo(RollbackResult.SKIPPED);

        harness.clock.advanceMinutes(1);
        assertThat(harness.orchestrator.rollback(executed, harness.clock.instant()))
            .isEqualTo(RollbackResult.ROLLED_BACK);

        ActionExecution rolledBack = harness.executions.findById(id).orElseThrow();
        assertThat(rolledBack.status()).isEqualTo(ExecutionStatus.ROLLED_BACK);
        assertThat(rolledBack.rolledBackAt()).isEqualTo(harness.clock.instant());
        assertThat(harness.executor.deniesOn(ROLE_R1)).isEmpty();
        assertThat(harness.sink.ofType(NotificationType.ROLLBACK_CONFIRMED)).hasSize(1);

        // the stale copy loses the version check
        assertThat(harness.orchestrator.rollback(executed, harness.clock.instant())).isEqualTo(RollbackResult.SKIPPED);
        assertThat(harness.executor.revertCalls()).hasSize(1);
    }

    @Test
    void rollbackNow_shouldReleaseExecutionWithoutTtl() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.AUTOMATIC, 0));
        ActionExecution executed = execution(harness.orchestrator.evaluate(budgetEvent("e1", "250")));
        assertThat(executed.ttlExpiresAt()).isNull();

        harness.clock.advanceMinutes(10_000);
        assertThat(harness.orchestrator.rollback(executed, harness.clock.instant())).isEqualTo(RollbackResult.SKIPPED);

        assertThat(harness.orchestrator.rollbackNow(executed.executionId(), "user:ops"))
            .isEqualTo(RollbackResult.ROLLED_BACK);
        assertThat(harness.auditLog.findByExecution(executed.executionId()))
            .filteredOn(r -> r.type() == AuditRecordType.ROLLBACK_COMPLETED)
            .singleElement()
            .satisfies(r -> assertThat(r.actor()).isEqualTo("user:ops"));
    }

    @Test
    @DisplayName("Repeated rollback failures escalate exactly once and keep retrying")
    void rollback_shouldEscalateOnceAfterThreshold() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.AUTOMATIC, 60));
        UUID id = execution(harness.orchestrator.evaluate(budgetEvent("e1", "250"))).executionId();
        harness.clock.advanceMinutes(60);
        harness.executor.revertFailures().setFailAlways(true);

        List<RollbackResult> results = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            ActionExecution current = harness.executions.findById(id).orElseThrow();
            results.add(harness.orchestrator.rollback(current, harness.clock.instant()));
        }

        assertThat(results).containsExactly(
            RollbackResult.RETRY_SCHEDULED, RollbackResult.RETRY_SCHEDULED, RollbackResult.RETRY_SCHEDULED,
            RollbackResult.ESCALATED, RollbackResult.RETRY_SCHEDULED);
        ActionExecution stuck = harness.executions.findById(id).orElseThrow();
        assertThat(stuck.status()).isEqualTo(ExecutionStatus.EXECUTED);
        assertThat(stuck.rollbackFailures()).isEqualTo(5);
        assertThat(harness.sink.ofType(NotificationType.ROLLBACK_ESCALATION)).hasSize(1);

        harness.executor.revertFailures().setFailAlways(false);
        assertThat(harness.orchestrator.rollback(stuck, harness.clock.instant())).isEqualTo(RollbackResult.ROLLED_BACK);
    }

    @Test
    @DisplayName("A rollback renews its claim between reverts so a second sweep cannot revert concurrently")
    void rollback_shouldRenewClaimBetweenReverts() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.AUTOMATIC, 60).toBuilder()
            .actions(List.of(
                GuardrailAction.denying("ec2:RunInstances"),
                GuardrailAction.denying("ec2:CreateNatGateway"),
                GuardrailAction.denying("rds:CreateDBInstance")))
            .build());
        UUID id = execution(harness.orchestrator.evaluate(budgetEvent("e1", "250"))).executionId();
        assertThat(harness.executions.findById(id).orElseThrow().diffs()).hasSize(3);
        harness.clock.advanceMinutes(60);

        // each revert takes 90s of the 2m claim; the second sweep arrives after the first claim ran out
        AtomicInteger reverts = new AtomicInteger();
        List<RollbackResult> concurrent = new ArrayList<>();
        harness.executor.beforeEachRevert(() -> {
            harness.clock.advanceSeconds(90);
            if (reverts.incrementAndGet() == 2) {
                ActionExecution stored = harness.executions.findById(id).orElseThrow();
                concurrent.add(harness.orchestrator.rollback(stored, harness.clock.instant()));
            }
        });

        RollbackResult result = harness.orchestrator.rollback(
            harness.executions.findById(id).orElseThrow(), harness.clock.instant());

        assertThat(result).isEqualTo(RollbackResult.ROLLED_BACK);
        assertThat(concurrent).containsExactly(RollbackResult.SKIPPED);
        assertThat(harness.executor.revertCalls()).hasSize(3);
        assertThat(harness.executions.findById(id).orElseThrow().status()).isEqualTo(ExecutionStatus.ROLLED_BACK);
        assertThat(harness.sink.ofType(NotificationType.ROLLBACK_CONFIRMED)).hasSize(1);
    }

    @Test
    void builder_shouldRejectRollbackClaimNotLongerThanExecutorTimeout() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.AUTOMATIC, 60));
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            OrchestratorSettings shortClaim = new OrchestratorSettings(
                Duration.ofHours(1), "http://localhost:8080", 3, Duration.ofSeconds(2), null);

            assertThatThrownBy(() -> ExecutionOrchestrator.builder()
                    .policies(harness.policies)
                    .executions(harness.executions)
                    .auditLog(harness.auditLog)
                    .executor(harness.executor)
                    .executorCalls(BoundedCalls.forExecutor(Duration.ofSeconds(2), pool))
                    .notifications(NotificationDispatcher.direct(harness.sink, harness.metrics))
                    .tokens(harness.signer)
                    .metrics(harness.metrics)
                    .settings(shortClaim)
                    .clock(harness.clock)
                    .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be longer than the executor timeout");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void rollback_withoutStoredDiffShouldBeAbandoned() {
        harness = new GuardrailHarness(policy("p1", ExecutionMode.AUTOMATIC, 60));
        GuardrailPolicy policy = harness.policies.snapshot().find("p1").orElseThrow();
        Instant now = harness.clock.instant();
        ActionExecution noBasis = ActionExecution.planned("e1", "p1", ExecutionMode.AUTOMATIC,
                TargetPrincipal.role(ROLE_R1), policy.actions(), 60, now, Duration.ofHours(1))
            .withExecuted(ActionExecution.EXECUTED_BY_SYSTEM, List.of(), now);
        assertThat(harness.executions.tryInsert(noBasis)).isTrue();

        harness.clock.advanceMinutes(61);
        RollbackResult result = harness.orchestrator.rollback(noBasis, harness.clock.instant());

        assertThat(result).isEqualTo(RollbackResult.ABANDONED);
        assertThat(result.isFailure()).isTrue();
        assertThat(harness.executions.findById(noBasis.executionId()).orElseThrow().status())
            .isEqualTo(ExecutionStatus.FAILED);
        assertThat(harness.executor.revertCalls()).isEmpty();
        assertThat(harness.sink.ofType(NotificationType.ROLLBACK_ESCALATION)).hasSize(1);
    }
}
