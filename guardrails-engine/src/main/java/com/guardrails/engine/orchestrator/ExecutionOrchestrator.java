package com.guardrails.engine.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.guardrails.core.exception.EventValidationException;
import com.guardrails.core.exception.ExecutorException;
import com.guardrails.core.exception.NotFoundException;
import com.guardrails.core.exception.OptimisticLockException;
import com.guardrails.core.json.GuardrailJson;
import com.guardrails.core.model.ActionExecution;
import com.guardrails.core.model.ActionPlan;
import com.guardrails.core.model.AuditRecord;
import com.guardrails.core.model.AuditRecordType;
import com.guardrails.core.model.CostEvent;
import com.guardrails.core.model.ExecutionStatus;
import com.guardrails.core.model.GuardrailAction;
import com.guardrails.core.model.GuardrailPolicy;
import com.guardrails.core.model.Notification;
import com.guardrails.core.model.NotificationRoute;
import com.guardrails.core.model.NotificationType;
import com.guardrails.core.model.StateDiff;
import com.guardrails.core.model.TargetPrincipal;
import com.guardrails.core.repository.AuditLogRepository;
import com.guardrails.core.repository.ExecutionRepository;
import com.guardrails.core.spi.GuardrailExecutor;
import com.guardrails.engine.approval.ApprovalToken;
import com.guardrails.engine.approval.ApprovalTokenSigner;
import com.guardrails.engine.execution.BoundedCalls;
import com.guardrails.engine.logging.LoggingContext;
import com.guardrails.engine.matching.PolicyMatcher;
import com.guardrails.engine.metrics.GuardrailMetrics;
import com.guardrails.engine.notification.NotificationDispatcher;
import com.guardrails.engine.plan.ActionPlanBuilder;
import com.guardrails.engine.policy.PolicyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Owns the lifecycle of action executions. The only component that mutates them.
 *
 * The three modes share one state machine and differ only in their first transitions:
 * simulate never persists, approve parks a PLANNED record until the approval callback,
 * automatic drives PLANNED straight to EXECUTED or FAILED. Every write is a
 * compare-and-swap on the record version; losing one means another caller already advanced
 * the record, and the losing operation becomes a no-op.
 */
public class ExecutionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionOrchestrator.class);

    private final PolicyStore policies;
    private final PolicyMatcher matcher;
    private final ActionPlanBuilder planBuilder;
    private final CostEventValidator eventValidator;
    private final ExecutionRepository executions;
    private final AuditTrail audit;
    private final GuardrailExecutor executor;
    private final BoundedCalls executorCalls;
    private final NotificationDispatcher notifications;
    private final ApprovalTokenSigner tokens;
    private final GuardrailMetrics metrics;
    private final OrchestratorSettings settings;
    private final Clock clock;

    private ExecutionOrchestrator(Builder builder) {
        this.policies = Objects.requireNonNull(builder.policies, "policies");
        this.matcher = builder.matcher != null ? builder.matcher : new PolicyMatcher();
        this.planBuilder = builder.planBuilder != null ? builder.planBuilder : new ActionPlanBuilder(false);
        this.eventValidator = new CostEventValidator();
        this.executions = Objects.requireNonNull(builder.executions, "executions");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        ObjectMapper objectMapper = builder.objectMapper != null ? builder.objectMapper : GuardrailJson.newObjectMapper();
        this.audit = new AuditTrail(Objects.requireNonNull(builder.auditLog, "auditLog"), objectMapper, clock);
        this.executor = Objects.requireNonNull(builder.executor, "executor");
        this.executorCalls = Objects.requireNonNull(builder.executorCalls, "executorCalls");
        this.notifications = Objects.requireNonNull(builder.notifications, "notifications");
        this.tokens = Objects.requireNonNull(builder.tokens, "tokens");
        this.metrics = Objects.requireNonNull(builder.metrics, "metrics");
        this.settings = builder.settings != null ? builder.settings : OrchestratorSettings.defaults();
        if (settings.rollbackClaim().compareTo(executorCalls.timeout()) <= 0) {
            throw new IllegalArgumentException("Rollback claim " + settings.rollbackClaim()
                + " must be longer than the executor timeout " + executorCalls.timeout());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Event evaluation ==========

    /**
     * Evaluate one cost event end to end. Never throws for a bad or unlucky event: validation
     * and processing failures come back as {@link DecisionOutcome#INVALID_EVENT} or
     * {@link DecisionOutcome#ERROR} after a failure record is written. Only a failure to write
     * that record propagates.
     */
    public Decision evaluate(CostEvent event) {
        String eventId = event != null ? event.eventId() : null;
        try (LoggingContext ctx = LoggingContext.forEvent(eventId)) {
            String policyId = null;
            try {
                eventValidator.validate(event);
                Instant now = clock.instant();

                Optional<GuardrailPolicy> matched = matcher.match(event, policies.snapshot().policies(), now);
                if (matched.isEmpty()) {
                    log.info("No policy matched cost event from account {} amount {}",
                        event.accountId(), event.amount());
                    metrics.eventEvaluated(outcomeTag(DecisionOutcome.NO_MATCH));
                    return Decision.noMatch(eventId);
                }

                GuardrailPolicy policy = matched.get();
                policyId = policy.policyId();
                LoggingContext.setPolicyId(policyId);

                ActionPlan plan = planBuilder.build(event, policy);
                if (plan.targets().isEmpty()) {
                    log.info("Policy {} matched but every target is allowlisted", policyId);
                    metrics.eventEvaluated(outcomeTag(DecisionOutcome.NO_MATCH));
                    return Decision.noMatch(eventId);
                }

                log.info("Policy {} matched, mode {} with {} target(s)", policyId, plan.mode(), plan.targets().size());
                Decision decision = switch (plan.mode()) {
                    case SIMULATE -> simulate(event, plan);
                    case APPROVE -> requestApproval(event, plan, now);
                    case AUTOMATIC -> executeAutomatically(event, plan, now);
                };
                metrics.eventEvaluated(outcomeTag(decision.outcome()));
                return decision;

            } catch (EventValidationException e) {
                log.warn("Rejected cost event: {}", e.getMessage());
                audit.eventFailed(event, null, e);
                metrics.eventEvaluated(outcomeTag(DecisionOutcome.INVALID_EVENT));
                return Decision.invalid(eventId, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Failed to process cost event {}", eventId, e);
                audit.eventFailed(event, policyId, e);
                metrics.eventEvaluated(outcomeTag(DecisionOutcome.ERROR));
                return Decision.error(eventId, policyId, e.getMessage());
            }
        }
    }

    private Decision simulate(CostEvent event, ActionPlan plan) {
        List<TargetResult> results = new ArrayList<>();
        for (TargetPrincipal target : plan.targets()) {
            audit.decision(event.eventId(), plan.policyId(), AuditRecordType.DECISION_SIMULATED,
                AuditTrail.fields(
                    "target", target.arn(),
                    "actions", plan.actions(),
                    "ttl_minutes", plan.ttlMinutes(),
                    "account_id", event.accountId(),
                    "amount", event.amount()));

            notifications.dispatch(new Notification(
                NotificationType.DRY_RUN,
                routeOr(plan.notification()),
                plan.policyId(),
                event.eventId(),
                null,
                target.arn(),
                AuditTrail.fields(
                    "account_id", event.accountId(),
                    "amount", event.amount(),
                    "source", event.source().wireName(),
                    "actions", plan.actions(),
                    "ttl_minutes", plan.ttlMinutes())));

            log.info("Simulated guardrail on {}", target.arn());
            results.add(TargetResult.simulated(target.arn()));
        }
        return new Decision(event.eventId(), DecisionOutcome.SIMULATED, plan.policyId(), plan.mode(), results,
            "Simulated " + results.size() + " target(s)");
    }

    private Decision requestApproval(CostEvent event, ActionPlan plan, Instant now) {
        List<TargetResult> results = new ArrayList<>();
        for (TargetPrincipal target : plan.targets()) {
            ActionExecution planned = newExecution(event, plan, target, now);
            if (!executions.tryInsert(planned)) {
                results.add(suppressDuplicate(planned));
                continue;
            }
            try (LoggingContext ctx = LoggingContext.forExecution(planned.executionId(), plan.policyId(), target.arn())) {
                try {
                    audit.execution(planned, AuditRecordType.EXECUTION_PLANNED, AuditRecord.ACTOR_SYSTEM,
                        AuditTrail.fields("mode", planned.mode().name(), "amount", event.amount()));
                    metrics.transition(ExecutionStatus.PLANNED, modeTag(planned));

                    ApprovalToken token = tokens.issue(planned.executionId());
                    audit.execution(planned, AuditRecordType.APPROVAL_REQUESTED, AuditRecord.ACTOR_SYSTEM,
                        AuditTrail.fields("expires_at", token.expiresAt()));

                    notifications.dispatch(Notification.forExecution(
                        NotificationType.APPROVAL_REQUEST,
                        routeOr(plan.notification()),
                        planned,
                        AuditTrail.fields(
                            "account_id", event.accountId(),
                            "amount", event.amount(),
                            "actions", plan.actions(),
                            "ttl_minutes", plan.ttlMinutes(),
                            "approve_url", approvalUrl(planned.executionId(), token, "approve"),
                            "reject_url", approvalUrl(planned.executionId(), token, "reject"),
                            "expires_at", token.expiresAt())));

                    log.info("Approval requested for {}, deadline {}", target.arn(), planned.approvalDeadline());
                    results.add(new TargetResult(target.arn(), planned.executionId(), planned.status(),
                        TargetOutcome.APPROVAL_REQUESTED));
                } catch (RuntimeException e) {
                    log.error("Approval request for {} not sent, releasing the slot", target.arn(), e);
                    ActionExecution released = releaseUnstarted(planned, "Approval request not sent: " + e.getMessage());
                    results.add(new TargetResult(target.arn(), released.executionId(), released.status(),
                        TargetOutcome.FAILED));
                }
            }
        }

        DecisionOutcome outcome;
        if (results.stream().anyMatch(r -> r.outcome() == TargetOutcome.APPROVAL_REQUESTED)) {
            outcome = DecisionOutcome.APPROVAL_REQUESTED;
        } else if (results.stream().anyMatch(r -> r.outcome() == TargetOutcome.FAILED)) {
            outcome = DecisionOutcome.FAILED;
        } else {
            outcome = DecisionOutcome.DUPLICATE;
        }
        String message = switch (outcome) {
            case APPROVAL_REQUESTED -> "Approval requested";
            case FAILED -> "Approval request failed";
            default -> "Already handled";
        };
        return new Decision(event.eventId(), outcome, plan.policyId(), plan.mode(), results, message);
    }

    private Decision executeAutomatically(CostEvent event, ActionPlan plan, Instant now) {
        List<TargetResult> results = new ArrayList<>();
        for (TargetPrincipal target : plan.targets()) {
            ActionExecution planned = newExecution(event, plan, target, now);
            if (!executions.tryInsert(planned)) {
                results.add(suppressDuplicate(planned));
                continue;
            }
            try (LoggingContext ctx = LoggingContext.forExecution(planned.executionId(), plan.policyId(), target.arn())) {
                try {
                    audit.execution(planned, AuditRecordType.EXECUTION_PLANNED, AuditRecord.ACTOR_SYSTEM,
                        AuditTrail.fields("mode", planned.mode().name(), "amount", event.amount()));
                    metrics.transition(ExecutionStatus.PLANNED, modeTag(planned));
                } catch (RuntimeException e) {
                    log.error("Could not record planned execution for {}, releasing the slot", target.arn(), e);
                    ActionExecution released = releaseUnstarted(planned, "Execution not started: " + e.getMessage());
                    results.add(new TargetResult(target.arn(), released.executionId(), released.status(),
                        TargetOutcome.FAILED));
                    continue;
                }

                ActionExecution result = applyActions(planned, ActionExecution.EXECUTED_BY_SYSTEM);
                TargetOutcome outcome = result.status() == ExecutionStatus.EXECUTED
                    ? TargetOutcome.EXECUTED
                    : TargetOutcome.FAILED;
                results.add(new TargetResult(target.arn(), result.executionId(), result.status(), outcome));
            }
        }

        DecisionOutcome outcome;
        if (results.stream().allMatch(r -> r.outcome() == TargetOutcome.DUPLICATE)) {
            outcome = DecisionOutcome.DUPLICATE;
        } else if (results.stream().anyMatch(r -> r.outcome() == TargetOutcome.FAILED)) {
            outcome = DecisionOutcome.FAILED;
        } else {
            outcome = DecisionOutcome.EXECUTED;
        }
        return new Decision(event.eventId(), outcome, plan.policyId(), plan.mode(), results, outcome.name());
    }

    /**
     * Move a PLANNED execution that never reached the executor or the approver to FAILED,
     * freeing its (policy, target) slot.
     */
    private ActionExecution releaseUnstarted(ActionExecution planned, String error) {
        ActionExecution failed = planned.withFailed(error, clock.instant());
        if (!compareAndSet(failed)) {
            return executions.findById(planned.executionId()).orElse(planned);
        }
        metrics.transition(ExecutionStatus.FAILED, modeTag(failed));
        try {
            audit.execution(failed, AuditRecordType.EXECUTION_FAILED, AuditRecord.ACTOR_SYSTEM,
                AuditTrail.fields("error", error));
        } catch (RuntimeException e) {
            log.error("Could not audit release of execution {}", planned.executionId(), e);
        }
        return failed;
    }

    private ActionExecution newExecution(CostEvent event, ActionPlan plan, TargetPrincipal target, Instant now) {
        return ActionExecution.planned(
            event.eventId(),
            plan.policyId(),
            plan.mode(),
            target,
            plan.actions(),
            plan.ttlMinutes(),
            now,
            settings.approvalWindow());
    }

    private TargetResult suppressDuplicate(ActionExecution rejected) {
        Optional<ActionExecution> existing = executions.findByIdempotencyKey(rejected.idempotencyKey())
            .or(() -> executions.findActive(rejected.policyId(), rejected.target().arn()));

        UUID existingId = existing.map(ActionExecution::executionId).orElse(null);
        ExecutionStatus existingStatus = existing.map(ActionExecution::status).orElse(null);

        log.info("Duplicate suppressed for {}: existing execution {} in {}",
            rejected.target().arn(), existingId, existingStatus);
        audit.decision(rejected.eventId(), rejected.policyId(), AuditRecordType.DUPLICATE_SUPPRESSED,
            AuditTrail.fields(
                "target", rejected.target().arn(),
                "existing_execution_id", existingId,
                "existing_status", existingStatus));

        return new TargetResult(rejected.target().arn(), existingId, existingStatus, TargetOutcome.DUPLICATE);
    }

    // ========== Approval callbacks ==========

    /**
     * Approve a PLANNED execution and run it.
     *
     * @return the final record (EXECUTED or FAILED), or empty if the execution was no longer
     *         PLANNED or another caller won the race
     * @throws NotFoundException if the execution does not exist
     */
    public Optional<ActionExecution> approve(UUID executionId, String approver) {
        ActionExecution current = load(executionId);
        try (LoggingContext ctx = forExecution(current)) {
            if (current.status() != ExecutionStatus.PLANNED) {
                log.info("Approval ignored, execution already {}", current.status());
                return Optional.empty();
            }
            Instant now = clock.instant();
            if (current.isApprovalOverdue(now)) {
                log.info("Approval arrived after the deadline {}", current.approvalDeadline());
                expire(current, now);
                return Optional.empty();
            }

            ActionExecution approved = current.withApproved(approver, now);
            if (!compareAndSet(approved)) {
                return Optional.empty();
            }
            audit.execution(approved, AuditRecordType.EXECUTION_APPROVED, approver, Map.of());
            metrics.transition(ExecutionStatus.APPROVED, modeTag(approved));
            log.info("Execution approved by {}", approver);

            return Optional.of(applyActions(approved, ActionExecution.USER_PREFIX + approver));
        }
    }

    /**
     * Reject a PLANNED execution. Nothing is applied.
     *
     * @return the REJECTED record, or empty if the execution was no longer PLANNED
     * @throws NotFoundException if the execution does not exist
     */
    public Optional<ActionExecution> reject(UUID executionId, String approver) {
        ActionExecution current = load(executionId);
        try (LoggingContext ctx = forExecution(current)) {
            if (current.status() != ExecutionStatus.PLANNED) {
                log.info("Rejection ignored, execution already {}", current.status());
                return Optional.empty();
            }
            ActionExecution rejected = current.withRejected(approver, clock.instant());
            if (!compareAndSet(rejected)) {
                return Optional.empty();
            }
            audit.execution(rejected, AuditRecordType.EXECUTION_REJECTED, approver, Map.of());
            metrics.transition(ExecutionStatus.REJECTED, modeTag(rejected));
            notifications.dispatch(Notification.forExecution(
                NotificationType.APPROVAL_REJECTED, route(rejected), rejected,
                AuditTrail.fields("rejected_by", approver)));
            log.info("Execution rejected by {}", approver);
            return Optional.of(rejected);
        }
    }

    /**
     * Expire a PLANNED execution whose approval window has elapsed.
     *
     * @return the EXPIRED record, or empty if it was not PLANNED, not yet overdue, or the race was lost
     */
    public Optional<ActionExecution> expire(UUID executionId, Instant now) {
        return executions.findById(executionId).flatMap(current -> expire(current, now));
    }

    public Optional<ActionExecution> expire(ActionExecution current, Instant now) {
        try (LoggingContext ctx = forExecution(current)) {
            if (!current.isApprovalOverdue(now)) {
                return Optional.empty();
            }
            ActionExecution expired = current.withExpired(now);
            if (!compareAndSet(expired)) {
                return Optional.empty();
            }
            audit.execution(expired, AuditRecordType.EXECUTION_EXPIRED, AuditRecord.ACTOR_SCHEDULER,
                AuditTrail.fields("deadline", current.approvalDeadline()));
            metrics.transition(ExecutionStatus.EXPIRED, modeTag(expired));
            notifications.dispatch(Notification.forExecution(
                NotificationType.APPROVAL_EXPIRED, route(expired), expired,
                AuditTrail.fields("deadline", current.approvalDeadline())));
            log.info("Approval window elapsed at {}, execution expired", current.approvalDeadline());
            return Optional.of(expired);
        }
    }

    /**
     * Fail an in-flight execution whose outcome was never recorded: approved but never applied,
     * or automatic and still PLANNED. Whether the executor ran is unknown, so a human is asked
     * to check the target.
     */
    public Optional<ActionExecution> failInterrupted(ActionExecution current, Instant now) {
        try (LoggingContext ctx = forExecution(current)) {
            if (!current.isInFlight()) {
                return Optional.empty();
            }
            String error = current.status() == ExecutionStatus.APPROVED
                ? "Approved execution interrupted before completion"
                : "Automatic execution interrupted before completion";
            ActionExecution failed = current.withFailed(error, now);
            if (!compareAndSet(failed)) {
                return Optional.empty();
            }
            audit.execution(failed, AuditRecordType.EXECUTION_FAILED, AuditRecord.ACTOR_SCHEDULER,
                AuditTrail.fields("error", error, "in_flight_since", current.inFlightSince()));
            metrics.transition(ExecutionStatus.FAILED, modeTag(failed));
            notifications.dispatch(Notification.forExecution(
                NotificationType.EXECUTION_FAILED, route(failed), failed,
                AuditTrail.fields("error", error, "manual_check_required", true)));
            log.warn("{} execution never completed, marked FAILED for manual check", current.status());
            return Optional.of(failed);
        }
    }

    // ========== Apply ==========

    /**
     * Apply every executor-backed action of a PLANNED or APPROVED execution.
     * On any failure the diffs already applied are reverted in reverse order and the execution
     * ends in FAILED; nothing is retried.
     */
    private ActionExecution applyActions(ActionExecution current, String executedBy) {
        TargetPrincipal target = current.target();
        List<StateDiff> applied = new ArrayList<>();

        try {
            for (GuardrailAction action : current.actions()) {
                if (!action.type().touchesExecutor()) {
                    continue;
                }
                StateDiff diff = timedExecutorCall("apply", () -> executor.apply(target, action));
                applied.add(diff);
            }
        } catch (ExecutorException e) {
            log.warn("Executor failed on {}: {}", target.arn(), e.getMessage());
            List<String> leftovers = compensate(current, applied);
            return markFailed(current, failureMessage(e.getMessage(), leftovers), leftovers);
        }

        ActionExecution executed = current.withExecuted(executedBy, applied, clock.instant());
        try {
            executions.update(executed);
        } catch (OptimisticLockException e) {
            log.warn("Execution advanced concurrently while applying, reverting: {}", e.getMessage());
            compensate(current, applied);
            return executions.findById(current.executionId()).orElse(current);
        } catch (RuntimeException e) {
            log.error("Could not record applied guardrail, reverting", e);
            List<String> leftovers = compensate(current, applied);
            return markFailed(current, failureMessage("Ledger write failed: " + e.getMessage(), leftovers), leftovers);
        }

        audit.execution(executed, AuditRecordType.EXECUTION_APPLIED, executedBy,
            AuditTrail.fields("diffs", executed.diffs(), "ttl_expires_at", executed.ttlExpiresAt()));
        metrics.transition(ExecutionStatus.EXECUTED, modeTag(executed));
        notifications.dispatch(Notification.forExecution(
            NotificationType.EXECUTION_CONFIRMED, route(executed), executed,
            AuditTrail.fields(
                "executed_by", executedBy,
                "actions", executed.actions(),
                "ttl_expires_at", executed.ttlExpiresAt())));

        if (executed.ttlExpiresAt() != null) {
            log.info("Guardrail applied on {}, rollback due at {}", target.arn(), executed.ttlExpiresAt());
        } else {
            log.info("Guardrail applied on {} with no automatic rollback", target.arn());
        }
        return executed;
    }

    /**
     * Best-effort revert of diffs applied by a failed attempt.
     *
     * @return descriptions of the diffs that could not be reverted
     */
    private List<String> compensate(ActionExecution execution, List<StateDiff> applied) {
        List<String> leftovers = new ArrayList<>();
        for (int i = applied.size() - 1; i >= 0; i--) {
            StateDiff diff = applied.get(i);
            try {
                boolean reverted = timedExecutorCall("revert", () -> executor.revert(execution.target(), diff));
                if (!reverted) {
                    leftovers.add(describe(diff) + ": revert returned false");
                }
            } catch (ExecutorException e) {
                leftovers.add(describe(diff) + ": " + e.getMessage());
            }
        }
        if (!leftovers.isEmpty()) {
            log.error("Partial apply could not be fully reverted on {}: {}", execution.target().arn(), leftovers);
        }
        return leftovers;
    }

    private ActionExecution markFailed(ActionExecution current, String error, List<String> leftovers) {
        ActionExecution failed = current.withFailed(error, clock.instant());
        if (!compareAndSet(failed)) {
            return executions.findById(current.executionId()).orElse(current);
        }
        audit.execution(failed, AuditRecordType.EXECUTION_FAILED, AuditRecord.ACTOR_SYSTEM,
            AuditTrail.fields("error", error, "unreverted", leftovers.isEmpty() ? null : leftovers));
        metrics.transition(ExecutionStatus.FAILED, modeTag(failed));
        notifications.dispatch(Notification.forExecution(
            NotificationType.EXECUTION_FAILED, route(failed), failed,
            AuditTrail.fields(
                "error", error,
                "manual_check_required", leftovers.isEmpty() ? null : Boolean.TRUE)));
        return failed;
    }

    // ========== Rollback ==========

    /**
     * Roll back an EXECUTED execution whose ttl has expired. Called by the rollback sweep.
     */
    public RollbackResult rollback(ActionExecution execution, Instant now) {
        if (!execution.isRollbackDue(now)) {
            return RollbackResult.SKIPPED;
        }
        return revertExecution(execution, now, AuditRecord.ACTOR_SCHEDULER);
    }

    /**
     * Roll back an EXECUTED execution on request, regardless of its ttl.
     * Executions created with ttl 0 are released this way.
     *
     * @throws NotFoundException if the execution does not exist
     */
    public RollbackResult rollbackNow(UUID executionId, String actor) {
        ActionExecution current = load(executionId);
        if (current.status() != ExecutionStatus.EXECUTED) {
            return RollbackResult.SKIPPED;
        }
        return revertExecution(current, clock.instant(), actor);
    }

    private RollbackResult revertExecution(ActionExecution execution, Instant now, String actor) {
        try (LoggingContext ctx = forExecution(execution)) {
            if (execution.isRollbackClaimed(now)) {
                log.debug("Rollback already claimed until {}", execution.rollbackClaimedUntil());
                return RollbackResult.SKIPPED;
            }
            ActionExecution claimed = execution.withRollbackClaim(now.plus(settings.rollbackClaim()));
            if (!compareAndSet(claimed)) {
                return RollbackResult.SKIPPED;
            }

            if (claimed.requiresRollbackBasis() && claimed.diffs().isEmpty()) {
                return abandon(claimed, now, actor);
            }

            TargetPrincipal target = claimed.target();
            List<String> failures = new ArrayList<>();
            List<StateDiff> diffs = claimed.diffs();
            for (int i = diffs.size() - 1; i >= 0; i--) {
                // The claim must outlive the next executor call, which is bounded by the executor timeout.
                if (i < diffs.size() - 1) {
                    ActionExecution renewed = claimed.withRollbackClaim(clock.instant().plus(settings.rollbackClaim()));
                    if (!compareAndSet(renewed)) {
                        log.error("Lost rollback claim after reverting {} of {} diff(s)", diffs.size() - 1 - i, diffs.size());
                        return RollbackResult.SKIPPED;
                    }
                    claimed = renewed;
                }
                StateDiff diff = diffs.get(i);
                try {
                    boolean reverted = timedExecutorCall("revert", () -> executor.revert(target, diff));
                    if (!reverted) {
                        failures.add(describe(diff) + ": revert returned false");
                    }
                } catch (ExecutorException e) {
                    failures.add(describe(diff) + ": " + e.getMessage());
                }
            }

            if (failures.isEmpty()) {
                ActionExecution rolledBack = claimed.withRolledBack(clock.instant());
                if (!compareAndSet(rolledBack)) {
                    return RollbackResult.SKIPPED;
                }
                audit.execution(rolledBack, AuditRecordType.ROLLBACK_COMPLETED, actor,
                    AuditTrail.fields("reverted", diffs.size()));
                metrics.transition(ExecutionStatus.ROLLED_BACK, modeTag(rolledBack));
                metrics.rollback("rolled_back");
                notifications.dispatch(Notification.forExecution(
                    NotificationType.ROLLBACK_CONFIRMED, route(rolledBack), rolledBack,
                    AuditTrail.fields("rolled_back_by", actor)));
                log.info("Guardrail rolled back on {}", rolledBack.target().arn());
                return RollbackResult.ROLLED_BACK;
            }

            return recordRollbackFailure(claimed, String.join("; ", failures), actor);
        }
    }

    private RollbackResult recordRollbackFailure(ActionExecution claimed, String error, String actor) {
        ActionExecution retry = claimed.withRollbackFailure(error);
        if (!compareAndSet(retry)) {
            return RollbackResult.SKIPPED;
        }
        audit.execution(retry, AuditRecordType.ROLLBACK_FAILED, actor,
            AuditTrail.fields("error", error, "consecutive_failures", retry.rollbackFailures()));
        metrics.rollback("failed");
        log.warn("Rollback failed ({} consecutive): {}", retry.rollbackFailures(), error);

        // Escalate exactly once: on the first failure past the threshold.
        if (retry.rollbackFailures() == settings.escalationThreshold() + 1) {
            escalate(retry, error, actor);
            return RollbackResult.ESCALATED;
        }
        return RollbackResult.RETRY_SCHEDULED;
    }

    private RollbackResult abandon(ActionExecution claimed, Instant now, String actor) {
        String error = "No stored diff to roll back from";
        ActionExecution failed = claimed.withFailed(error, now);
        if (!compareAndSet(failed)) {
            return RollbackResult.SKIPPED;
        }
        audit.execution(failed, AuditRecordType.EXECUTION_FAILED, actor, AuditTrail.fields("error", error));
        metrics.transition(ExecutionStatus.FAILED, modeTag(failed));
        metrics.rollback("abandoned");
        escalate(failed, error, actor);
        log.error("Execution has no rollback basis, moved to FAILED");
        return RollbackResult.ABANDONED;
    }

    private void escalate(ActionExecution execution, String error, String actor) {
        audit.execution(execution, AuditRecordType.ROLLBACK_ESCALATED, actor,
            AuditTrail.fields("error", error, "consecutive_failures", execution.rollbackFailures()));
        metrics.rollbackEscalated();
        notifications.dispatch(Notification.forExecution(
            NotificationType.ROLLBACK_ESCALATION, route(execution), execution,
            AuditTrail.fields(
                "error", error,
                "consecutive_failures", execution.rollbackFailures(),
                "diffs", execution.diffs())));
        log.error("Rollback escalated after {} consecutive failure(s)", execution.rollbackFailures());
    }

    // ========== Helpers ==========

    private ActionExecution load(UUID executionId) {
        return executions.findById(executionId)
            .orElseThrow(() -> new NotFoundException("ActionExecution", executionId.toString()));
    }

    private boolean compareAndSet(ActionExecution next) {
        try {
            executions.update(next);
            return true;
        } catch (OptimisticLockException e) {
            log.info("Lost update race on execution {}, treating as no-op: {}", next.executionId(), e.getMessage());
            return false;
        }
    }

    private <T> T timedExecutorCall(String operation, Supplier<T> call) {
        long started = System.nanoTime();
        boolean success = false;
        try {
            T result = executorCalls.call(operation, call::get);
            success = true;
            return result;
        } finally {
            metrics.executorCall(operation, Duration.ofNanos(System.nanoTime() - started), success);
        }
    }

    private NotificationRoute route(ActionExecution execution) {
        return policies.snapshot().find(execution.policyId())
            .map(GuardrailPolicy::notification)
            .map(this::routeOr)
            .orElse(settings.fallbackRoute());
    }

    private NotificationRoute routeOr(NotificationRoute route) {
        return route != null ? route : settings.fallbackRoute();
    }

    private String approvalUrl(UUID executionId, ApprovalToken token, String decision) {
        return settings.approvalBaseUrl() + "/api/v1/approvals/" + executionId
            + "?token=" + URLEncoder.encode(token.value(), StandardCharsets.UTF_8)
            + "&decision=" + decision;
    }

    private static LoggingContext forExecution(ActionExecution execution) {
        return LoggingContext.forExecution(execution.executionId(), execution.policyId(), execution.target().arn());
    }

    private static String describe(StateDiff diff) {
        return diff.actionType().wireName() + " on " + diff.principalArn();
    }

    private static String failureMessage(String error, List<String> leftovers) {
        return leftovers.isEmpty() ? error : error + "; not reverted: " + String.join(", ", leftovers);
    }

    private static String outcomeTag(DecisionOutcome outcome) {
        return outcome.name().toLowerCase(Locale.ROOT);
    }

    private static String modeTag(ActionExecution execution) {
        return execution.mode().wireName();
    }

    public OrchestratorSettings settings() {
        return settings;
    }

    /**
     * Builder for the orchestrator and its collaborators.
     */
    public static class Builder {
        private PolicyStore policies;
        private PolicyMatcher matcher;
        private ActionPlanBuilder planBuilder;
        private ExecutionRepository executions;
        private AuditLogRepository auditLog;
        private GuardrailExecutor executor;
        private BoundedCalls executorCalls;
        private NotificationDispatcher notifications;
        private ApprovalTokenSigner tokens;
        private GuardrailMetrics metrics;
        private OrchestratorSettings settings;
        private ObjectMapper objectMapper;
        private Clock clock;

        public Builder policies(PolicyStore policies) {
            this.policies = policies;
            return this;
        }

        public Builder matcher(PolicyMatcher matcher) {
            this.matcher = matcher;
            return this;
        }

        public Builder planBuilder(ActionPlanBuilder planBuilder) {
            this.planBuilder = planBuilder;
            return this;
        }

        public Builder executions(ExecutionRepository executions) {
            this.executions = executions;
            return this;
        }

        public Builder auditLog(AuditLogRepository auditLog) {
            this.auditLog = auditLog;
            return this;
        }

        public Builder executor(GuardrailExecutor executor) {
            this.executor = executor;
            return this;
        }

        public Builder executorCalls(BoundedCalls executorCalls) {
            this.executorCalls = executorCalls;
            return this;
        }

        public Builder notifications(NotificationDispatcher notifications) {
            this.notifications = notifications;
            return this;
        }

        public Builder tokens(ApprovalTokenSigner tokens) {
            this.tokens = tokens;
            return this;
        }

        public Builder metrics(GuardrailMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder settings(OrchestratorSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ExecutionOrchestrator build() {
            return new ExecutionOrchestrator(this);
        }
    }
}
