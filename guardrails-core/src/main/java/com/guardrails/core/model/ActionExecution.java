package com.guardrails.core.model;

import com.guardrails.core.exception.InvalidStatusTransitionException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Durable record of one guardrail application on one target and its lifecycle.
 *
 * Primary Key: executionId
 * Unique Constraint: idempotencyKey
 * Unique Constraint: (policyId, target.arn) while status is non-terminal
 *
 * Invariants:
 * - every copy produced by a {@code with*} method carries version + 1
 * - diffs are set exactly once, by the EXECUTED transition
 * - no transition leaves a terminal status
 */
public record ActionExecution(
    // Primary key
    UUID executionId,

    // Origin
    String policyId,
    String eventId,
    String idempotencyKey,
    ExecutionMode mode,

    // State
    ExecutionStatus status,
    String executedBy,

    // What and where
    List<GuardrailAction> actions,
    TargetPrincipal target,
    List<StateDiff> diffs,
    int ttlMinutes,

    // Timing
    Instant createdAt,
    Instant approvalDeadline,
    Instant executedAt,
    Instant ttlExpiresAt,
    Instant resolvedAt,
    String resolvedBy,
    Instant rolledBackAt,

    // Failure tracking
    String lastError,
    int rollbackFailures,
    Instant rollbackClaimedUntil,

    // Optimistic concurrency
    long version
) {
    public static final String EXECUTED_BY_SYSTEM = "system:auto";
    public static final String USER_PREFIX = "user:";

    public ActionExecution {
        actions = actions == null ? List.of() : List.copyOf(actions);
        diffs = diffs == null ? List.of() : List.copyOf(diffs);
    }

    /**
     * Create a new execution in PLANNED status.
     */
    public static ActionExecution planned(
            String eventId,
            String policyId,
            ExecutionMode mode,
            TargetPrincipal target,
            List<GuardrailAction> actions,
            int ttlMinutes,
            Instant createdAt,
            Duration approvalWindow) {

        return new ActionExecution(
            UUID.randomUUID(),
            policyId,
            eventId,
            idempotencyKey(eventId, policyId, target),
            mode,
            ExecutionStatus.PLANNED,
            null,
            actions,
            target,
            List.of(),
            ttlMinutes,
            createdAt,
            createdAt.plus(approvalWindow),
            null,
            null,
            null,
            null,
            null,
            null,
            0,
            null,
            0L
        );
    }

    /**
     * Per-event idempotency key: one execution per (event, policy, target), ever.
     */
    public static String idempotencyKey(String eventId, String policyId, TargetPrincipal target) {
        return eventId + ":" + policyId + ":" + target.arn();
    }

    /**
     * Key of the (policy, target) slot that at most one active execution may hold.
     */
    public String slotKey() {
        return policyId + "|" + target.arn();
    }

    /**
     * Only APPROVE-mode records wait for a decision; an automatic record in PLANNED is mid-apply.
     */
    public boolean isApprovalOverdue(Instant now) {
        return status == ExecutionStatus.PLANNED
            && mode == ExecutionMode.APPROVE
            && approvalDeadline != null
            && !now.isBefore(approvalDeadline);
    }

    /**
     * Whether the executor may have been called without the outcome being recorded:
     * an approved execution, or an automatic one still in PLANNED.
     */
    public boolean isInFlight() {
        return status == ExecutionStatus.APPROVED
            || (status == ExecutionStatus.PLANNED && mode == ExecutionMode.AUTOMATIC);
    }

    /**
     * When the in-flight executor work started: the approval, or creation for automatic records.
     */
    public Instant inFlightSince() {
        return resolvedAt != null ? resolvedAt : createdAt;
    }

    public boolean isRollbackDue(Instant now) {
        return status == ExecutionStatus.EXECUTED && ttlExpiresAt != null && !now.isBefore(ttlExpiresAt);
    }

    public boolean isRollbackClaimed(Instant now) {
        return rollbackClaimedUntil != null && rollbackClaimedUntil.isAfter(now);
    }

    /**
     * Whether any planned action changed the target, i.e. whether a rollback needs a stored diff.
     */
    public boolean requiresRollbackBasis() {
        return actions.stream().anyMatch(a -> a.type().touchesExecutor());
    }

    // ========== Transitions ==========

    public ActionExecution withApproved(String approver, Instant at) {
        return transition(ExecutionStatus.APPROVED)
            .resolvedAt(at)
            .resolvedBy(approver)
            .build();
    }

    public ActionExecution withRejected(String approver, Instant at) {
        return transition(ExecutionStatus.REJECTED)
            .resolvedAt(at)
            .resolvedBy(approver)
            .build();
    }

    public ActionExecution withExpired(Instant at) {
        return transition(ExecutionStatus.EXPIRED)
            .resolvedAt(at)
            .build();
    }

    /**
     * Record the applied state. The diff list is captured here once and never replaced.
     */
    public ActionExecution withExecuted(String by, List<StateDiff> appliedDiffs, Instant at) {
        if (!diffs.isEmpty()) {
            throw new IllegalStateException("Diff already captured for execution " + executionId);
        }
        Instant expiry = ttlMinutes > 0 ? at.plus(Duration.ofMinutes(ttlMinutes)) : null;
        return transition(ExecutionStatus.EXECUTED)
            .executedBy(by)
            .diffs(appliedDiffs)
            .executedAt(at)
            .ttlExpiresAt(expiry)
            .build();
    }

    public ActionExecution withFailed(String error, Instant at) {
        Builder builder = transition(ExecutionStatus.FAILED)
            .lastError(error)
            .rollbackClaimedUntil(null);
        if (resolvedAt == null) {
            builder.resolvedAt(at);
        }
        return builder.build();
    }

    public ActionExecution withRollbackClaim(Instant claimedUntil) {
        return toBuilder()
            .rollbackClaimedUntil(claimedUntil)
            .incrementVersion()
            .build();
    }

    public ActionExecution withRollbackFailure(String error) {
        return toBuilder()
            .rollbackFailures(rollbackFailures + 1)
            .lastError(error)
            .rollbackClaimedUntil(null)
            .incrementVersion()
            .build();
    }

    public ActionExecution withRolledBack(Instant at) {
        return transition(ExecutionStatus.ROLLED_BACK)
            .rolledBackAt(at)
            .rollbackClaimedUntil(null)
            .build();
    }

    private Builder transition(ExecutionStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new InvalidStatusTransitionException(executionId, status, next);
        }
        return toBuilder().status(next).incrementVersion();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Builder for creating modified copies.
     */
    public static class Builder {
        private final UUID executionId;
        private final String policyId;
        private final String eventId;
        private final String idempotencyKey;
        private final ExecutionMode mode;
        private ExecutionStatus status;
        private String executedBy;
        private final List<GuardrailAction> actions;
        private final TargetPrincipal target;
        private List<StateDiff> diffs;
        private final int ttlMinutes;
        private final Instant createdAt;
        private final Instant approvalDeadline;
        private Instant executedAt;
        private Instant ttlExpiresAt;
        private Instant resolvedAt;
        private String resolvedBy;
        private Instant rolledBackAt;
        private String lastError;
        private int rollbackFailures;
        private Instant rollbackClaimedUntil;
        private long version;

        public Builder(ActionExecution execution) {
            this.executionId = execution.executionId;
            this.policyId = execution.policyId;
            this.eventId = execution.eventId;
            this.idempotencyKey = execution.idempotencyKey;
            this.mode = execution.mode;
            this.status = execution.status;
            this.executedBy = execution.executedBy;
            this.actions = execution.actions;
            this.target = execution.target;
            this.diffs = execution.diffs;
            this.ttlMinutes = execution.ttlMinutes;
            this.createdAt = execution.createdAt;
            this.approvalDeadline = execution.approvalDeadline;
            this.executedAt = execution.executedAt;
            this.ttlExpiresAt = execution.ttlExpiresAt;
            this.resolvedAt = execution.resolvedAt;
            this.resolvedBy = execution.resolvedBy;
            this.rolledBackAt = execution.rolledBackAt;
            this.lastError = execution.lastError;
            this.rollbackFailures = execution.rollbackFailures;
            this.rollbackClaimedUntil = execution.rollbackClaimedUntil;
            this.version = execution.version;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder executedBy(String executedBy) {
            this.executedBy = executedBy;
            return this;
        }

        public Builder diffs(List<StateDiff> diffs) {
            this.diffs = diffs;
            return this;
        }

        public Builder executedAt(Instant executedAt) {
            this.executedAt = executedAt;
            return this;
        }

        public Builder ttlExpiresAt(Instant ttlExpiresAt) {
            this.ttlExpiresAt = ttlExpiresAt;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        public Builder resolvedBy(String resolvedBy) {
            this.resolvedBy = resolvedBy;
            return this;
        }

        public Builder rolledBackAt(Instant rolledBackAt) {
            this.rolledBackAt = rolledBackAt;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder rollbackFailures(int rollbackFailures) {
            this.rollbackFailures = rollbackFailures;
            return this;
        }

        public Builder rollbackClaimedUntil(Instant rollbackClaimedUntil) {
            this.rollbackClaimedUntil = rollbackClaimedUntil;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder incrementVersion() {
            this.version++;
            return this;
        }

        public ActionExecution build() {
            return new ActionExecution(
                executionId, policyId, eventId, idempotencyKey, mode,
                status, executedBy, actions, target, diffs, ttlMinutes,
                createdAt, approvalDeadline, executedAt, ttlExpiresAt,
                resolvedAt, resolvedBy, rolledBackAt,
                lastError, rollbackFailures, rollbackClaimedUntil,
                version
            );
        }
    }
}
