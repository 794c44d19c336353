package com.guardrails.core.repository;

import com.guardrails.core.model.ActionExecution;
import com.guardrails.core.model.ExecutionStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The audit ledger for action executions.
 * All writes are conditional; there is no unconditional overwrite.
 */
public interface ExecutionRepository {

    /**
     * Insert a new execution unless it would violate an idempotency rule.
     *
     * @param execution The new execution (version 0)
     * @return false if a non-terminal execution already holds the same (policy, target) pair,
     *         or the idempotency key was seen before
     */
    boolean tryInsert(ActionExecution execution);

    /**
     * Compare-and-swap update keyed on the version.
     * The stored version must equal {@code execution.version() - 1}.
     *
     * @param execution The new state of the execution
     * @throws com.guardrails.core.exception.OptimisticLockException if the stored version differs
     * @throws com.guardrails.core.exception.NotFoundException if the execution does not exist
     */
    void update(ActionExecution execution);

    /**
     * Find an execution by ID.
     */
    Optional<ActionExecution> findById(UUID executionId);

    /**
     * Find an execution by idempotency key.
     */
    Optional<ActionExecution> findByIdempotencyKey(String idempotencyKey);

    /**
     * Find the non-terminal execution holding a (policy, target) pair, if any.
     */
    Optional<ActionExecution> findActive(String policyId, String targetArn);

    /**
     * Find EXECUTED executions whose ttl expiry is at or before {@code now}
     * and that are not claimed by a rollback in progress.
     *
     * @param now Current time
     * @param after Page start, exclusive; null for the first page
     * @param limit Maximum number of results
     * @return Due executions ordered by (ttl expiry, execution id)
     */
    List<ActionExecution> findDueForRollback(Instant now, LedgerCursor after, int limit);

    /**
     * Find APPROVE-mode PLANNED executions whose approval deadline is at or before {@code now},
     * ordered by (approval deadline, execution id).
     */
    List<ActionExecution> findOverdueApprovals(Instant now, LedgerCursor after, int limit);

    /**
     * Find in-flight executions (APPROVED, or AUTOMATIC still PLANNED) whose executor work
     * started at or before {@code startedBefore}, ordered by ({@link ActionExecution#inFlightSince()},
     * execution id). Such an execution was interrupted mid-call.
     */
    List<ActionExecution> findInterrupted(Instant startedBefore, LedgerCursor after, int limit);

    /**
     * Find executions originating from a cost event.
     */
    List<ActionExecution> findByEventId(String eventId);

    /**
     * Find executions by status, most recent first.
     */
    List<ActionExecution> findByStatus(ExecutionStatus status, int limit);

    /**
     * Find most recent executions regardless of status.
     */
    List<ActionExecution> findRecent(int limit);

    /**
     * Count executions per status.
     */
    Map<ExecutionStatus, Long> countByStatus();
}
