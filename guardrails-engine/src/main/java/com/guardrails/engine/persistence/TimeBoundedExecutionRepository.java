package com.guardrails.engine.persistence;

import com.guardrails.core.model.ActionExecution;
import com.guardrails.core.model.ExecutionStatus;
import com.guardrails.core.repository.ExecutionRepository;
import com.guardrails.core.repository.LedgerCursor;
import com.guardrails.engine.execution.BoundedCalls;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Decorator putting every ledger call under a timeout.
 * A hung ledger surfaces as {@link com.guardrails.core.exception.LedgerException};
 * lock conflicts and not-found signals pass through unchanged.
 */
public class TimeBoundedExecutionRepository implements ExecutionRepository {

    private final ExecutionRepository delegate;
    private final BoundedCalls calls;

    public TimeBoundedExecutionRepository(ExecutionRepository delegate, BoundedCalls calls) {
        this.delegate = delegate;
        this.calls = calls;
    }

    @Override
    public boolean tryInsert(ActionExecution execution) {
        return calls.call("tryInsert", () -> delegate.tryInsert(execution));
    }

    @Override
    public void update(ActionExecution execution) {
        calls.run("update", () -> delegate.update(execution));
    }

    @Override
    public Optional<ActionExecution> findById(UUID executionId) {
        return calls.call("findById", () -> delegate.findById(executionId));
    }

    @Override
    public Optional<ActionExecution> findByIdempotencyKey(String idempotencyKey) {
        return calls.call("findByIdempotencyKey", () -> delegate.findByIdempotencyKey(idempotencyKey));
    }

    @Override
    public Optional<ActionExecution> findActive(String policyId, String targetArn) {
        return calls.call("findActive", () -> delegate.findActive(policyId, targetArn));
    }

    @Override
    public List<ActionExecution> findDueForRollback(Instant now, LedgerCursor after, int limit) {
        return calls.call("findDueForRollback", () -> delegate.findDueForRollback(now, after, limit));
    }

    @Override
    public List<ActionExecution> findOverdueApprovals(Instant now, LedgerCursor after, int limit) {
        return calls.call("findOverdueApprovals", () -> delegate.findOverdueApprovals(now, after, limit));
    }

    @Override
    public List<ActionExecution> findInterrupted(Instant startedBefore, LedgerCursor after, int limit) {
        return calls.call("findInterrupted", () -> delegate.findInterrupted(startedBefore, after, limit));
    }

    @Override
    public List<ActionExecution> findByEventId(String eventId) {
        return calls.call("findByEventId", () -> delegate.findByEventId(eventId));
    }

    @Override
    public List<ActionExecution> findByStatus(ExecutionStatus status, int limit) {
        return calls.call("findByStatus", () -> delegate.findByStatus(status, limit));
    }

    @Override
    public List<ActionExecution> findRecent(int limit) {
        return calls.call("findRecent", () -> delegate.findRecent(limit));
    }

    @Override
    public Map<ExecutionStatus, Long> countByStatus() {
        return calls.call("countByStatus", delegate::countByStatus);
    }
}
