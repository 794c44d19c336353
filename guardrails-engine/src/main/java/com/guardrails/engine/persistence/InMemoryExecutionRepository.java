package com.guardrails.engine.persistence;

import com.guardrails.core.exception.NotFoundException;
import com.guardrails.core.exception.OptimisticLockException;
import com.guardrails.core.model.ActionExecution;
import com.guardrails.core.model.ExecutionStatus;
import com.guardrails.core.repository.ExecutionRepository;
import com.guardrails.core.repository.LedgerCursor;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory implementation of ExecutionRepository.
 * Default ledger of the service and the one the engine tests run against.
 *
 * The (policy, target) slot index holds the id of the single non-terminal execution per pair;
 * inserts claim it with {@code compute}, terminal updates release it.
 */
public class InMemoryExecutionRepository implements ExecutionRepository {

    private final Map<UUID, ActionExecution> executions = new ConcurrentHashMap<>();
    private final Map<String, UUID> byIdempotencyKey = new ConcurrentHashMap<>();
    private final Map<String, UUID> activeBySlot = new ConcurrentHashMap<>();

    @Override
    public boolean tryInsert(ActionExecution execution) {
        boolean[] inserted = {false};
        activeBySlot.compute(execution.slotKey(), (slot, holder) -> {
            if (holder != null) {
                return holder;
            }
            if (byIdempotencyKey.putIfAbsent(execution.idempotencyKey(), execution.executionId()) != null) {
                return null;
            }
            executions.put(execution.executionId(), execution);
            inserted[0] = true;
            return execution.status().isTerminal() ? null : execution.executionId();
        });
        return inserted[0];
    }

    @Override
    public void update(ActionExecution execution) {
        long expected = execution.version() - 1;
        executions.compute(execution.executionId(), (id, stored) -> {
            if (stored == null) {
                throw new NotFoundException("ActionExecution", id.toString());
            }
            if (stored.version() != expected) {
                throw new OptimisticLockException("ActionExecution", id.toString(), expected, stored.version());
            }
            return execution;
        });
        if (execution.status().isTerminal()) {
            activeBySlot.remove(execution.slotKey(), execution.executionId());
        }
    }

    @Override
    public Optional<ActionExecution> findById(UUID executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public Optional<ActionExecution> findByIdempotencyKey(String idempotencyKey) {
        UUID id = byIdempotencyKey.get(idempotencyKey);
        return id == null ? Optional.empty() : findById(id);
    }

    @Override
    public Optional<ActionExecution> findActive(String policyId, String targetArn) {
        UUID id = activeBySlot.get(policyId + "|" + targetArn);
        return id == null
            ? Optional.empty()
            : findById(id).filter(e -> !e.status().isTerminal());
    }

    @Override
    public List<ActionExecution> findDueForRollback(Instant now, LedgerCursor after, int limit) {
        return page(
            executions.values().stream()
                .filter(e -> e.isRollbackDue(now))
                .filter(e -> !e.isRollbackClaimed(now)),
            ActionExecution::ttlExpiresAt, after, limit);
    }

    @Override
    public List<ActionExecution> findOverdueApprovals(Instant now, LedgerCursor after, int limit) {
        return page(
            executions.values().stream().filter(e -> e.isApprovalOverdue(now)),
            ActionExecution::approvalDeadline, after, limit);
    }

    @Override
    public List<ActionExecution> findInterrupted(Instant startedBefore, LedgerCursor after, int limit) {
        return page(
            executions.values().stream()
                .filter(ActionExecution::isInFlight)
                .filter(e -> !e.inFlightSince().isAfter(startedBefore)),
            ActionExecution::inFlightSince, after, limit);
    }

    private static List<ActionExecution> page(
            Stream<ActionExecution> candidates,
            Function<ActionExecution, Instant> position,
            LedgerCursor after,
            int limit) {
        return candidates
            .filter(e -> after == null || after.precedes(position.apply(e), e.executionId()))
            .sorted(Comparator.comparing(position).thenComparing(ActionExecution::executionId))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<ActionExecution> findByEventId(String eventId) {
        return executions.values().stream()
            .filter(e -> e.eventId().equals(eventId))
            .sorted(Comparator.comparing(ActionExecution::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public List<ActionExecution> findByStatus(ExecutionStatus status, int limit) {
        return executions.values().stream()
            .filter(e -> e.status() == status)
            .sorted(Comparator.comparing(ActionExecution::createdAt).reversed())
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<ActionExecution> findRecent(int limit) {
        return executions.values().stream()
            .sorted(Comparator.comparing(ActionExecution::createdAt).reversed())
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public Map<ExecutionStatus, Long> countByStatus() {
        Map<ExecutionStatus, Long> counts = new EnumMap<>(ExecutionStatus.class);
        executions.values().forEach(e -> counts.merge(e.status(), 1L, Long::sum));
        return counts;
    }
}
