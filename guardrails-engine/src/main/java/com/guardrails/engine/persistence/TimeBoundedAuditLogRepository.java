package com.guardrails.engine.persistence;

import com.guardrails.core.model.AuditRecord;
import com.guardrails.core.model.AuditRecordType;
import com.guardrails.core.repository.AuditLogRepository;
import com.guardrails.engine.execution.BoundedCalls;

import java.util.List;
import java.util.UUID;

/**
 * Decorator putting every audit log call under a timeout.
 */
public class TimeBoundedAuditLogRepository implements AuditLogRepository {

    private final AuditLogRepository delegate;
    private final BoundedCalls calls;

    public TimeBoundedAuditLogRepository(AuditLogRepository delegate, BoundedCalls calls) {
        this.delegate = delegate;
        this.calls = calls;
    }

    @Override
    public void append(AuditRecord record) {
        calls.run("append", () -> delegate.append(record));
    }

    @Override
    public List<AuditRecord> findByExecution(UUID executionId) {
        return calls.call("findByExecution", () -> delegate.findByExecution(executionId));
    }

    @Override
    public List<AuditRecord> findByEvent(String eventId) {
        return calls.call("findByEvent", () -> delegate.findByEvent(eventId));
    }

    @Override
    public List<AuditRecord> findByType(AuditRecordType type, int limit) {
        return calls.call("findByType", () -> delegate.findByType(type, limit));
    }
}
