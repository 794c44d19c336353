package com.guardrails.core.repository;

import com.guardrails.core.model.AuditRecord;
import com.guardrails.core.model.AuditRecordType;

import java.util.List;
import java.util.UUID;

/**
 * Append-only audit log. Records are never modified.
 */
public interface AuditLogRepository {

    /**
     * Append a record to the log.
     */
    void append(AuditRecord record);

    /**
     * All records of an execution in timestamp order.
     */
    List<AuditRecord> findByExecution(UUID executionId);

    /**
     * All records of a cost event in timestamp order.
     */
    List<AuditRecord> findByEvent(String eventId);

    /**
     * Most recent records of a type.
     */
    List<AuditRecord> findByType(AuditRecordType type, int limit);
}
