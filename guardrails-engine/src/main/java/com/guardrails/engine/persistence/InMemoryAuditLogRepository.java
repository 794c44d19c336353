package com.guardrails.engine.persistence;

import com.guardrails.core.model.AuditRecord;
import com.guardrails.core.model.AuditRecordType;
import com.guardrails.core.repository.AuditLogRepository;

import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of AuditLogRepository.
 * Append-only; insertion order breaks timestamp ties.
 */
public class InMemoryAuditLogRepository implements AuditLogRepository {

    private final List<AuditRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void append(AuditRecord record) {
        records.add(record);
    }

    @Override
    public List<AuditRecord> findByExecution(UUID executionId) {
        return records.stream()
            .filter(r -> executionId.equals(r.executionId()))
            .sorted(Comparator.comparing(AuditRecord::timestamp))
            .collect(Collectors.toList());
    }

    @Override
    public List<AuditRecord> findByEvent(String eventId) {
        return records.stream()
            .filter(r -> eventId.equals(r.eventId()))
            .sorted(Comparator.comparing(AuditRecord::timestamp))
            .collect(Collectors.toList());
    }

    @Override
    public List<AuditRecord> findByType(AuditRecordType type, int limit) {
        return records.stream()
            .filter(r -> r.type() == type)
            .sorted(Comparator.comparing(AuditRecord::timestamp).reversed())
            .limit(limit)
            .collect(Collectors.toList());
    }

    public int size() {
        return records.size();
    }
}
