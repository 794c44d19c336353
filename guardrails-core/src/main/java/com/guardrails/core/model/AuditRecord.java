package com.guardrails.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of something that happened to an execution or an event.
 *
 * Primary Key: recordId
 * Index: executionId, eventId
 *
 * Invariants:
 * - records are never deleted or modified
 * - executionId is null only for decisions that created no execution
 */
public record AuditRecord(
    UUID recordId,
    UUID executionId,
    String eventId,
    String policyId,
    AuditRecordType type,
    Instant timestamp,
    JsonNode payload,
    String actor
) {
    /**
     * Actor types for attribution.
     */
    public static final String ACTOR_SYSTEM = "system";
    public static final String ACTOR_SCHEDULER = "scheduler";
    public static final String ACTOR_APPROVER = "approver";

    public static AuditRecord create(
            UUID executionId,
            String eventId,
            String policyId,
            AuditRecordType type,
            Instant timestamp,
            JsonNode payload,
            String actor) {
        return new AuditRecord(
            UUID.randomUUID(),
            executionId,
            eventId,
            policyId,
            type,
            timestamp,
            payload,
            actor
        );
    }

    @JsonIgnore
    public boolean isRollbackRecord() {
        return type.name().startsWith("ROLLBACK_");
    }
}
