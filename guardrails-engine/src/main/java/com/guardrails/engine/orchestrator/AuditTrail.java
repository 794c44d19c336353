package com.guardrails.engine.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guardrails.core.model.ActionExecution;
import com.guardrails.core.model.AuditRecord;
import com.guardrails.core.model.AuditRecordType;
import com.guardrails.core.model.CostEvent;
import com.guardrails.core.repository.AuditLogRepository;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Writes audit records for the orchestrator. Every transition gets one.
 */
class AuditTrail {

    private final AuditLogRepository auditLog;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    AuditTrail(AuditLogRepository auditLog, ObjectMapper objectMapper, Clock clock) {
        this.auditLog = auditLog;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    void execution(ActionExecution execution, AuditRecordType type, String actor, Map<String, Object> payload) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", execution.status().name());
        body.put("version", execution.version());
        body.put("target", execution.target().arn());
        body.putAll(payload);
        append(execution.executionId(), execution.eventId(), execution.policyId(), type, actor, body);
    }

    void decision(String eventId, String policyId, AuditRecordType type, Map<String, Object> payload) {
        append(null, eventId, policyId, type, AuditRecord.ACTOR_SYSTEM, payload);
    }

    /**
     * Durable failure record carrying the whole event, so a rejected or crashed evaluation
     * can be replayed by hand.
     */
    void eventFailed(CostEvent event, String policyId, Exception error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error.getMessage());
        body.put("error_type", error.getClass().getSimpleName());
        body.put("event", event);
        String eventId = event != null ? event.eventId() : null;
        append(null, eventId, policyId, AuditRecordType.EVENT_PROCESSING_FAILED, AuditRecord.ACTOR_SYSTEM, body);
    }

    private void append(UUID executionId, String eventId, String policyId,
                        AuditRecordType type, String actor, Map<String, Object> payload) {
        JsonNode json = objectMapper.valueToTree(payload);
        auditLog.append(AuditRecord.create(executionId, eventId, policyId, type, clock.instant(), json, actor));
    }

    /**
     * Ordered payload map that drops null values.
     */
    static Map<String, Object> fields(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return map;
    }
}
