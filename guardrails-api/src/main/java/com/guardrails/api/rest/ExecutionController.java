package com.guardrails.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.guardrails.core.exception.NotFoundException;
import com.guardrails.core.model.ActionExecution;
import com.guardrails.core.model.AuditRecord;
import com.guardrails.core.model.AuditRecordType;
import com.guardrails.core.model.ExecutionMode;
import com.guardrails.core.model.ExecutionStatus;
import com.guardrails.core.model.GuardrailAction;
import com.guardrails.core.model.StateDiff;
import com.guardrails.core.model.TargetPrincipal;
import com.guardrails.core.repository.AuditLogRepository;
import com.guardrails.core.repository.ExecutionRepository;
import com.guardrails.engine.orchestrator.ExecutionOrchestrator;
import com.guardrails.engine.orchestrator.RollbackResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read access to the execution ledger and its audit trail, plus manual rollback.
 */
@RestController
@RequestMapping("/api/v1/executions")
public class ExecutionController {

    private static final int MAX_LIMIT = 500;

    private final ExecutionRepository executions;
    private final AuditLogRepository auditLog;
    private final ExecutionOrchestrator orchestrator;

    public ExecutionController(
            ExecutionRepository executions,
            AuditLogRepository auditLog,
            ExecutionOrchestrator orchestrator) {
        this.executions = executions;
        this.auditLog = auditLog;
        this.orchestrator = orchestrator;
    }

    @GetMapping("/{executionId}")
    public ResponseEntity<ExecutionResponse> getExecution(@PathVariable UUID executionId) {
        return ResponseEntity.ok(ExecutionResponse.from(load(executionId)));
    }

    /**
     * Most recent executions, optionally restricted to one status.
     */
    @GetMapping
    public ResponseEntity<List<ExecutionResponse>> listExecutions(
            @RequestParam(required = false) ExecutionStatus status,
            @RequestParam(required = false) String eventId,
            @RequestParam(defaultValue = "100") int limit) {

        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        List<ActionExecution> found;
        if (eventId != null) {
            found = executions.findByEventId(eventId);
        } else if (status != null) {
            found = executions.findByStatus(status, bounded);
        } else {
            found = executions.findRecent(bounded);
        }

        return ResponseEntity.ok(found.stream()
            .map(ExecutionResponse::from)
            .toList());
    }

    @GetMapping("/{executionId}/audit")
    public ResponseEntity<List<AuditRecordResponse>> getAuditTrail(@PathVariable UUID executionId) {
        load(executionId);
        return ResponseEntity.ok(auditLog.findByExecution(executionId).stream()
            .map(AuditRecordResponse::from)
            .toList());
    }

    /**
     * Revert an EXECUTED guardrail now instead of waiting for its ttl.
     * Executions created with ttl 0 are only released this way.
     */
    @PostMapping("/{executionId}/rollback")
    public ResponseEntity<RollbackResponse> rollback(
            @PathVariable UUID executionId,
            @RequestParam(defaultValue = "unknown") String user) {

        RollbackResult result = orchestrator.rollbackNow(executionId, ActionExecution.USER_PREFIX + user.trim());
        ActionExecution current = load(executionId);
        RollbackResponse body = new RollbackResponse(executionId, result, current.status(), current.rollbackFailures());
        return result == RollbackResult.SKIPPED
            ? ResponseEntity.status(409).body(body)
            : ResponseEntity.ok(body);
    }

    private ActionExecution load(UUID executionId) {
        return executions.findById(executionId)
            .orElseThrow(() -> new NotFoundException("ActionExecution", executionId.toString()));
    }

    // ========== DTOs ==========

    public record ExecutionResponse(
        UUID executionId,
        String policyId,
        String eventId,
        ExecutionMode mode,
        ExecutionStatus status,
        TargetPrincipal target,
        List<GuardrailAction> actions,
        List<StateDiff> diffs,
        String executedBy,
        int ttlMinutes,
        Instant createdAt,
        Instant approvalDeadline,
        Instant executedAt,
        Instant ttlExpiresAt,
        Instant resolvedAt,
        String resolvedBy,
        Instant rolledBackAt,
        String lastError,
        int rollbackFailures,
        long version
    ) {
        public static ExecutionResponse from(ActionExecution execution) {
            return new ExecutionResponse(
                execution.executionId(),
                execution.policyId(),
                execution.eventId(),
                execution.mode(),
                execution.status(),
                execution.target(),
                execution.actions(),
                execution.diffs(),
                execution.executedBy(),
                execution.ttlMinutes(),
                execution.createdAt(),
                execution.approvalDeadline(),
                execution.executedAt(),
                execution.ttlExpiresAt(),
                execution.resolvedAt(),
                execution.resolvedBy(),
                execution.rolledBackAt(),
                execution.lastError(),
                execution.rollbackFailures(),
                execution.version()
            );
        }
    }

    public record AuditRecordResponse(
        UUID recordId,
        AuditRecordType type,
        Instant timestamp,
        String actor,
        JsonNode payload
    ) {
        public static AuditRecordResponse from(AuditRecord record) {
            return new AuditRecordResponse(
                record.recordId(),
                record.type(),
                record.timestamp(),
                record.actor(),
                record.payload()
            );
        }
    }

    public record RollbackResponse(
        UUID executionId,
        RollbackResult result,
        ExecutionStatus status,
        int rollbackFailures
    ) {}
}
