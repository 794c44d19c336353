package com.guardrails.engine.approval;

import com.guardrails.core.exception.NotFoundException;
import com.guardrails.core.model.ActionExecution;
import com.guardrails.core.model.ExecutionStatus;
import com.guardrails.core.repository.ExecutionRepository;
import com.guardrails.engine.logging.LoggingContext;
import com.guardrails.engine.metrics.GuardrailMetrics;
import com.guardrails.engine.orchestrator.ExecutionOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Validates approval callbacks and hands them to the orchestrator.
 *
 * The token is checked before the ledger is read, so an unauthenticated caller learns nothing
 * about which executions exist. Replays are safe: the orchestrator only acts on a PLANNED
 * record, so a second delivery of the same valid token resolves to ALREADY_RESOLVED.
 */
public class ApprovalGateway {

    private static final Logger log = LoggerFactory.getLogger(ApprovalGateway.class);

    private final ApprovalTokenSigner signer;
    private final ExecutionOrchestrator orchestrator;
    private final ExecutionRepository executions;
    private final GuardrailMetrics metrics;
    private final Clock clock;

    public ApprovalGateway(ApprovalTokenSigner signer,
                           ExecutionOrchestrator orchestrator,
                           ExecutionRepository executions,
                           GuardrailMetrics metrics,
                           Clock clock) {
        this.signer = signer;
        this.orchestrator = orchestrator;
        this.executions = executions;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @param decision {@code approve} or {@code reject}
     * @param user     identity of the human answering, recorded on the execution
     * @throws IllegalArgumentException for an unknown decision string
     */
    public ApprovalResult resolve(UUID executionId, String token, String decision, String user) {
        ApprovalDecision parsed = ApprovalDecision.parse(decision);
        String approver = user == null || user.isBlank() ? "unknown" : user.trim();

        try (LoggingContext ctx = LoggingContext.forExecution(executionId, null, null)) {
            ApprovalResult result = resolve(executionId, token, parsed, approver);
            metrics.approvalResolved(result.outcome().name().toLowerCase(Locale.ROOT));
            log.info("Approval callback {} by {} resolved to {}", parsed, approver, result.outcome());
            return result;
        }
    }

    private ApprovalResult resolve(UUID executionId, String token, ApprovalDecision decision, String approver) {
        TokenVerification verification = signer.verify(executionId, token);
        if (verification == TokenVerification.STALE) {
            log.debug("Stale approval token presented");
            orchestrator.expire(executionId, clock.instant());
            return ApprovalResult.denied(executionId);
        }
        if (verification != TokenVerification.VALID) {
            log.debug("Invalid approval token presented");
            return ApprovalResult.denied(executionId);
        }

        try {
            return switch (decision) {
                case APPROVE -> approve(executionId, approver);
                case REJECT -> reject(executionId, approver);
            };
        } catch (NotFoundException e) {
            return new ApprovalResult(ApprovalOutcome.NOT_FOUND, executionId, null);
        }
    }

    private ApprovalResult approve(UUID executionId, String approver) {
        Optional<ActionExecution> result = orchestrator.approve(executionId, approver);
        if (result.isEmpty()) {
            return alreadyResolved(executionId);
        }
        ActionExecution execution = result.get();
        ApprovalOutcome outcome = switch (execution.status()) {
            case EXECUTED -> ApprovalOutcome.EXECUTED;
            case FAILED -> ApprovalOutcome.FAILED;
            default -> ApprovalOutcome.ALREADY_RESOLVED;
        };
        return new ApprovalResult(outcome, executionId, execution.status());
    }

    private ApprovalResult reject(UUID executionId, String approver) {
        return orchestrator.reject(executionId, approver)
            .map(e -> new ApprovalResult(ApprovalOutcome.REJECTED, executionId, e.status()))
            .orElseGet(() -> alreadyResolved(executionId));
    }

    private ApprovalResult alreadyResolved(UUID executionId) {
        ExecutionStatus status = executions.findById(executionId).map(ActionExecution::status).orElse(null);
        return new ApprovalResult(ApprovalOutcome.ALREADY_RESOLVED, executionId, status);
    }
}
