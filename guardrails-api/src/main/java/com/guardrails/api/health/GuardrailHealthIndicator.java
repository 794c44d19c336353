package com.guardrails.api.health;

import com.guardrails.core.model.ExecutionStatus;
import com.guardrails.core.repository.ExecutionRepository;
import com.guardrails.engine.policy.PolicyLoadReport;
import com.guardrails.engine.policy.PolicySet;
import com.guardrails.engine.policy.PolicyStore;
import com.guardrails.scheduler.RollbackScheduler;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of the guardrail controller.
 * Reports health status based on:
 * - Ledger reachability
 * - Loaded policy set and the outcome of the last load
 * - Rollback scheduler state and guardrails waiting for rollback
 */
@Component
public class GuardrailHealthIndicator implements HealthIndicator {

    private final ExecutionRepository executions;
    private final PolicyStore policyStore;
    private final RollbackScheduler scheduler;

    public GuardrailHealthIndicator(
            ExecutionRepository executions,
            PolicyStore policyStore,
            RollbackScheduler scheduler) {
        this.executions = executions;
        this.policyStore = policyStore;
        this.scheduler = scheduler;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();

        checkPolicies(details);
        details.put("rollbackScheduler", scheduler.isRunning() ? "running" : "stopped");

        try {
            Map<ExecutionStatus, Long> counts = executions.countByStatus();
            details.put("executions", counts);
            details.put("activeGuardrails", counts.getOrDefault(ExecutionStatus.EXECUTED, 0L));
            details.put("pendingApprovals", counts.getOrDefault(ExecutionStatus.PLANNED, 0L));
        } catch (RuntimeException e) {
            details.put("ledger", "unreachable");
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }

        details.put("ledger", "reachable");
        return Health.up()
            .withDetails(details)
            .build();
    }

    private void checkPolicies(Map<String, Object> details) {
        PolicySet snapshot = policyStore.snapshot();
        details.put("policies", snapshot.size());
        details.put("policiesLoadedAt", snapshot.loadedAt().toString());

        PolicyLoadReport report = policyStore.lastReport();
        if (report != null && !report.isClean()) {
            details.put("rejectedPolicies", report.rejected().size());
        }
        if (snapshot.size() == 0) {
            details.put("policyWarning", "No policies loaded - every event resolves to NO_MATCH");
        }
    }
}
