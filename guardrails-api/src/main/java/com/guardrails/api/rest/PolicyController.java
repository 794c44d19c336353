package com.guardrails.api.rest;

import com.guardrails.core.model.ActionType;
import com.guardrails.core.model.ExecutionMode;
import com.guardrails.core.model.GuardrailAction;
import com.guardrails.core.model.GuardrailPolicy;
import com.guardrails.core.model.TargetPrincipal;
import com.guardrails.engine.policy.PolicyLoadReport;
import com.guardrails.engine.policy.PolicySet;
import com.guardrails.engine.policy.PolicyStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * Listing and hot reload of the loaded policy set.
 */
@RestController
@RequestMapping("/api/v1/policies")
public class PolicyController {

    private final PolicyStore policyStore;

    public PolicyController(PolicyStore policyStore) {
        this.policyStore = policyStore;
    }

    /**
     * Policies in evaluation order, disabled ones included.
     */
    @GetMapping
    public ResponseEntity<PolicySetResponse> listPolicies() {
        PolicySet snapshot = policyStore.snapshot();
        return ResponseEntity.ok(new PolicySetResponse(
            snapshot.loadedAt(),
            policyStore.isStrict(),
            snapshot.policies().stream().map(PolicySummary::from).toList(),
            policyStore.lastReport()
        ));
    }

    /**
     * Re-read the policy directory. In strict mode a rejected document fails the reload
     * and the previous set stays in force.
     */
    @PostMapping("/reload")
    public ResponseEntity<PolicyLoadReport> reload() {
        return ResponseEntity.ok(policyStore.reload());
    }

    // ========== DTOs ==========

    public record PolicySetResponse(
        Instant loadedAt,
        boolean strict,
        List<PolicySummary> policies,
        PolicyLoadReport lastReport
    ) {}

    public record PolicySummary(
        String policyId,
        String description,
        boolean enabled,
        ExecutionMode mode,
        int ttlMinutes,
        List<String> targets,
        List<ActionType> actions
    ) {
        public static PolicySummary from(GuardrailPolicy policy) {
            return new PolicySummary(
                policy.policyId(),
                policy.description(),
                policy.active(),
                policy.mode(),
                policy.ttl(),
                policy.targets().stream().map(TargetPrincipal::arn).toList(),
                policy.actions().stream().map(GuardrailAction::type).toList()
            );
        }
    }
}
