package com.guardrails.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guardrails.api.GuardrailApplication;
import com.guardrails.core.model.ExecutionStatus;
import com.guardrails.core.repository.ExecutionRepository;
import com.guardrails.engine.approval.ApprovalTokenSigner;
import com.guardrails.testsupport.RecordingGuardrailExecutor;
import com.guardrails.testsupport.TimeController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end tests over HTTP against the in-memory ledger and the test policy directory.
 */
@SpringBootTest(
    classes = GuardrailApplication.class,
    properties = {
        "guardrails.policies.directory=src/test/resources/policies",
        "guardrails.policies.strict=true",
        "guardrails.approval.secret=api-test-secret",
        "guardrails.rollback.scheduler-enabled=false",
        "guardrails.timeouts.executor=2s"
    })
@AutoConfigureMockMvc
@Import(GuardrailApiTest.TestCollaborators.class)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class GuardrailApiTest {

    private static final String ROLE_R1 = "arn:aws:iam::123456789012:role/R1";
    private static final String ROLE_R2 = "arn:aws:iam::123456789012:role/R2";

    @TestConfiguration
    static class TestCollaborators {

        @Bean
        @Primary
        TimeController testClock() {
            return TimeController.frozenAt("2025-01-15T10:00:00Z");
        }

        @Bean
        @Primary
        RecordingGuardrailExecutor recordingExecutor() {
            return new RecordingGuardrailExecutor();
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TimeController clock;

    @Autowired
    private RecordingGuardrailExecutor executor;

    @Autowired
    private ApprovalTokenSigner signer;

    @Autowired
    private ExecutionRepository executions;

    private static String budgetEvent(String eventId, String amount) {
        return """
            {"event_id": "%s", "source": "budgets", "account_id": "A1",
             "amount": %s, "time_window": "2025-01", "details": {}}
            """.formatted(eventId, amount);
    }

    private static String anomalyEvent(String eventId, String amount) {
        return """
            {"event_id": "%s", "source": "anomaly", "account_id": "A2",
             "amount": %s, "time_window": "2025-01-15", "details": {"service": "EC2"}}
            """.formatted(eventId, amount);
    }

    private JsonNode postEvent(String body, int expectedStatus) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().is(expectedStatus))
            .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private UUID firstExecution(JsonNode decision) {
        return UUID.fromString(decision.path("targets").get(0).path("executionId").asText());
    }

    private ExecutionStatus statusOf(UUID executionId) {
        return executions.findById(executionId).orElseThrow().status();
    }

    // ========== Events ==========

    @Test
    @DisplayName("Budget event over the threshold plans an execution and waits for approval")
    void submitEvent_approvalPolicy_shouldPlanExecution() throws Exception {
        JsonNode decision = postEvent(budgetEvent("e1", "250"), 200);

        assertThat(decision.path("outcome").asText()).isEqualTo("APPROVAL_REQUESTED");
        assertThat(decision.path("policyId").asText()).isEqualTo("approve-ci");
        assertThat(statusOf(firstExecution(decision))).isEqualTo(ExecutionStatus.PLANNED);
        assertThat(executor.applyCalls()).isEmpty();
    }

    @Test
    void submitEvent_belowThreshold_shouldNotMatch() throws Exception {
        JsonNode decision = postEvent(budgetEvent("e1", "150"), 200);

        assertThat(decision.path("outcome").asText()).isEqualTo("NO_MATCH");
        assertThat(executions.findRecent(10)).isEmpty();
    }

    @Test
    void submitEvent_redelivery_shouldNotCreateSecondExecution() throws Exception {
        UUID first = firstExecution(postEvent(budgetEvent("e1", "250"), 200));
        JsonNode again = postEvent(budgetEvent("e1", "250"), 200);

        assertThat(again.path("targets").get(0).path("outcome").asText()).isEqualTo("DUPLICATE");
        assertThat(executions.findRecent(10)).hasSize(1);
        assertThat(statusOf(first)).isEqualTo(ExecutionStatus.PLANNED);
    }

    @Test
    void submitEvent_nonPositiveAmount_shouldBeRejected() throws Exception {
        JsonNode decision = postEvent(budgetEvent("e1", "-5"), 400);

        assertThat(decision.path("outcome").asText()).isEqualTo("INVALID_EVENT");
        assertThat(decision.path("message").asText()).contains("amount must be positive");
    }

    @Test
    void submitEvent_malformedBody_shouldReturnErrorBody() throws Exception {
        mockMvc.perform(post("/api/v1/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"event_id\": "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("BAD_REQUEST"))
            .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void submitEvent_automaticPolicy_shouldApplyImmediately() throws Exception {
        JsonNode decision = postEvent(anomalyEvent("a1", "150"), 200);

        assertThat(decision.path("outcome").asText()).isEqualTo("EXECUTED");
        UUID executionId = firstExecution(decision);
        assertThat(statusOf(executionId)).isEqualTo(ExecutionStatus.EXECUTED);
        assertThat(executor.deniesOn(ROLE_R2)).containsExactly("ec2:RunInstances");
    }

    // ========== Approvals ==========

    @Test
    @DisplayName("Approval link applies the guardrail once; replay is a conflict")
    void approve_withValidToken_shouldExecuteOnce() throws Exception {
        UUID executionId = firstExecution(postEvent(budgetEvent("e1", "250"), 200));
        String token = signer.issue(executionId).value();

        mockMvc.perform(get("/api/v1/approvals/{id}", executionId)
                .param("token", token)
                .param("decision", "approve")
                .param("user", "alice"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.outcome").value("EXECUTED"))
            .andExpect(jsonPath("$.status").value("EXECUTED"));

        assertThat(executor.deniesOn(ROLE_R1)).containsExactly("ec2:RunInstances", "ec2:CreateNatGateway");
        assertThat(executions.findById(executionId).orElseThrow().executedBy()).isEqualTo("user:alice");

        mockMvc.perform(post("/api/v1/approvals/{id}", executionId)
                .param("token", token)
                .param("decision", "approve"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.outcome").value("ALREADY_RESOLVED"));
        assertThat(executor.applyCalls()).hasSize(1);
    }

    @Test
    void reject_withValidToken_shouldLeaveTargetUntouched() throws Exception {
        UUID executionId = firstExecution(postEvent(budgetEvent("e1", "250"), 200));

        mockMvc.perform(post("/api/v1/approvals/{id}", executionId)
                .param("token", signer.issue(executionId).value())
                .param("decision", "REJECT")
                .param("user", "bob"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.outcome").value("REJECTED"));

        assertThat(statusOf(executionId)).isEqualTo(ExecutionStatus.REJECTED);
        assertThat(executor.applyCalls()).isEmpty();
    }

    @Test
    void approve_withForgedToken_shouldBeDenied() throws Exception {
        UUID executionId = firstExecution(postEvent(budgetEvent("e1", "250"), 200));
        String forged = clock.instant().getEpochSecond() + "." + "0".repeat(64);

        mockMvc.perform(get("/api/v1/approvals/{id}", executionId)
                .param("token", forged)
                .param("decision", "approve"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.outcome").value("DENIED"));

        assertThat(statusOf(executionId)).isEqualTo(ExecutionStatus.PLANNED);
    }

    @Test
    void approve_afterWindow_shouldBeDeniedAndExpire() throws Exception {
        UUID executionId = firstExecution(postEvent(budgetEvent("e1", "250"), 200));
        String token = signer.issue(executionId).value();
        clock.advanceMinutes(61);

        mockMvc.perform(get("/api/v1/approvals/{id}", executionId)
                .param("token", token)
                .param("decision", "approve"))
            .andExpect(status().isForbidden());

        assertThat(statusOf(executionId)).isEqualTo(ExecutionStatus.EXPIRED);
        assertThat(executor.applyCalls()).isEmpty();
    }

    @Test
    void approve_unknownExecution_shouldReturnNotFound() throws Exception {
        UUID unknown = UUID.randomUUID();

        mockMvc.perform(get("/api/v1/approvals/{id}", unknown)
                .param("token", signer.issue(unknown).value())
                .param("decision", "approve"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.outcome").value("NOT_FOUND"));
    }

    @Test
    void approve_unknownDecision_shouldBeBadRequest() throws Exception {
        UUID executionId = firstExecution(postEvent(budgetEvent("e1", "250"), 200));

        mockMvc.perform(get("/api/v1/approvals/{id}", executionId)
                .param("token", signer.issue(executionId).value())
                .param("decision", "maybe"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));
    }

    @Test
    void approve_withoutToken_shouldBeBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/approvals/{id}", UUID.randomUUID())
                .param("decision", "approve"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("BAD_REQUEST"));
    }

    // ========== Executions & Rollback ==========

    @Test
    void sweep_afterTtl_shouldRollBackAutomaticGuardrail() throws Exception {
        UUID executionId = firstExecution(postEvent(anomalyEvent("a1", "150"), 200));
        clock.advanceMinutes(60);

        mockMvc.perform(post("/api/v1/sweeps"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.attempted").value(1))
            .andExpect(jsonPath("$.rolledBack").value(1));

        mockMvc.perform(get("/api/v1/executions/{id}", executionId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ROLLED_BACK"))
            .andExpect(jsonPath("$.target.arn").value(ROLE_R2));
        assertThat(executor.deniesOn(ROLE_R2)).isEmpty();
    }

    @Test
    void rollback_manual_shouldRevertBeforeTtl() throws Exception {
        UUID executionId = firstExecution(postEvent(anomalyEvent("a1", "150"), 200));

        mockMvc.perform(post("/api/v1/executions/{id}/rollback", executionId).param("user", "carol"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result").value("ROLLED_BACK"))
            .andExpect(jsonPath("$.status").value("ROLLED_BACK"));

        mockMvc.perform(post("/api/v1/executions/{id}/rollback", executionId))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.result").value("SKIPPED"));
        assertThat(executor.revertCalls()).hasSize(1);
    }

    @Test
    void listExecutions_shouldFilterByStatusAndExposeAudit() throws Exception {
        UUID executed = firstExecution(postEvent(anomalyEvent("a1", "150"), 200));
        postEvent(budgetEvent("e1", "250"), 200);

        mockMvc.perform(get("/api/v1/executions").param("status", "EXECUTED"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].executionId").value(executed.toString()));

        mockMvc.perform(get("/api/v1/executions").param("eventId", "e1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].status").value("PLANNED"));

        mockMvc.perform(get("/api/v1/executions/{id}/audit", executed))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(greaterThan(0)));
    }

    @Test
    void getExecution_unknown_shouldReturnErrorBody() throws Exception {
        mockMvc.perform(get("/api/v1/executions/{id}", UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value("NOT_FOUND"));
    }

    // ========== Policies & Health ==========

    @Test
    void listPolicies_shouldReturnDeclaredOrder() throws Exception {
        mockMvc.perform(get("/api/v1/policies"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.strict").value(true))
            .andExpect(jsonPath("$.policies[0].policyId").value("approve-ci"))
            .andExpect(jsonPath("$.policies[1].policyId").value("auto-sandbox"))
            .andExpect(jsonPath("$.policies[1].targets[0]").value(ROLE_R2));
    }

    @Test
    void reloadPolicies_shouldReportAcceptedPolicies() throws Exception {
        mockMvc.perform(post("/api/v1/policies/reload"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.accepted.length()").value(2))
            .andExpect(jsonPath("$.rejected.length()").value(0));
    }

    @Test
    void health_shouldReportPoliciesAndLedger() throws Exception {
        postEvent(anomalyEvent("a1", "150"), 200);

        mockMvc.perform(get("/actuator/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.components.guardrail.details.policies").value(2))
            .andExpect(jsonPath("$.components.guardrail.details.activeGuardrails").value(1));
    }
}
