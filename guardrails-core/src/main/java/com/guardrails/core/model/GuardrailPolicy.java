package com.guardrails.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A guardrail policy definition as loaded from configuration.
 * Read-only to the engine.
 *
 * Invariants (enforced by the policy validator, not the constructor):
 * - policyId is unique within a policy set
 * - scope is non-empty and holds no wildcard principals
 * - no action names a deletion-class operation
 * - maxAmount > minAmount when both are present; ttlMinutes >= 0
 */
public record GuardrailPolicy(
    @JsonProperty("policy_id") @JsonAlias("policyId")
    String policyId,

    @JsonProperty("description")
    String description,

    @JsonProperty("enabled")
    Boolean enabled,

    @JsonProperty("mode")
    ExecutionMode mode,

    @JsonProperty("ttl_minutes") @JsonAlias("ttlMinutes")
    Integer ttlMinutes,

    @JsonProperty("match")
    MatchCriteria match,

    @JsonProperty("scope")
    PolicyScope scope,

    @JsonProperty("actions")
    List<GuardrailAction> actions,

    @JsonProperty("notify")
    NotificationRoute notification,

    @JsonProperty("exceptions") @JsonAlias("exemptions")
    Exemptions exemptions
) {
    public GuardrailPolicy {
        enabled = enabled == null ? Boolean.TRUE : enabled;
        actions = actions == null ? List.of() : List.copyOf(actions);
        exemptions = exemptions == null ? Exemptions.NONE : exemptions;
    }

    public boolean active() {
        return Boolean.TRUE.equals(enabled);
    }

    public List<TargetPrincipal> targets() {
        return scope == null ? List.of() : scope.principals();
    }

    public int ttl() {
        return ttlMinutes == null ? 0 : ttlMinutes;
    }

    public static Builder builder(String policyId) {
        return new Builder(policyId);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Builder for creating modified copies.
     */
    public static class Builder {
        private String policyId;
        private String description;
        private Boolean enabled = Boolean.TRUE;
        private ExecutionMode mode = ExecutionMode.SIMULATE;
        private Integer ttlMinutes = 0;
        private MatchCriteria match;
        private final List<TargetPrincipal> principals = new ArrayList<>();
        private final List<GuardrailAction> actions = new ArrayList<>();
        private NotificationRoute notification;
        private Exemptions exemptions = Exemptions.NONE;

        public Builder(String policyId) {
            this.policyId = policyId;
        }

        public Builder(GuardrailPolicy policy) {
            this.policyId = policy.policyId;
            this.description = policy.description;
            this.enabled = policy.enabled;
            this.mode = policy.mode;
            this.ttlMinutes = policy.ttlMinutes;
            this.match = policy.match;
            this.principals.addAll(policy.targets());
            this.actions.addAll(policy.actions);
            this.notification = policy.notification;
            this.exemptions = policy.exemptions;
        }

        public Builder policyId(String policyId) {
            this.policyId = policyId;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder mode(ExecutionMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder ttlMinutes(Integer ttlMinutes) {
            this.ttlMinutes = ttlMinutes;
            return this;
        }

        public Builder match(MatchCriteria match) {
            this.match = match;
            return this;
        }

        public Builder principals(List<TargetPrincipal> principals) {
            this.principals.clear();
            this.principals.addAll(principals);
            return this;
        }

        public Builder principal(TargetPrincipal principal) {
            this.principals.add(principal);
            return this;
        }

        public Builder actions(List<GuardrailAction> actions) {
            this.actions.clear();
            this.actions.addAll(actions);
            return this;
        }

        public Builder action(GuardrailAction action) {
            this.actions.add(action);
            return this;
        }

        public Builder notification(NotificationRoute notification) {
            this.notification = notification;
            return this;
        }

        public Builder exemptions(Exemptions exemptions) {
            this.exemptions = exemptions;
            return this;
        }

        public GuardrailPolicy build() {
            return new GuardrailPolicy(
                policyId, description, enabled, mode, ttlMinutes, match,
                new PolicyScope(principals), actions, notification, exemptions
            );
        }
    }
}
