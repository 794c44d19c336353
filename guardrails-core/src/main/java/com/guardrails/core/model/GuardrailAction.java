package com.guardrails.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One typed operation of a policy. Only "deny further creation" style denies are allowed.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record GuardrailAction(
    @JsonProperty("type") ActionType type,
    @JsonProperty("deny") List<String> deny
) {
    public GuardrailAction {
        deny = deny == null ? List.of() : List.copyOf(deny);
    }

    public static GuardrailAction denying(String... actions) {
        return new GuardrailAction(ActionType.ATTACH_DENY_POLICY, List.of(actions));
    }

    public static GuardrailAction notifyOnly() {
        return new GuardrailAction(ActionType.NOTIFY_ONLY, List.of());
    }
}
