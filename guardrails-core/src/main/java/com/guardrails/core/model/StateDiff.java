package com.guardrails.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Prior and posterior state of a target around one applied action.
 * Produced by the executor on apply and stored on the execution; rollback uses it verbatim.
 */
public record StateDiff(
    @JsonProperty("action_type") ActionType actionType,
    @JsonProperty("principal_arn") String principalArn,
    @JsonProperty("policy_name") String policyName,
    @JsonProperty("before") List<String> before,
    @JsonProperty("after") List<String> after,
    @JsonProperty("attributes") Map<String, String> attributes
) {
    public StateDiff {
        before = before == null ? List.of() : List.copyOf(before);
        after = after == null ? List.of() : List.copyOf(after);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
