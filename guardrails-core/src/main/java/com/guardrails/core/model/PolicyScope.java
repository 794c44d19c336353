package com.guardrails.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record PolicyScope(
    @JsonProperty("principals") List<TargetPrincipal> principals
) {
    public PolicyScope {
        principals = principals == null ? List.of() : List.copyOf(principals);
    }

    public static PolicyScope of(TargetPrincipal... principals) {
        return new PolicyScope(List.of(principals));
    }
}
