package com.guardrails.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A fully-qualified identity a guardrail is applied to.
 */
public record TargetPrincipal(
    @JsonProperty("type") PrincipalType type,
    @JsonProperty("arn") String arn
) {
    public static TargetPrincipal role(String arn) {
        return new TargetPrincipal(PrincipalType.ROLE, arn);
    }

    public static TargetPrincipal user(String arn) {
        return new TargetPrincipal(PrincipalType.USER, arn);
    }

    /**
     * The trailing name segment of the ARN, e.g. {@code ci-deployer} for {@code ...:role/ci-deployer}.
     */
    public String name() {
        if (arn == null) {
            return null;
        }
        int slash = arn.lastIndexOf('/');
        return slash >= 0 ? arn.substring(slash + 1) : arn;
    }
}
