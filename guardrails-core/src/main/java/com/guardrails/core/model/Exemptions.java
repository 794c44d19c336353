package com.guardrails.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Allowlists that suppress an otherwise matching policy.
 * Principal entries may end with {@code *} to match by prefix.
 */
public record Exemptions(
    @JsonProperty("accounts")
    List<String> accounts,

    @JsonProperty("principals")
    List<String> principals,

    @JsonProperty("time_windows") @JsonAlias("timeWindows")
    List<ExemptionWindow> timeWindows
) {
    public static final Exemptions NONE = new Exemptions(List.of(), List.of(), List.of());

    public Exemptions {
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
        principals = principals == null ? List.of() : List.copyOf(principals);
        timeWindows = timeWindows == null ? List.of() : List.copyOf(timeWindows);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return accounts.isEmpty() && principals.isEmpty() && timeWindows.isEmpty();
    }
}
