package com.guardrails.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Match predicate of a policy. All present conditions must hold.
 * Amount bounds are inclusive; service and region filters are optional.
 */
public record MatchCriteria(
    @JsonProperty("source") @JsonAlias("sources")
    List<SourceKind> sources,

    @JsonProperty("account_ids") @JsonAlias("accountIds")
    List<String> accountIds,

    @JsonProperty("min_amount_usd") @JsonAlias({"min_amount", "minAmount"})
    BigDecimal minAmount,

    @JsonProperty("max_amount_usd") @JsonAlias({"max_amount", "maxAmount"})
    BigDecimal maxAmount,

    @JsonProperty("services")
    List<String> services,

    @JsonProperty("regions")
    List<String> regions
) {
    public MatchCriteria {
        sources = sources == null ? List.of() : List.copyOf(sources);
        accountIds = accountIds == null ? List.of() : List.copyOf(accountIds);
        services = services == null ? List.of() : List.copyOf(services);
        regions = regions == null ? List.of() : List.copyOf(regions);
    }
}
