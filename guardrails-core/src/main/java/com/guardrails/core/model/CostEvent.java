package com.guardrails.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Normalized cost signal produced by an external normalizer.
 * Immutable; the same eventId may be delivered more than once.
 */
public record CostEvent(
    @JsonProperty("event_id") @JsonAlias("eventId")
    String eventId,

    @JsonProperty("source")
    SourceKind source,

    @JsonProperty("account_id") @JsonAlias("accountId")
    String accountId,

    @JsonProperty("amount")
    BigDecimal amount,

    @JsonProperty("time_window") @JsonAlias("timeWindow")
    String timeWindow,

    @JsonProperty("details")
    Map<String, Object> details
) {
    public static final String DETAIL_SERVICE = "service";
    public static final String DETAIL_REGION = "region";
    public static final String DETAIL_PRINCIPAL_ARN = "principal_arn";

    public CostEvent {
        details = details == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /**
     * Read a detail as a string, if present and non-blank.
     */
    public Optional<String> detail(String key) {
        Object value = details.get(key);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString();
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }
}
