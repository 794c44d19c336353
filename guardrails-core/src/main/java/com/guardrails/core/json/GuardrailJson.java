package com.guardrails.core.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson configuration for ledger payloads and policy documents.
 */
public final class GuardrailJson {

    private GuardrailJson() {
    }

    /**
     * Mapper for stored payloads: ISO-8601 instants, tolerant of unknown properties.
     */
    public static ObjectMapper newObjectMapper() {
        return configure(new ObjectMapper())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Apply the common settings to a mapper built elsewhere (e.g. a YAML mapper).
     */
    public static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }
}
