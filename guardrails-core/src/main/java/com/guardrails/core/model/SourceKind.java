package com.guardrails.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Where a cost event came from.
 */
public enum SourceKind {
    BUDGET_THRESHOLD("budgets"),
    ANOMALY_DETECTION("anomaly");

    private final String wireName;

    SourceKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Accepts the wire names ("budgets", "anomaly"), the singular "budget" and the enum constant names.
     */
    @JsonCreator
    public static SourceKind fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "budgets", "budget", "budget_threshold" -> BUDGET_THRESHOLD;
            case "anomaly", "anomaly_detection" -> ANOMALY_DETECTION;
            default -> throw new IllegalArgumentException("Unknown event source: " + value);
        };
    }
}
