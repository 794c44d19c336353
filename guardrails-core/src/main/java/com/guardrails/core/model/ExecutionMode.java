package com.guardrails.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Graduated execution tiers.
 */
public enum ExecutionMode {
    /**
     * Decision and notification only. No execution record is created.
     */
    SIMULATE("dry_run"),

    /**
     * Execution waits in PLANNED for a signed human approval.
     */
    APPROVE("manual"),

    /**
     * Executor is invoked immediately.
     */
    AUTOMATIC("auto");

    private final String wireName;

    ExecutionMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ExecutionMode fromValue(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "dry_run", "dry-run", "simulate" -> SIMULATE;
            case "manual", "approve" -> APPROVE;
            case "auto", "automatic" -> AUTOMATIC;
            default -> throw new IllegalArgumentException("Unknown execution mode: " + value);
        };
    }
}
