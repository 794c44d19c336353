package com.guardrails.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ActionType {
    /**
     * Attach an inline deny statement to the target principal. Reversible.
     */
    ATTACH_DENY_POLICY("attach_deny_policy"),

    /**
     * Notify only; the executor is never called.
     */
    NOTIFY_ONLY("notify_only");

    private final String wireName;

    ActionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean touchesExecutor() {
        return this == ATTACH_DENY_POLICY;
    }

    @JsonCreator
    public static ActionType fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ActionType type : values()) {
            if (type.wireName.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown action type: " + value);
    }
}
