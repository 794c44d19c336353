package com.guardrails.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PrincipalType {
    ROLE("iam_role", "role/"),
    USER("iam_user", "user/");

    private final String wireName;
    private final String resourcePrefix;

    PrincipalType(String wireName, String resourcePrefix) {
        this.wireName = wireName;
        this.resourcePrefix = resourcePrefix;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resource segment an ARN of this type carries after the account id, e.g. {@code role/}.
     */
    public String resourcePrefix() {
        return resourcePrefix;
    }

    @JsonCreator
    public static PrincipalType fromValue(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "iam_role", "role" -> ROLE;
            case "iam_user", "user" -> USER;
            default -> throw new IllegalArgumentException("Unknown principal type: " + value);
        };
    }
}
