package com.guardrails.engine.approval;

import java.util.Locale;

public enum ApprovalDecision {
    APPROVE,
    REJECT;

    /**
     * Parse a callback decision, case-insensitively.
     *
     * @throws IllegalArgumentException for anything but approve or reject
     */
    public static ApprovalDecision parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Decision is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "approve" -> APPROVE;
            case "reject" -> REJECT;
            default -> throw new IllegalArgumentException("Unknown decision: " + value);
        };
    }
}
