package com.guardrails.engine.matching;

import java.util.List;

/**
 * Principal allowlist matching: exact ARN, or prefix when the pattern ends with {@code *}.
 */
public final class PrincipalPatterns {

    private PrincipalPatterns() {
    }

    public static boolean matches(String pattern, String arn) {
        if (pattern == null || arn == null) {
            return false;
        }
        if (pattern.endsWith("*")) {
            return arn.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return arn.equals(pattern);
    }

    public static boolean matchesAny(List<String> patterns, String arn) {
        return patterns.stream().anyMatch(pattern -> matches(pattern, arn));
    }
}
