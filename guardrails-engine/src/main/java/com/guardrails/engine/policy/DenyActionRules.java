package com.guardrails.engine.policy;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Classifies IAM action names that a guardrail may never deny-list as "restrictive".
 * Guardrails only block further creation; anything that reads as deletion is rejected at load.
 */
public final class DenyActionRules {

    private static final Set<String> DELETION_CLASS_ACTIONS = Set.of(
        "s3:deletebucket",
        "dynamodb:deletetable",
        "rds:deletedbinstance",
        "ec2:terminateinstances",
        "ec2:deletevolume"
    );

    private static final List<String> DELETION_VERBS = List.of(
        "delete", "terminate", "destroy", "purge", "remove"
    );

    private DenyActionRules() {
    }

    /**
     * True if the action names, or through a wildcard could name, a deletion-class operation.
     * Matching is case-insensitive, like IAM action names.
     */
    public static boolean isDeletionClass(String action) {
        if (action == null) {
            return false;
        }
        String normalized = action.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("*") || DELETION_CLASS_ACTIONS.contains(normalized)) {
            return true;
        }
        int colon = normalized.indexOf(':');
        String operation = colon >= 0 ? normalized.substring(colon + 1) : normalized;

        int star = operation.indexOf('*');
        if (star >= 0) {
            String prefix = operation.substring(0, star);
            return DELETION_VERBS.stream().anyMatch(verb -> verb.startsWith(prefix) || prefix.startsWith(verb));
        }
        return DELETION_VERBS.stream().anyMatch(operation::startsWith);
    }

    /**
     * True if the string is shaped like {@code service:Operation}.
     */
    public static boolean isWellFormed(String action) {
        if (action == null || action.isBlank()) {
            return false;
        }
        int colon = action.indexOf(':');
        return colon > 0 && colon < action.length() - 1 && action.indexOf(':', colon + 1) < 0;
    }
}
