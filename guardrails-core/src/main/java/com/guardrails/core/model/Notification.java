package com.guardrails.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Structured payload handed to the notification sink. Formatting is the sink's concern.
 */
public record Notification(
    NotificationType type,
    NotificationRoute route,
    String policyId,
    String eventId,
    UUID executionId,
    String target,
    Map<String, Object> attributes
) {
    public Notification {
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Notification forExecution(
            NotificationType type,
            NotificationRoute route,
            ActionExecution execution,
            Map<String, Object> attributes) {
        return new Notification(
            type,
            route,
            execution.policyId(),
            execution.eventId(),
            execution.executionId(),
            execution.target().arn(),
            attributes
        );
    }
}
