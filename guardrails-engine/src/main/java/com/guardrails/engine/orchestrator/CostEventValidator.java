package com.guardrails.engine.orchestrator;

import com.guardrails.core.exception.EventValidationException;
import com.guardrails.core.model.CostEvent;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Ingest checks on a cost event. Malformed events are rejected, never coerced.
 */
public class CostEventValidator {

    public List<String> violations(CostEvent event) {
        List<String> violations = new ArrayList<>();
        if (event == null) {
            violations.add("event is required");
            return violations;
        }
        if (isBlank(event.eventId())) {
            violations.add("event_id is required");
        }
        if (event.source() == null) {
            violations.add("source is required");
        }
        if (isBlank(event.accountId())) {
            violations.add("account_id is required");
        }
        if (event.amount() == null) {
            violations.add("amount is required");
        } else if (event.amount().compareTo(BigDecimal.ZERO) <= 0) {
            violations.add("amount must be positive, got " + event.amount());
        }
        if (isBlank(event.timeWindow())) {
            violations.add("time_window is required");
        }
        return violations;
    }

    public void validate(CostEvent event) {
        List<String> violations = violations(event);
        if (!violations.isEmpty()) {
            String eventId = event == null || isBlank(event.eventId()) ? "<unknown>" : event.eventId();
            throw new EventValidationException(eventId, violations);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
