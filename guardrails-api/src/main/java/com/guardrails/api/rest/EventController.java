package com.guardrails.api.rest;

import com.guardrails.core.model.CostEvent;
import com.guardrails.engine.orchestrator.Decision;
import com.guardrails.engine.orchestrator.ExecutionOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Intake of normalized cost events.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final ExecutionOrchestrator orchestrator;

    public EventController(ExecutionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Evaluate one event. Redelivering the same event is safe.
     */
    @PostMapping
    public ResponseEntity<Decision> submitEvent(@RequestBody CostEvent event) {
        Decision decision = orchestrator.evaluate(event);
        HttpStatus status = switch (decision.outcome()) {
            case INVALID_EVENT -> HttpStatus.BAD_REQUEST;
            case ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
            default -> HttpStatus.OK;
        };
        return ResponseEntity.status(status).body(decision);
    }
}
