package com.guardrails.api.rest;

import com.guardrails.scheduler.RollbackScheduler;
import com.guardrails.scheduler.SweepSummary;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * Runs a rollback sweep on demand, alongside the background schedule.
 */
@RestController
@RequestMapping("/api/v1/sweeps")
public class SweepController {

    private final RollbackScheduler scheduler;
    private final Clock clock;

    public SweepController(RollbackScheduler scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @PostMapping
    public ResponseEntity<SweepSummary> sweep() {
        return ResponseEntity.ok(scheduler.sweep(clock.instant()));
    }
}
