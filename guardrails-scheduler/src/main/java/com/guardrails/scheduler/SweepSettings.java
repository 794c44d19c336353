package com.guardrails.scheduler;

import java.time.Duration;

/**
 * @param interval               delay between the end of one sweep and the start of the next
 * @param batchSize              executions fetched per ledger query
 * @param interruptedAge         how long executor work may stay unrecorded (APPROVED, or AUTOMATIC in PLANNED)
 *                               before the execution is considered interrupted
 */
public record SweepSettings(Duration interval, int batchSize, Duration interruptedAge) {

    public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(5);
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final Duration DEFAULT_INTERRUPTED_AGE = Duration.ofMinutes(10);

    public SweepSettings {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        if (interruptedAge == null || interruptedAge.isNegative()) {
            throw new IllegalArgumentException("interruptedAge must not be negative");
        }
    }

    public static SweepSettings defaults() {
        return new SweepSettings(DEFAULT_INTERVAL, DEFAULT_BATCH_SIZE, DEFAULT_INTERRUPTED_AGE);
    }
}
