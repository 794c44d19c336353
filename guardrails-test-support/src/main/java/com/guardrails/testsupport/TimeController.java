package com.guardrails.testsupport;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Controllable clock for testing time-dependent behavior.
 * Pass it wherever production code takes a {@link Clock}; tests move time without waiting.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * TimeController time = TimeController.frozenAt(Instant.parse("2025-01-15T10:00:00Z"));
 * orchestrator.evaluate(event);
 * time.advanceMinutes(180);
 * scheduler.sweep(time.instant());
 * }</pre>
 */
public class TimeController extends Clock {

    private final AtomicReference<Instant> currentTime;
    private final ZoneId zone;

    public TimeController(Instant startTime) {
        this(new AtomicReference<>(startTime), ZoneOffset.UTC);
    }

    private TimeController(AtomicReference<Instant> currentTime, ZoneId zone) {
        this.currentTime = currentTime;
        this.zone = zone;
    }

    @Override
    public Instant instant() {
        return currentTime.get();
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    /**
     * A view in another zone that shares this controller's time.
     */
    @Override
    public Clock withZone(ZoneId zone) {
        return new TimeController(currentTime, zone);
    }

    /**
     * Advance time by a duration.
     */
    public void advance(Duration duration) {
        currentTime.updateAndGet(t -> t.plus(duration));
    }

    public void advanceSeconds(long seconds) {
        advance(Duration.ofSeconds(seconds));
    }

    public void advanceMinutes(long minutes) {
        advance(Duration.ofMinutes(minutes));
    }

    /**
     * Set time to a specific instant.
     */
    public void setTime(Instant newTime) {
        currentTime.set(newTime);
    }

    public static TimeController frozenAt(Instant time) {
        return new TimeController(time);
    }

    public static TimeController frozenAt(String isoInstant) {
        return new TimeController(Instant.parse(isoInstant));
    }
}
