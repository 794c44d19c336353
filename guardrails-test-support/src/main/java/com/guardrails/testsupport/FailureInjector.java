package com.guardrails.testsupport;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Failure injection for collaborator fakes.
 * Fails deterministically: always, never, the next N calls, or after a delay.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * FailureInjector injector = FailureInjector.neverFail();
 * injector.failNext(3);           // next three calls throw
 * injector.maybeThrow(() -> new IllegalStateException("throttled"));
 * }</pre>
 */
public class FailureInjector {

    private final AtomicBoolean failAlways;
    private final AtomicInteger remainingFailures;
    private final AtomicInteger failureCount;
    private volatile Duration delay;

    private FailureInjector(boolean failAlways) {
        this.failAlways = new AtomicBoolean(failAlways);
        this.remainingFailures = new AtomicInteger(0);
        this.failureCount = new AtomicInteger(0);
        this.delay = Duration.ZERO;
    }

    /**
     * Create an injector that always fails.
     */
    public static FailureInjector alwaysFail() {
        return new FailureInjector(true);
    }

    /**
     * Create an injector that never fails.
     */
    public static FailureInjector neverFail() {
        return new FailureInjector(false);
    }

    public void setFailAlways(boolean value) {
        failAlways.set(value);
    }

    /**
     * Fail the next {@code count} calls, then recover.
     */
    public void failNext(int count) {
        remainingFailures.set(count);
    }

    /**
     * Delay every call by a fixed duration, e.g. to trip a timeout.
     */
    public void delayEachCall(Duration delay) {
        this.delay = delay;
    }

    /**
     * Check if this invocation should fail. Consumes one pending failure.
     */
    public boolean shouldFail() {
        if (failAlways.get()) {
            return true;
        }
        return remainingFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0;
    }

    /**
     * Maybe throw an exception from a supplier.
     */
    public <T extends RuntimeException> void maybeThrow(Supplier<T> exceptionSupplier) {
        maybeDelay();
        if (shouldFail()) {
            failureCount.incrementAndGet();
            throw exceptionSupplier.get();
        }
    }

    private void maybeDelay() {
        Duration current = delay;
        if (current.isZero()) {
            return;
        }
        try {
            Thread.sleep(current.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Get the number of failures injected.
     */
    public int getFailureCount() {
        return failureCount.get();
    }
}
