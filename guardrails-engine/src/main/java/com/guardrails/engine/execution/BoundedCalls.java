package com.guardrails.engine.execution;

import com.guardrails.core.exception.ExecutorException;
import com.guardrails.core.exception.GuardrailException;
import com.guardrails.core.exception.LedgerException;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiFunction;

/**
 * Runs blocking calls to an external dependency under a hard timeout.
 * A call that does not answer in time is cancelled and surfaces as the dependency's own
 * exception type, so callers handle a hang exactly like a failure.
 */
public class BoundedCalls {

    private final Duration timeout;
    private final ExecutorService pool;
    private final BiFunction<String, Throwable, GuardrailException> failure;
    private final BiFunction<String, Duration, GuardrailException> timedOut;
    private final boolean passDomainErrors;

    private BoundedCalls(Duration timeout,
                         ExecutorService pool,
                         BiFunction<String, Throwable, GuardrailException> failure,
                         BiFunction<String, Duration, GuardrailException> timedOut,
                         boolean passDomainErrors) {
        this.timeout = timeout;
        this.pool = pool;
        this.failure = failure;
        this.timedOut = timedOut;
        this.passDomainErrors = passDomainErrors;
    }

    /**
     * Calls into the identity backend; everything surfaces as {@link ExecutorException}.
     */
    public static BoundedCalls forExecutor(Duration timeout, ExecutorService pool) {
        return new BoundedCalls(timeout, pool,
            (operation, cause) -> new ExecutorException(
                "Executor call " + operation + " failed: " + cause.getMessage(), cause),
            ExecutorException::timeout,
            false);
    }

    /**
     * Calls into the ledger; guardrail exceptions (lock conflicts, not found) pass through
     * unchanged, anything else surfaces as {@link LedgerException}.
     */
    public static BoundedCalls forLedger(Duration timeout, ExecutorService pool) {
        return new BoundedCalls(timeout, pool,
            (operation, cause) -> new LedgerException(
                "Ledger call " + operation + " failed: " + cause.getMessage(), cause),
            (operation, limit) -> new LedgerException(
                "Ledger call " + operation + " timed out after " + limit.toMillis() + " ms"),
            true);
    }

    public Duration timeout() {
        return timeout;
    }

    public <T> T call(String operation, Callable<T> body) {
        Future<T> future = pool.submit(body);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw timedOut.apply(operation, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ExecutorException executorException) {
                throw executorException;
            }
            if (passDomainErrors && cause instanceof GuardrailException guardrailException) {
                throw guardrailException;
            }
            throw failure.apply(operation, cause);
        } catch (CancellationException e) {
            throw failure.apply(operation, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw failure.apply(operation, e);
        }
    }

    public void run(String operation, Runnable body) {
        call(operation, () -> {
            body.run();
            return null;
        });
    }
}
