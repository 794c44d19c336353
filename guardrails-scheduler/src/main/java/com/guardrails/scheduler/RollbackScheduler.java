package com.guardrails.scheduler;

import com.guardrails.core.model.ActionExecution;
import com.guardrails.core.repository.ExecutionRepository;
import com.guardrails.core.repository.LedgerCursor;
import com.guardrails.engine.logging.LoggingContext;
import com.guardrails.engine.metrics.GuardrailMetrics;
import com.guardrails.engine.orchestrator.ExecutionOrchestrator;
import com.guardrails.engine.orchestrator.RollbackResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Periodic cleanup of the execution ledger.
 *
 * Each sweep, in order:
 * - expires APPROVE-mode PLANNED executions whose approval window has elapsed
 * - fails in-flight executions (APPROVED, or AUTOMATIC still PLANNED) that never completed
 * - rolls back EXECUTED executions whose ttl has expired, from their stored diffs
 *
 * A failed rollback leaves the execution EXECUTED for the next sweep. All writes go through
 * the orchestrator's compare-and-swap, so overlapping sweeps on one or many nodes never
 * revert the same execution twice.
 */
public class RollbackScheduler {

    private static final Logger log = LoggerFactory.getLogger(RollbackScheduler.class);

    private final ExecutionOrchestrator orchestrator;
    private final ExecutionRepository executions;
    private final GuardrailMetrics metrics;
    private final SweepSettings settings;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public RollbackScheduler(
            ExecutionOrchestrator orchestrator,
            ExecutionRepository executions,
            GuardrailMetrics metrics,
            SweepSettings settings,
            Clock clock) {
        this.orchestrator = orchestrator;
        this.executions = executions;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "rollback-sweep");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start sweeping on a fixed delay.
     */
    public void start() {
        if (running) {
            log.warn("Rollback scheduler already running");
            return;
        }

        running = true;
        log.info("Starting rollback scheduler, interval {}", settings.interval());

        scheduler.scheduleWithFixedDelay(
            this::scheduledSweep,
            settings.interval().toMillis(),
            settings.interval().toMillis(),
            TimeUnit.MILLISECONDS
        );
    }

    /**
     * Stop the scheduler, letting a sweep in progress finish.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Rollback scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void scheduledSweep() {
        if (!running) return;

        try {
            sweep(clock.instant());
        } catch (Exception e) {
            log.error("Rollback sweep failed, will retry next interval", e);
        } finally {
            LoggingContext.clearAll();
        }
    }

    /**
     * Run one sweep as of {@code now}. Safe to call concurrently with itself.
     */
    public SweepSummary sweep(Instant now) {
        long started = System.nanoTime();

        int expired = drain(
            (after, limit) -> executions.findOverdueApprovals(now, after, limit),
            ActionExecution::approvalDeadline,
            execution -> orchestrator.expire(execution, now).isPresent());

        Instant startedBefore = now.minus(settings.interruptedAge());
        int interrupted = drain(
            (after, limit) -> executions.findInterrupted(startedBefore, after, limit),
            ActionExecution::inFlightSince,
            execution -> orchestrator.failInterrupted(execution, now).isPresent());

        int[] counts = new int[4];
        drain(
            (after, limit) -> executions.findDueForRollback(now, after, limit),
            ActionExecution::ttlExpiresAt,
            execution -> {
                RollbackResult result = orchestrator.rollback(execution, now);
                if (result != RollbackResult.SKIPPED) {
                    counts[0]++;
                }
                if (result == RollbackResult.ROLLED_BACK) {
                    counts[1]++;
                }
                if (result.isFailure()) {
                    counts[2]++;
                }
                if (result == RollbackResult.ESCALATED || result == RollbackResult.ABANDONED) {
                    counts[3]++;
                }
                return result != RollbackResult.SKIPPED;
            });

        SweepSummary summary = new SweepSummary(counts[0], counts[1], counts[2], counts[3], expired, interrupted);
        metrics.sweepCompleted(Duration.ofNanos(System.nanoTime() - started));

        if (summary.isIdle()) {
            log.debug("Rollback sweep found nothing to do");
        } else {
            log.info("Rollback sweep: {}", summary);
        }
        return summary;
    }

    /**
     * Walk a sweep query page by page with a keyset cursor until it runs dry. Each page starts
     * after the last row of the previous one, so executions that stay eligible after being
     * handled (a failed rollback goes back to EXECUTED) never block the ones behind them; they
     * are retried on the next sweep.
     *
     * @return how many executions the handler reported as changed
     */
    private int drain(
            BiFunction<LedgerCursor, Integer, List<ActionExecution>> query,
            Function<ActionExecution, Instant> position,
            Predicate<ActionExecution> handler) {
        LedgerCursor cursor = null;
        int changed = 0;
        while (true) {
            List<ActionExecution> batch = query.apply(cursor, settings.batchSize());
            for (ActionExecution execution : batch) {
                try {
                    if (handler.test(execution)) {
                        changed++;
                    }
                } catch (RuntimeException e) {
                    log.error("Sweep failed on execution {}, continuing", execution.executionId(), e);
                }
            }
            if (batch.size() < settings.batchSize()) {
                return changed;
            }
            ActionExecution last = batch.get(batch.size() - 1);
            cursor = LedgerCursor.after(last, position.apply(last));
        }
    }
}
