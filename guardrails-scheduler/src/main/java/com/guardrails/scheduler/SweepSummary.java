package com.guardrails.scheduler;

/**
 * Counts from one rollback sweep.
 *
 * @param attempted          rollbacks actually tried (claims won)
 * @param rolledBack         executions now ROLLED_BACK
 * @param failed             attempts that did not roll back, escalated ones included
 * @param escalated          attempts that paged a human this sweep
 * @param expiredApprovals   PLANNED executions moved to EXPIRED
 * @param interrupted        in-flight executions (APPROVED, or AUTOMATIC still PLANNED) found stuck and moved to FAILED
 */
public record SweepSummary(
    int attempted,
    int rolledBack,
    int failed,
    int escalated,
    int expiredApprovals,
    int interrupted
) {
    public static final SweepSummary EMPTY = new SweepSummary(0, 0, 0, 0, 0, 0);

    public SweepSummary plus(SweepSummary other) {
        return new SweepSummary(
            attempted + other.attempted,
            rolledBack + other.rolledBack,
            failed + other.failed,
            escalated + other.escalated,
            expiredApprovals + other.expiredApprovals,
            interrupted + other.interrupted
        );
    }

    public boolean isIdle() {
        return equals(EMPTY);
    }
}
