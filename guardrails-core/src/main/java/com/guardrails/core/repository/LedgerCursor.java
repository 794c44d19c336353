package com.guardrails.core.repository;

import com.guardrails.core.model.ActionExecution;

import java.time.Instant;
import java.util.UUID;

/**
 * Keyset position for paging through a sweep query ordered by (position, executionId).
 * Each page starts strictly after the cursor, so a page never returns a row already handed out.
 *
 * @param position    the ordering timestamp of the last row returned
 * @param executionId the id of the last row returned
 */
public record LedgerCursor(Instant position, UUID executionId) {

    public static LedgerCursor after(ActionExecution execution, Instant position) {
        return new LedgerCursor(position, execution.executionId());
    }

    /**
     * Whether a row at (position, executionId) sorts after this cursor.
     */
    public boolean precedes(Instant rowPosition, UUID rowId) {
        int byPosition = rowPosition.compareTo(position);
        return byPosition > 0 || (byPosition == 0 && rowId.compareTo(executionId) > 0);
    }
}
