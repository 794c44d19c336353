package com.guardrails.core.spi;

import com.guardrails.core.model.GuardrailAction;
import com.guardrails.core.model.StateDiff;
import com.guardrails.core.model.TargetPrincipal;

/**
 * Performs the concrete identity-backend operations.
 * Both methods must be safe to call more than once with the same arguments.
 */
public interface GuardrailExecutor {

    /**
     * Apply one action to a target.
     *
     * @return The prior and posterior state of the target
     * @throws RuntimeException if the backend rejects or fails the call
     */
    StateDiff apply(TargetPrincipal target, GuardrailAction action);

    /**
     * Restore a target to the {@code before} state of a stored diff.
     *
     * @return true if the target is back in its prior state
     */
    boolean revert(TargetPrincipal target, StateDiff diff);
}
