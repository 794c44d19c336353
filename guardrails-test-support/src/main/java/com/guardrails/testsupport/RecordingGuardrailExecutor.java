package com.guardrails.testsupport;

import com.guardrails.core.model.ActionType;
import com.guardrails.core.model.GuardrailAction;
import com.guardrails.core.model.StateDiff;
import com.guardrails.core.model.TargetPrincipal;
import com.guardrails.core.spi.GuardrailExecutor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory executor that tracks the deny set attached to each principal
 * and records every apply and revert call.
 */
public class RecordingGuardrailExecutor implements GuardrailExecutor {

    private final Map<String, List<String>> denies = new ConcurrentHashMap<>();
    private final List<String> applyCalls = new CopyOnWriteArrayList<>();
    private final List<String> revertCalls = new CopyOnWriteArrayList<>();
    private final Set<String> failingTargets = ConcurrentHashMap.newKeySet();
    private final Set<String> failingReverts = ConcurrentHashMap.newKeySet();
    private volatile Runnable beforeRevert = () -> { };
    private final FailureInjector applyFailures = FailureInjector.neverFail();
    private final FailureInjector revertFailures = FailureInjector.neverFail();

    @Override
    public StateDiff apply(TargetPrincipal target, GuardrailAction action) {
        applyCalls.add(target.arn());
        if (failingTargets.contains(target.arn())) {
            throw new IllegalStateException("AccessDenied: cannot modify " + target.arn());
        }
        applyFailures.maybeThrow(() -> new IllegalStateException("Throttling: rate exceeded"));

        List<String> before = List.copyOf(denies.getOrDefault(target.arn(), List.of()));
        List<String> after = new ArrayList<>(before);
        for (String deny : action.deny()) {
            if (!after.contains(deny)) {
                after.add(deny);
            }
        }
        denies.put(target.arn(), List.copyOf(after));
        return new StateDiff(ActionType.ATTACH_DENY_POLICY, target.arn(), "cost-guardrail",
            before, after, Map.of("principal_name", target.name()));
    }

    @Override
    public boolean revert(TargetPrincipal target, StateDiff diff) {
        revertCalls.add(target.arn());
        beforeRevert.run();
        if (failingReverts.contains(target.arn())) {
            throw new IllegalStateException("AccessDenied: cannot restore " + target.arn());
        }
        revertFailures.maybeThrow(() -> new IllegalStateException("ServiceUnavailable"));
        if (diff.before().isEmpty()) {
            denies.remove(target.arn());
        } else {
            denies.put(target.arn(), diff.before());
        }
        return true;
    }

    public List<String> deniesOn(String arn) {
        return denies.getOrDefault(arn, List.of());
    }

    public List<String> applyCalls() {
        return Collections.unmodifiableList(applyCalls);
    }

    public List<String> revertCalls() {
        return Collections.unmodifiableList(revertCalls);
    }

    /**
     * Make every apply on this target fail.
     */
    public void failApplyOn(String arn) {
        failingTargets.add(arn);
    }

    /**
     * Make every revert on this target fail.
     */
    public void failRevertOn(String arn) {
        failingReverts.add(arn);
    }

    /**
     * Run a hook inside every revert call, before it takes effect.
     */
    public void beforeEachRevert(Runnable hook) {
        this.beforeRevert = hook;
    }

    public FailureInjector applyFailures() {
        return applyFailures;
    }

    public FailureInjector revertFailures() {
        return revertFailures;
    }
}
