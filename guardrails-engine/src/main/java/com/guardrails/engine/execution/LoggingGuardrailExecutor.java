package com.guardrails.engine.execution;

import com.guardrails.core.model.ActionType;
import com.guardrails.core.model.GuardrailAction;
import com.guardrails.core.model.StateDiff;
import com.guardrails.core.model.TargetPrincipal;
import com.guardrails.core.spi.GuardrailExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Executor that records deny statements in memory and logs what a real backend would do.
 * Wired when no identity backend is configured so the service runs without cloud credentials.
 */
public class LoggingGuardrailExecutor implements GuardrailExecutor {

    private static final Logger log = LoggerFactory.getLogger(LoggingGuardrailExecutor.class);

    public static final String POLICY_NAME = "cost-guardrail";

    private final Map<String, Set<String>> denies = new ConcurrentHashMap<>();

    @Override
    public StateDiff apply(TargetPrincipal target, GuardrailAction action) {
        if (action.type() == ActionType.NOTIFY_ONLY) {
            log.info("Notify-only action for {}, nothing to apply", target.arn());
            return new StateDiff(ActionType.NOTIFY_ONLY, target.arn(), null, List.of(), List.of(), Map.of());
        }

        List<String> before = new ArrayList<>();
        List<String> after = new ArrayList<>();
        denies.compute(target.arn(), (arn, current) -> {
            Set<String> next = current == null ? new LinkedHashSet<>() : new LinkedHashSet<>(current);
            before.addAll(next);
            next.addAll(action.deny());
            after.addAll(next);
            return next;
        });

        log.info("Would attach inline policy {} to {} denying {}", POLICY_NAME, target.arn(), action.deny());
        return new StateDiff(
            ActionType.ATTACH_DENY_POLICY,
            target.arn(),
            POLICY_NAME,
            before,
            after,
            Map.of("principal_name", target.name())
        );
    }

    @Override
    public boolean revert(TargetPrincipal target, StateDiff diff) {
        if (diff.actionType() == ActionType.NOTIFY_ONLY) {
            return true;
        }
        if (diff.before().isEmpty()) {
            denies.remove(target.arn());
        } else {
            denies.put(target.arn(), new LinkedHashSet<>(diff.before()));
        }
        log.info("Would restore inline policy {} on {} to {}", POLICY_NAME, target.arn(), diff.before());
        return true;
    }

    public Set<String> deniesOn(String arn) {
        return Set.copyOf(denies.getOrDefault(arn, Set.of()));
    }
}
