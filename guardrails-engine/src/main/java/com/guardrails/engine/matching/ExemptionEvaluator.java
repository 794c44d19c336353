package com.guardrails.engine.matching;

import com.guardrails.core.model.CostEvent;
import com.guardrails.core.model.ExemptionWindow;
import com.guardrails.core.model.Exemptions;
import com.guardrails.core.model.GuardrailPolicy;
import com.guardrails.core.model.TargetPrincipal;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether an otherwise matching policy is suppressed for an event.
 * Pure: the evaluation instant is an argument, never read from a clock.
 */
public class ExemptionEvaluator {

    /**
     * @return the first exemption that applies, described for logging; empty if none
     */
    public Optional<String> exemption(GuardrailPolicy policy, CostEvent event, Instant evaluatedAt) {
        Exemptions exemptions = policy.exemptions();
        if (exemptions.isEmpty()) {
            return Optional.empty();
        }

        if (exemptions.accounts().contains(event.accountId())) {
            return Optional.of("account " + event.accountId() + " is allowlisted");
        }

        if (!exemptions.principals().isEmpty()) {
            Optional<String> principal = event.detail(CostEvent.DETAIL_PRINCIPAL_ARN);
            if (principal.isPresent() && PrincipalPatterns.matchesAny(exemptions.principals(), principal.get())) {
                return Optional.of("principal " + principal.get() + " is allowlisted");
            }
            List<TargetPrincipal> targets = policy.targets();
            if (!targets.isEmpty() && targets.stream()
                    .allMatch(t -> PrincipalPatterns.matchesAny(exemptions.principals(), t.arn()))) {
                return Optional.of("every scope principal is allowlisted");
            }
        }

        for (ExemptionWindow window : exemptions.timeWindows()) {
            if (isWithin(window, evaluatedAt)) {
                return Optional.of("inside exemption window " + window.start() + "-" + window.end()
                    + " " + window.timezone());
            }
        }
        return Optional.empty();
    }

    public boolean isExempt(GuardrailPolicy policy, CostEvent event, Instant evaluatedAt) {
        return exemption(policy, event, evaluatedAt).isPresent();
    }

    /**
     * Whether an instant falls inside a window, in the window's own zone, bounds inclusive to the minute.
     * For a window spanning midnight the part after midnight belongs to the previous day's entry.
     */
    public static boolean isWithin(ExemptionWindow window, Instant instant) {
        ZonedDateTime local = instant.atZone(window.zone());
        LocalTime time = local.toLocalTime().truncatedTo(ChronoUnit.MINUTES);
        DayOfWeek today = local.getDayOfWeek();
        Set<DayOfWeek> days = window.daysOfWeek();
        LocalTime start = window.startTime();
        LocalTime end = window.endTime();

        if (!window.spansMidnight()) {
            return days.contains(today) && !time.isBefore(start) && !time.isAfter(end);
        }
        boolean lateToday = days.contains(today) && !time.isBefore(start);
        boolean earlyFromYesterday = days.contains(today.minus(1)) && !time.isAfter(end);
        return lateToday || earlyFromYesterday;
    }
}
