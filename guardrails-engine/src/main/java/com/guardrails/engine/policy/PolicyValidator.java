package com.guardrails.engine.policy;

import com.guardrails.core.exception.PolicyValidationException;
import com.guardrails.core.model.ActionType;
import com.guardrails.core.model.ExemptionWindow;
import com.guardrails.core.model.GuardrailAction;
import com.guardrails.core.model.GuardrailPolicy;
import com.guardrails.core.model.MatchCriteria;
import com.guardrails.core.model.TargetPrincipal;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validates a single guardrail policy. Every violation is collected; nothing is coerced.
 */
public class PolicyValidator {

    public static final String ARN_PREFIX = "arn:aws:iam::";

    private static final Pattern HH_MM = Pattern.compile("^([01]\\d|2[0-3]):[0-5]\\d$");

    /**
     * Validate and throw if any rule is broken.
     *
     * @throws PolicyValidationException listing all violations
     */
    public void validate(GuardrailPolicy policy) {
        List<String> violations = violations(policy);
        if (!violations.isEmpty()) {
            throw new PolicyValidationException(policy.policyId(), violations);
        }
    }

    public List<String> violations(GuardrailPolicy policy) {
        List<String> violations = new ArrayList<>();

        if (policy.policyId() == null || policy.policyId().isBlank()) {
            violations.add("policy_id is required");
        }
        if (policy.mode() == null) {
            violations.add("mode is required");
        }
        if (policy.ttlMinutes() == null) {
            violations.add("ttl_minutes is required");
        } else if (policy.ttlMinutes() < 0) {
            violations.add("ttl_minutes must be >= 0, got " + policy.ttlMinutes());
        }

        validateMatch(policy.match(), violations);
        validateScope(policy.targets(), violations);
        validateActions(policy.actions(), violations);

        if (policy.notification() == null || policy.notification().destination() == null
                || policy.notification().destination().isBlank()) {
            violations.add("notify.destination is required");
        }

        for (ExemptionWindow window : policy.exemptions().timeWindows()) {
            validateWindow(window, violations);
        }
        for (String principal : policy.exemptions().principals()) {
            if (principal == null || principal.isBlank() || principal.equals("*")) {
                violations.add("exception principal must be an ARN or an ARN prefix ending in *: " + principal);
            } else if (principal.indexOf('*') >= 0 && principal.indexOf('*') != principal.length() - 1) {
                violations.add("exception principal may only use * as a suffix: " + principal);
            }
        }
        return violations;
    }

    private void validateMatch(MatchCriteria match, List<String> violations) {
        if (match == null) {
            violations.add("match is required");
            return;
        }
        if (match.sources().isEmpty()) {
            violations.add("match.source must list at least one source");
        }
        if (match.accountIds().isEmpty()) {
            violations.add("match.account_ids must list at least one account");
        }
        BigDecimal min = match.minAmount();
        BigDecimal max = match.maxAmount();
        if (min != null && min.signum() < 0) {
            violations.add("match.min_amount_usd must be >= 0");
        }
        if (max != null && max.signum() <= 0) {
            violations.add("match.max_amount_usd must be > 0");
        }
        if (min != null && max != null && max.compareTo(min) <= 0) {
            violations.add("match.max_amount_usd (" + max + ") must exceed min_amount_usd (" + min + ")");
        }
    }

    private void validateScope(List<TargetPrincipal> principals, List<String> violations) {
        if (principals.isEmpty()) {
            violations.add("scope.principals must not be empty");
            return;
        }
        for (TargetPrincipal principal : principals) {
            String arn = principal.arn();
            if (principal.type() == null) {
                violations.add("scope principal type is required: " + arn);
            }
            if (arn == null || arn.isBlank()) {
                violations.add("scope principal arn is required");
                continue;
            }
            if (arn.contains("*")) {
                violations.add("wildcard principal ARNs are not allowed: " + arn);
            }
            if (!arn.startsWith(ARN_PREFIX)) {
                violations.add("principal ARN must start with " + ARN_PREFIX + ": " + arn);
            } else if (principal.type() != null) {
                String resource = arn.substring(arn.indexOf(':', ARN_PREFIX.length()) + 1);
                if (!resource.startsWith(principal.type().resourcePrefix())) {
                    violations.add("principal ARN does not name a " + principal.type().wireName() + ": " + arn);
                }
            }
        }
    }

    private void validateActions(List<GuardrailAction> actions, List<String> violations) {
        if (actions.isEmpty()) {
            violations.add("actions must not be empty");
            return;
        }
        for (GuardrailAction action : actions) {
            if (action.type() == null) {
                violations.add("action type is required");
                continue;
            }
            if (action.type() == ActionType.ATTACH_DENY_POLICY && action.deny().isEmpty()) {
                violations.add("attach_deny_policy requires a non-empty deny list");
            }
            for (String deny : action.deny()) {
                if (!DenyActionRules.isWellFormed(deny) && !"*".equals(deny)) {
                    violations.add("deny entry must look like service:Operation: " + deny);
                } else if (DenyActionRules.isDeletionClass(deny)) {
                    violations.add("deletion-class operation is not allowed in deny list: " + deny);
                }
            }
        }
    }

    private void validateWindow(ExemptionWindow window, List<String> violations) {
        if (window.start() == null || !HH_MM.matcher(window.start()).matches()) {
            violations.add("time window start must be HH:MM: " + window.start());
        }
        if (window.end() == null || !HH_MM.matcher(window.end()).matches()) {
            violations.add("time window end must be HH:MM: " + window.end());
        }
        if (window.timezone() == null) {
            violations.add("time window timezone is required");
        } else {
            try {
                ZoneId.of(window.timezone());
            } catch (DateTimeException e) {
                violations.add("unknown time window timezone: " + window.timezone());
            }
        }
        if (window.days().isEmpty()) {
            violations.add("time window must list at least one day");
        }
        for (String day : window.days()) {
            try {
                ExemptionWindow.parseDay(day);
            } catch (IllegalArgumentException | DateTimeParseException e) {
                violations.add("invalid day in time window: " + day);
            }
        }
    }
}
