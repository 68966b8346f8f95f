package com.example.gdprpdp.service;

import com.example.gdprpdp.models.Effect;
import com.example.gdprpdp.models.Policy;
import com.example.gdprpdp.models.Rule;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Checks policy definitions before they reach storage. Field-level constraints come from the
 * bean-validation annotations on {@link Policy} and {@link Rule}; the rest are cross-field rules
 * that annotations cannot express.
 */
@Component
public class PolicyValidator {

    private final Validator validator;

    public PolicyValidator(Validator validator) {
        this.validator = validator;
    }

    /**
     * Validates a whole batch and throws once with every violation found, so nothing in the batch is
     * applied when any definition is bad.
     */
    public void validateAll(Collection<Policy> policies) {
        List<String> violations = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        int index = 0;
        for (Policy policy : policies) {
            String label = policy == null || policy.getPolicyId() == null
                    ? "policies[" + index + "]"
                    : policy.getPolicyId();
            if (policy == null) {
                violations.add(label + ": definition is null");
            } else {
                violations.addAll(check(policy, label));
                if (policy.getPolicyId() != null && !seenIds.add(policy.getPolicyId())) {
                    violations.add(label + ": duplicate policy_id in batch");
                }
            }
            index++;
        }
        if (!violations.isEmpty()) {
            throw PdpException.schemaInvalid(violations);
        }
    }

    public void validate(Policy policy) {
        validateAll(List.of(policy));
    }

    private List<String> check(Policy policy, String label) {
        List<String> violations = new ArrayList<>();
        validator.validate(policy).stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(v -> label + ": " + describe(v))
                .forEach(violations::add);

        Set<String> ruleIds = new HashSet<>();
        List<Rule> rules = policy.rulesOrEmpty();
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            String ruleLabel = label + ": rules[" + i + "]";
            if (rule == null) {
                violations.add(ruleLabel + " is null");
                continue;
            }
            if (rule.getRuleId() != null && !ruleIds.add(rule.getRuleId())) {
                violations.add(ruleLabel + " duplicate rule_id " + rule.getRuleId());
            }
            checkRetention(rule, ruleLabel, violations);
            checkValidity(rule, ruleLabel, violations);
        }
        return violations;
    }

    private static void checkRetention(Rule rule, String ruleLabel, List<String> violations) {
        boolean hasPeriod = rule.getRetentionPeriod() != null && !rule.getRetentionPeriod().isBlank();
        if (Boolean.FALSE.equals(rule.getRetentionBearing()) && hasPeriod) {
            violations.add(ruleLabel + " declares retention_period but retention_bearing is false");
            return;
        }
        if (!rule.isRetentionImposing()) {
            return;
        }
        if (rule.getEffect() != Effect.PERMIT) {
            violations.add(ruleLabel + " is retention-bearing but its effect is not Permit");
        }
        if (!hasPeriod) {
            violations.add(ruleLabel + " is retention-bearing but has no retention_period");
            return;
        }
        try {
            Duration period = Duration.parse(rule.getRetentionPeriod());
            if (period.isZero() || period.isNegative()) {
                violations.add(ruleLabel + " retention_period must be positive");
            }
        } catch (DateTimeParseException e) {
            violations.add(ruleLabel + " retention_period is not an ISO-8601 duration: " + rule.getRetentionPeriod());
        }
    }

    private static void checkValidity(Rule rule, String ruleLabel, List<String> violations) {
        Instant from = parseInstant(rule.getValidFrom(), ruleLabel + " valid_from", violations);
        Instant until = parseInstant(rule.getValidUntil(), ruleLabel + " valid_until", violations);
        if (from != null && until != null && from.isAfter(until)) {
            violations.add(ruleLabel + " valid_from is after valid_until");
        }
    }

    private static Instant parseInstant(String value, String field, List<String> violations) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            violations.add(field + " is not an ISO-8601 instant: " + value);
            return null;
        }
    }

    private static String describe(ConstraintViolation<Policy> violation) {
        return violation.getPropertyPath() + " " + violation.getMessage();
    }
}
