package com.example.gdprpdp.models;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of evaluating one request against one policy. {@code matchedRuleId} is null when the
 * decision is the fail-closed default.
 */
public record Decision(
        String policyId,
        Effect effect,
        String matchedRuleId,
        List<Obligation> obligations,
        Instant evaluatedAt
) {

    public Decision {
        Objects.requireNonNull(policyId, "policyId");
        Objects.requireNonNull(effect, "effect");
        Objects.requireNonNull(evaluatedAt, "evaluatedAt");
        obligations = obligations == null ? List.of() : List.copyOf(obligations);
        if (effect == Effect.DENY && !obligations.isEmpty()) {
            throw new IllegalArgumentException("a Deny decision carries no obligations");
        }
    }

    public static Decision permit(String policyId, String ruleId, List<Obligation> obligations, Instant at) {
        return new Decision(policyId, Effect.PERMIT, ruleId, obligations, at);
    }

    public static Decision deny(String policyId, String ruleId, Instant at) {
        return new Decision(policyId, Effect.DENY, ruleId, List.of(), at);
    }

    public static Decision defaultDeny(String policyId, Instant at) {
        return new Decision(policyId, Effect.DENY, null, List.of(), at);
    }

    public boolean isPermit() {
        return effect == Effect.PERMIT;
    }

    public boolean isDefaultDeny() {
        return effect == Effect.DENY && matchedRuleId == null;
    }
}
