package com.example.gdprpdp.service;

import com.example.gdprpdp.models.Decision;
import com.example.gdprpdp.models.Effect;
import com.example.gdprpdp.models.Obligation;
import com.example.gdprpdp.models.ObligationCombining;
import com.example.gdprpdp.models.Policy;
import com.example.gdprpdp.models.RequestContext;
import com.example.gdprpdp.models.Rule;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Turns a policy and a request context into a {@link Decision}.
 *
 * <p>Matching rules are grouped by specificity rank and only the most specific tier decides: a Deny
 * anywhere in that tier wins, otherwise the tier permits and its retention-bearing rules contribute
 * obligations. Nothing matching means Deny. Evaluation reads no clock and touches no storage, so the
 * same inputs always give the same decision.
 */
@Component
public class PolicyEvaluator {

    public Decision evaluate(Policy policy, RequestContext context) {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(context, "context");

        List<Rule> candidates = policy.rulesOrEmpty().stream()
                .filter(rule -> rule.matches(context))
                .sorted(Rule.BY_SPECIFICITY)
                .collect(Collectors.toList());

        if (candidates.isEmpty()) {
            return Decision.defaultDeny(policy.getPolicyId(), context.timestamp());
        }

        int topRank = candidates.get(0).specificityRank();
        List<Rule> topTier = candidates.stream()
                .filter(rule -> rule.specificityRank() == topRank)
                .collect(Collectors.toList());

        for (Rule rule : topTier) {
            if (rule.getEffect() == Effect.DENY) {
                return Decision.deny(policy.getPolicyId(), rule.getRuleId(), context.timestamp());
            }
        }

        List<Obligation> obligations = new ArrayList<>();
        for (Rule rule : topTier) {
            if (rule.isRetentionImposing()) {
                obligations.add(new Obligation(rule.resolveDataTarget(context), rule.retentionDuration(), rule.getRuleId()));
            }
        }

        return Decision.permit(
                policy.getPolicyId(),
                topTier.get(0).getRuleId(),
                combine(obligations, policy.effectiveCombining()),
                context.timestamp());
    }

    static List<Obligation> combine(List<Obligation> obligations, ObligationCombining combining) {
        Map<String, Obligation> kept = new LinkedHashMap<>();
        for (Obligation obligation : obligations) {
            if (combining == ObligationCombining.MOST_RESTRICTIVE) {
                kept.merge(obligation.dataTarget(), obligation, PolicyEvaluator::shorter);
            } else {
                kept.putIfAbsent(obligation.dataTarget() + "|" + obligation.retentionPeriod(), obligation);
            }
        }
        return List.copyOf(kept.values());
    }

    private static Obligation shorter(Obligation a, Obligation b) {
        Duration pa = a.retentionPeriod();
        Duration pb = b.retentionPeriod();
        return pb.compareTo(pa) < 0 ? b : a;
    }
}
