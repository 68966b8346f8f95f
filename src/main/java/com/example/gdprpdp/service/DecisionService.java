package com.example.gdprpdp.service;

import com.example.gdprpdp.models.AuditEntry;
import com.example.gdprpdp.models.Decision;
import com.example.gdprpdp.models.Duty;
import com.example.gdprpdp.models.Policy;
import com.example.gdprpdp.models.RequestContext;
import com.example.gdprpdp.requests.DecisionServiceRequest;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Handles one decision request end to end: resolve the policy, evaluate, then record the decision
 * in the audit chain together with the duties its obligations create. An unknown policy fails
 * before anything is written.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DecisionService {

    private final PolicyStoreService policyStore;
    private final PolicyEvaluator evaluator;
    private final AuditLogService auditLogService;
    private final DutyScheduler dutyScheduler;

    public DecisionOutcome decide(DecisionServiceRequest request) {
        Objects.requireNonNull(request, "request");

        Policy policy = policyStore.get(request.policyId());
        Decision decision = evaluator.evaluate(policy, request.context());
        List<Duty> planned = dutyScheduler.plan(decision);
        AuditEntry entry = auditLogService.recordDecision(
                request.context(), decision, request.requestId(), planned);
        List<Duty> duties = planned.stream()
                .map(duty -> duty.withDecisionSequence(entry.getSequence()))
                .collect(Collectors.toList());
        duties.forEach(dutyScheduler::logCreated);

        log.info("decision policy={} effect={} rule={} seq={} duties={}",
                decision.policyId(), decision.effect().label(), decision.matchedRuleId(),
                entry.getSequence(), duties.size());
        return new DecisionOutcome(decision, entry, duties);
    }

    /**
     * Evaluates without recording anything. Used for dry runs; never creates duties.
     */
    public Decision evaluate(String policyId, RequestContext context) {
        return evaluator.evaluate(policyStore.get(policyId), context);
    }
}
