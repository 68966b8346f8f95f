package com.example.gdprpdp.http;

import com.example.gdprpdp.models.Duty;
import com.example.gdprpdp.service.DecisionOutcome;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record DecisionResponse(
        @JsonProperty("policy_id") String policyId,
        @JsonProperty("effect") String effect,
        @JsonProperty("matched_rule_id") String matchedRuleId,
        @JsonProperty("obligations") List<ObligationResponse> obligations,
        @JsonProperty("evaluated_at") String evaluatedAt,
        @JsonProperty("audit_sequence") Long auditSequence,
        @JsonProperty("duty_ids") List<String> dutyIds
) {

    static DecisionResponse from(DecisionOutcome outcome) {
        return new DecisionResponse(
                outcome.decision().policyId(),
                outcome.decision().effect().label(),
                outcome.decision().matchedRuleId(),
                outcome.decision().obligations().stream().map(ObligationResponse::from).toList(),
                outcome.decision().evaluatedAt().toString(),
                outcome.auditEntry().getSequence(),
                outcome.duties().stream().map(Duty::getDutyId).toList());
    }
}
