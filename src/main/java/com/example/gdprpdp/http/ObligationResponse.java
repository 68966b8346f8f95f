package com.example.gdprpdp.http;

import com.example.gdprpdp.models.Obligation;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ObligationResponse(
        @JsonProperty("data_target") String dataTarget,
        @JsonProperty("retention_period") String retentionPeriod,
        @JsonProperty("rule_id") String ruleId
) {

    static ObligationResponse from(Obligation obligation) {
        return new ObligationResponse(
                obligation.dataTarget(),
                obligation.retentionPeriod().toString(),
                obligation.ruleId());
    }
}
