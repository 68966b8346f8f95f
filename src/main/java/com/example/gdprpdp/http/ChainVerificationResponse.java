package com.example.gdprpdp.http;

import com.example.gdprpdp.models.ChainVerification;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ChainVerificationResponse(
        @JsonProperty("valid") boolean valid,
        @JsonProperty("first_bad_index") Long firstBadIndex,
        @JsonProperty("entries_checked") long entriesChecked
) {

    static ChainVerificationResponse from(ChainVerification result) {
        return new ChainVerificationResponse(result.valid(), result.firstBadIndex(), result.entriesChecked());
    }
}
