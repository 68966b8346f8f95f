package com.example.gdprpdp.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * HTTP-layer payload captured from client POST /decisions requests. {@code timestamp} is an
 * optional ISO-8601 instant; the server clock is used when it is absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DecisionHttpRequest(
        @JsonProperty("policy_id") @NotBlank String policyId,
        @JsonProperty("role") @NotBlank String role,
        @JsonProperty("purpose") @NotBlank String purpose,
        @JsonProperty("data_target") @NotBlank String dataTarget,
        @JsonProperty("location") @NotBlank String location,
        @JsonProperty("timestamp") String timestamp
) {}
