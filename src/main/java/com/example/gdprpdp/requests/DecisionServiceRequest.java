package com.example.gdprpdp.requests;

import com.example.gdprpdp.models.RequestContext;
import java.util.Objects;
import java.util.UUID;

/**
 * Service-layer command built from {@link DecisionHttpRequest} plus server-side context: the
 * resolved evaluation timestamp and the request id that ties the audit entry to the HTTP call.
 */
public record DecisionServiceRequest(
        String policyId,
        RequestContext context,
        String requestId
) {

    public DecisionServiceRequest(String policyId, RequestContext context) {
        this(policyId, context, null);
    }

    public DecisionServiceRequest {
        Objects.requireNonNull(policyId, "policyId");
        if (policyId.isBlank()) {
            throw new IllegalArgumentException("policyId must be non-blank");
        }

        Objects.requireNonNull(context, "context");

        requestId = (requestId == null || requestId.isBlank()) ? UUID.randomUUID().toString() : requestId;
    }
}
