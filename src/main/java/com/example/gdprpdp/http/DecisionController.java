package com.example.gdprpdp.http;

import com.example.gdprpdp.models.RequestContext;
import com.example.gdprpdp.requests.DecisionHttpRequest;
import com.example.gdprpdp.requests.DecisionServiceRequest;
import com.example.gdprpdp.service.DecisionOutcome;
import com.example.gdprpdp.service.DecisionService;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for access decisions. Converts the HTTP payload into a request context, stamping
 * it with the server clock when the client sent no timestamp, and returns the recorded decision.
 */
@RestController
public class DecisionController {

    private final DecisionService decisionService;
    private final Clock clock;

    public DecisionController(DecisionService decisionService, Clock clock) {
        this.decisionService = decisionService;
        this.clock = clock;
    }

    @PostMapping("/decisions")
    public ResponseEntity<DecisionResponse> decide(@Valid @RequestBody DecisionHttpRequest request) {
        RequestContext context = new RequestContext(
                request.role(),
                request.purpose(),
                request.dataTarget(),
                request.location(),
                resolveTimestamp(request.timestamp()));

        DecisionOutcome outcome = decisionService.decide(new DecisionServiceRequest(
                request.policyId(), context, RequestIdFilter.currentRequestId()));

        return ResponseEntity.ok(DecisionResponse.from(outcome));
    }

    private Instant resolveTimestamp(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return clock.instant();
        }
        try {
            return Instant.parse(timestamp);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("timestamp must be an ISO-8601 instant: " + timestamp, e);
        }
    }
}
