package com.example.gdprpdp.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.gdprpdp.config.AuditLogProperties;
import com.example.gdprpdp.config.DutySchedulerProperties;
import com.example.gdprpdp.models.AuditEntry;
import com.example.gdprpdp.models.Duty;
import com.example.gdprpdp.models.Effect;
import com.example.gdprpdp.models.RequestContext;
import com.example.gdprpdp.requests.DecisionServiceRequest;
import jakarta.validation.Validation;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DecisionServiceTest {

    private static final Instant NOW = Instant.parse("2024-10-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private InMemoryDutyAccess dutyAccess;
    private InMemoryAuditEntryAccess auditAccess;
    private AuditLogService auditLogService;
    private DecisionService decisionService;

    @BeforeEach
    void setUp() {
        InMemoryPolicyAccess policyAccess = new InMemoryPolicyAccess();
        PolicyStoreService store = new PolicyStoreService(policyAccess,
                new PolicyValidator(Validation.buildDefaultValidatorFactory().getValidator()), CLOCK);
        store.create(PolicyEvaluatorTest.p1());

        dutyAccess = new InMemoryDutyAccess();
        auditAccess = new InMemoryAuditEntryAccess(dutyAccess);
        auditLogService = new AuditLogService(auditAccess, new AuditLogProperties(), CLOCK);
        DutyScheduler scheduler = new DutyScheduler(dutyAccess, auditLogService,
                target -> { }, new DutySchedulerProperties(), CLOCK);
        decisionService = new DecisionService(store, new PolicyEvaluator(), auditLogService, scheduler);
    }

    @Test
    @DisplayName("a Deny is recorded in the audit log and creates no duty")
    void denyRecorded() {
        DecisionOutcome outcome = decisionService.decide(request("marketing", "req-1"));

        assertEquals(Effect.DENY, outcome.decision().effect());
        assertEquals(0L, outcome.auditEntry().getSequence());
        assertTrue(outcome.duties().isEmpty());
        assertTrue(outcome.auditEntry().getPayload().contains("\"request_id\":\"req-1\""));
        assertTrue(dutyAccess.findAll().isEmpty());
    }

    @Test
    @DisplayName("a Permit with retention creates a duty pointing at its decision entry")
    void permitCreatesDuty() {
        decisionService.decide(request("marketing", "req-1"));

        DecisionOutcome outcome = decisionService.decide(request("service-improvement", "req-2"));

        assertEquals(Effect.PERMIT, outcome.decision().effect());
        assertEquals(1L, outcome.auditEntry().getSequence());
        assertEquals(1, outcome.duties().size());
        Duty duty = outcome.duties().get(0);
        assertEquals(1L, duty.getDecisionSequence());
        assertEquals(NOW.plus(Duration.ofDays(30)).toEpochMilli(), duty.getExpiresAt());
        assertEquals(List.of(AuditEntry.Kind.DECISION, AuditEntry.Kind.DECISION),
                auditAccess.all("main").stream().map(AuditEntry::getKind).toList());
    }

    @Test
    @DisplayName("the stored duty carries the sequence of its decision entry")
    void storedDutyLinkedToDecision() {
        DecisionOutcome outcome = decisionService.decide(request("service-improvement", "req-1"));

        Duty stored = dutyAccess.get(outcome.duties().get(0).getDutyId());
        assertEquals(0L, stored.getDecisionSequence());
        assertEquals(Duty.Status.PENDING, stored.getStatus());
    }

    @Test
    @DisplayName("when the duty cannot be stored the Permit is not recorded, and a retry records both")
    void permitNeverRecordedWithoutDuty() {
        dutyAccess.failSaves(true);

        assertThrows(IllegalStateException.class,
                () -> decisionService.decide(request("service-improvement", "req-1")));

        assertTrue(auditAccess.all("main").isEmpty());
        assertTrue(dutyAccess.findAll().isEmpty());

        dutyAccess.failSaves(false);
        DecisionOutcome outcome = decisionService.decide(request("service-improvement", "req-2"));

        assertEquals(0L, outcome.auditEntry().getSequence());
        assertEquals(1, dutyAccess.findAll().size());
        assertTrue(auditLogService.verify().valid());
    }

    @Test
    @DisplayName("an unknown policy fails before the audit log is touched")
    void unknownPolicy() {
        RequestContext context = new RequestContext("analyst", "marketing", "customers", "EU", NOW);

        PdpException ex = assertThrows(PdpException.class,
                () -> decisionService.decide(new DecisionServiceRequest("nope", context)));

        assertEquals(PdpException.Code.POLICY_NOT_FOUND, ex.getCode());
        assertTrue(auditAccess.all("main").isEmpty());
    }

    @Test
    @DisplayName("evaluate is a dry run that records nothing")
    void evaluateDryRun() {
        RequestContext context = new RequestContext("analyst", "service-improvement", "customers", "EU", NOW);

        assertTrue(decisionService.evaluate("P1", context).isPermit());
        assertTrue(auditAccess.all("main").isEmpty());
        assertTrue(dutyAccess.findAll().isEmpty());
    }

    private static DecisionServiceRequest request(String purpose, String requestId) {
        return new DecisionServiceRequest("P1",
                new RequestContext("analyst", purpose, "customers", "EU", NOW), requestId);
    }
}
