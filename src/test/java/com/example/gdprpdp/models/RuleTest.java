package com.example.gdprpdp.models;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RuleTest {

    private static final Instant NOW = Instant.parse("2024-10-01T12:00:00Z");

    private static Rule rule(String id, String role, String purpose, String target, String location) {
        return Rule.builder()
                .ruleId(id)
                .role(role)
                .purpose(purpose)
                .dataTarget(target)
                .location(location)
                .effect(Effect.PERMIT)
                .build();
    }

    @Test
    @DisplayName("rank counts literal fields first, then breaks ties by field priority")
    void specificityRank() {
        assertEquals(0, rule("a", "*", "*", "*", "*").specificityRank());
        assertEquals(16 | 1, rule("a", "r", "*", "*", "*").specificityRank());
        assertEquals(16 | 8, rule("a", "*", "*", "*", "EU").specificityRank());
        assertEquals(32 | 4 | 2, rule("a", "*", "p", "t", "*").specificityRank());
        assertEquals(64 | 15, rule("a", "r", "p", "t", "EU").specificityRank());

        // two literals always outrank one, whatever the fields
        assertTrue(rule("a", "r", "p", "*", "*").specificityRank()
                > rule("b", "*", "*", "*", "EU").specificityRank());
    }

    @Test
    @DisplayName("BY_SPECIFICITY orders by rank, then by rule id")
    void comparator() {
        List<Rule> rules = new ArrayList<>(List.of(
                rule("z", "r", "*", "*", "*"),
                rule("b", "*", "*", "*", "*"),
                rule("a", "r", "*", "*", "*"),
                rule("c", "*", "*", "t", "*")));

        rules.sort(Rule.BY_SPECIFICITY);

        assertEquals(List.of("c", "a", "z", "b"), rules.stream().map(Rule::getRuleId).toList());
    }

    @Test
    @DisplayName("fields match their literal value or anything when wildcarded")
    void matching() {
        RequestContext ctx = new RequestContext("analyst", "marketing", "customers", "EU", NOW);

        assertTrue(rule("a", "*", "*", "*", "*").matches(ctx));
        assertTrue(rule("a", "analyst", "marketing", "customers", "EU").matches(ctx));
        assertFalse(rule("a", "analyst", "marketing", "customers", "US").matches(ctx));
        assertFalse(rule("a", "Analyst", "*", "*", "*").matches(ctx));
    }

    @Test
    @DisplayName("validity window bounds are inclusive")
    void validityWindow() {
        Rule windowed = rule("a", "*", "*", "*", "*").toBuilder()
                .validFrom("2024-10-01T12:00:00Z")
                .validUntil("2024-10-31T00:00:00Z")
                .build();

        assertTrue(windowed.isValidAt(NOW));
        assertTrue(windowed.isValidAt(Instant.parse("2024-10-31T00:00:00Z")));
        assertFalse(windowed.isValidAt(NOW.minusMillis(1)));
        assertFalse(windowed.isValidAt(Instant.parse("2024-10-31T00:00:00.001Z")));
    }

    @Test
    @DisplayName("retention is imposed by a period unless explicitly switched off")
    void retentionImposing() {
        Rule plain = rule("a", "*", "*", "*", "*");
        Rule withPeriod = plain.toBuilder().retentionPeriod("P30D").build();

        assertFalse(plain.isRetentionImposing());
        assertNull(plain.retentionDuration());
        assertTrue(withPeriod.isRetentionImposing());
        assertEquals(Duration.ofDays(30), withPeriod.retentionDuration());
        assertFalse(withPeriod.toBuilder().retentionBearing(false).build().isRetentionImposing());
    }

    @Test
    @DisplayName("obligation target is the literal target, or the requested one for a wildcard")
    void resolveDataTarget() {
        RequestContext ctx = new RequestContext("analyst", "marketing", "customers", "EU", NOW);

        assertEquals("orders", rule("a", "*", "*", "orders", "*").resolveDataTarget(ctx));
        assertEquals("customers", rule("a", "*", "*", "*", "*").resolveDataTarget(ctx));
    }

    @Test
    @DisplayName("request contexts reject blanks and wildcards")
    void contextValidation() {
        assertThrows(IllegalArgumentException.class, () -> new RequestContext("*", "p", "t", "l", NOW));
        assertThrows(IllegalArgumentException.class, () -> new RequestContext("r", " ", "t", "l", NOW));
        assertThrows(NullPointerException.class, () -> new RequestContext("r", "p", "t", "l", null));
    }

    @Test
    @DisplayName("a Deny decision cannot carry obligations")
    void denyWithoutObligations() {
        List<Obligation> obligations = List.of(new Obligation("t", Duration.ofDays(1), "a"));

        assertThrows(IllegalArgumentException.class,
                () -> new Decision("P", Effect.DENY, "a", obligations, NOW));
        assertTrue(Decision.defaultDeny("P", NOW).isDefaultDeny());
        assertFalse(Decision.deny("P", "a", NOW).isDefaultDeny());
    }
}
