package com.example.gdprpdp.models;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

class PolicyTest {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    private static final String FIXTURE = "/fixtures/policy.json";

    private static ValidatorFactory factory;
    private static Validator validator;

    private static String readFixture(String path) throws IOException {
        try (InputStream in = PolicyTest.class.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Missing test fixture: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @BeforeAll
    static void initValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        if (factory != null) {
            factory.close();
        }
    }

    @Test
    @DisplayName("fixture deserializes with snake_case names and survives a JSON round trip")
    void fixtureAndJsonRoundTrip() throws IOException {
        Policy policy = MAPPER.readValue(readFixture(FIXTURE), Policy.class);

        assertEquals("P1", policy.getPolicyId());
        assertEquals(ObligationCombining.UNION, policy.getObligationCombining());
        assertEquals(2, policy.getRules().size());
        Rule permit = policy.getRules().get(0);
        assertEquals("service-improvement", permit.getPurpose());
        assertEquals(Effect.PERMIT, permit.getEffect());
        assertEquals("P30D", permit.getRetentionPeriod());
        assertEquals(Effect.DENY, policy.getRules().get(1).getEffect());
        assertEquals("2024-01-01T00:00:00Z", policy.getRules().get(1).getValidFrom());
        assertEquals(3L, policy.getVersion());

        JsonNode node = MAPPER.readTree(MAPPER.writeValueAsString(policy));
        assertEquals("P1", node.get("policy_id").asText());
        assertEquals("Permit", node.get("rules").get(0).get("effect").asText());
        assertEquals("customers", node.get("rules").get(1).get("data_target").asText());
        assertEquals(1727740800000L, node.get("created_at").asLong());
        assertTrue(node.get("rules").get(1).get("retention_period") == null, "nulls are omitted");

        Policy roundTrip = MAPPER.readValue(MAPPER.writeValueAsString(policy), Policy.class);
        assertEquals(policy.getPolicyId(), roundTrip.getPolicyId());
        assertEquals(policy.getRules().get(0).getRuleId(), roundTrip.getRules().get(0).getRuleId());
    }

    @Test
    @DisplayName("validation cascades into rules")
    void validationCascades() {
        Policy invalid = Policy.builder()
                .policyId(" ")
                .rule(Rule.builder().ruleId("R1").role("a").purpose("b").dataTarget("c").build())
                .build();

        Set<String> paths = validator.validate(invalid).stream()
                .map(ConstraintViolation::getPropertyPath)
                .map(Object::toString)
                .collect(Collectors.toSet());

        assertEquals(Set.of("policyId", "rules[0].location", "rules[0].effect"), paths);
    }

    @Test
    @DisplayName("effective combining defaults to UNION and rule() appends without sharing lists")
    void builderDefaults() {
        List<Rule> shared = List.of(Rule.builder().ruleId("R1").build());
        Policy policy = Policy.builder().policyId("P").rules(shared).rule(Rule.builder().ruleId("R2").build()).build();

        assertEquals(ObligationCombining.UNION, policy.effectiveCombining());
        assertEquals(2, policy.getRules().size());
        assertEquals(1, shared.size());
        assertTrue(Policy.builder().policyId("Q").build().rulesOrEmpty().isEmpty());
    }

    @Test
    @DisplayName("DynamoDb annotations set correct attribute names")
    void dynamoAnnotations() throws Exception {
        Method getPolicyId = Policy.class.getMethod("getPolicyId");
        Method getRules = Policy.class.getMethod("getRules");
        Method getCombining = Policy.class.getMethod("getObligationCombining");
        Method getUpdatedAt = Policy.class.getMethod("getUpdatedAt");

        assertNotNull(getPolicyId.getAnnotation(DynamoDbPartitionKey.class));
        assertEquals("policy_id", getPolicyId.getAnnotation(DynamoDbAttribute.class).value());
        assertEquals("rules", getRules.getAnnotation(DynamoDbAttribute.class).value());
        assertEquals(RuleListAttributeConverter.class, getRules.getAnnotation(DynamoDbConvertedBy.class).value());
        assertEquals("obligation_combining", getCombining.getAnnotation(DynamoDbAttribute.class).value());
        assertEquals("updated_at", getUpdatedAt.getAnnotation(DynamoDbAttribute.class).value());
    }

    @Test
    @DisplayName("rules converter stores the list as a JSON string and reads it back")
    void rulesConverter() {
        RuleListAttributeConverter converter = new RuleListAttributeConverter();
        List<Rule> rules = List.of(Rule.builder()
                .ruleId("R1").role("*").purpose("p").dataTarget("t").location("*")
                .effect(Effect.PERMIT).retentionPeriod("P1D").build());

        var stored = converter.transformFrom(rules);
        List<Rule> back = converter.transformTo(stored);

        assertNotNull(stored.s());
        assertTrue(stored.s().contains("\"rule_id\":\"R1\""));
        assertEquals("P1D", back.get(0).getRetentionPeriod());
        assertEquals(Effect.PERMIT, back.get(0).getEffect());
    }
}
