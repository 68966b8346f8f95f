package com.example.gdprpdp.requests;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DecisionHttpRequestTest {

    private static Validator validator;
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static String fixture;

    @BeforeAll
    static void setUpValidator() throws IOException {
        try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
            validator = factory.getValidator();
        }
        fixture = loadFixture();
    }

    @Test
    @DisplayName("fixture deserializes from snake_case and passes bean validation")
    void validRequest() throws Exception {
        DecisionHttpRequest request = MAPPER.readValue(fixture, DecisionHttpRequest.class);

        assertEquals("P1", request.policyId());
        assertEquals("usage-logs", request.dataTarget());
        assertEquals("2024-10-01T12:00:00Z", request.timestamp());
        assertTrue(validator.validate(request).isEmpty(), "Expected no validation errors for valid payload");
    }

    @Test
    @DisplayName("blank attributes fail bean validation, a missing timestamp does not")
    void blankFieldsFailValidation() {
        DecisionHttpRequest request = new DecisionHttpRequest("P1", " ", "service-improvement", "", "EU", null);

        Set<ConstraintViolation<DecisionHttpRequest>> violations = validator.validate(request);
        Set<String> fields = violations.stream()
                .map(v -> v.getPropertyPath().toString())
                .collect(Collectors.toSet());

        assertEquals(Set.of("role", "dataTarget"), fields);
    }

    @Test
    @DisplayName("JSON serialization uses snake_case names and omits absent timestamp")
    void jsonSerializationUsesExpectedFields() throws Exception {
        DecisionHttpRequest request = new DecisionHttpRequest("P1", "analyst", "marketing", "customers", "EU", null);

        JsonNode node = MAPPER.readTree(MAPPER.writeValueAsString(request));

        assertEquals("P1", node.get("policy_id").asText());
        assertEquals("customers", node.get("data_target").asText());
        assertFalse(node.has("timestamp"));
        assertNull(node.get("dataTarget"));
    }

    private static String loadFixture() throws IOException {
        try (InputStream stream = DecisionHttpRequestTest.class.getClassLoader()
                .getResourceAsStream("fixtures/decision_request.json")) {
            return new String(Objects.requireNonNull(stream, "decision_request fixture not found").readAllBytes());
        }
    }
}
