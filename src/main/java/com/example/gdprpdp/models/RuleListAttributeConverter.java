package com.example.gdprpdp.models;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.List;
import software.amazon.awssdk.enhanced.dynamodb.AttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.AttributeValueType;
import software.amazon.awssdk.enhanced.dynamodb.EnhancedType;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Stores a policy's rules as one JSON string attribute, in the same snake_case shape policies
 * are authored in.
 */
public class RuleListAttributeConverter implements AttributeConverter<List<Rule>> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public AttributeValue transformFrom(List<Rule> input) {
        return AttributeValue.builder().s(toJsonString(input)).build();
    }

    @Override
    public List<Rule> transformTo(AttributeValue attributeValue) {
        String json = attributeValue.s();
        try {
            return MAPPER.readValue(
                    json,
                    MAPPER.getTypeFactory().constructCollectionType(List.class, Rule.class)
            );
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid JSON in rules attribute", e);
        }
    }

    @Override
    public EnhancedType<List<Rule>> type() {
        return EnhancedType.listOf(Rule.class);
    }

    @Override
    public AttributeValueType attributeValueType() {
        return AttributeValueType.S; // stored as a JSON string
    }

    static String toJsonString(List<Rule> input) {
        try {
            return MAPPER.writeValueAsString(input == null ? List.of() : input);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize rules", e);
        }
    }
}
