package com.example.dyncms.models;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.List;
import software.amazon.awssdk.enhanced.dynamodb.AttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.AttributeValueType;
import software.amazon.awssdk.enhanced.dynamodb.EnhancedType;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Stores the ordered field list of a content type as a single JSON string attribute.
 */
public class FieldDefinitionListAttributeConverter implements AttributeConverter<List<FieldDefinition>> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<FieldDefinition>> FIELD_LIST = new TypeReference<>() { };

    @Override
    public AttributeValue transformFrom(List<FieldDefinition> input) {
        try {
            return AttributeValue.builder().s(MAPPER.writeValueAsString(input == null ? List.of() : input)).build();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize field definitions", e);
        }
    }

    @Override
    public List<FieldDefinition> transformTo(AttributeValue attributeValue) {
        String json = attributeValue.s();
        if (json == null) {
            return List.of();
        }
        try {
            return MAPPER.readValue(json, FIELD_LIST);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid JSON in fields attribute", e);
        }
    }

    @Override
    public EnhancedType<List<FieldDefinition>> type() {
        return EnhancedType.listOf(FieldDefinition.class);
    }

    @Override
    public AttributeValueType attributeValueType() {
        return AttributeValueType.S;
    }
}
