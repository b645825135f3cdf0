package com.autoprof.orchestrator.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

/** Step name to mean seconds, as a JSON object in step order. */
@Converter
public class TimingMapConverter implements AttributeConverter<Map<String, Double>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Double>> TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(Map<String, Double> timings) {
        if (timings == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(timings);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise mean timings", e);
        }
    }

    @Override
    public Map<String, Double> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return MAPPER.readValue(json, TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not read mean timings", e);
        }
    }
}
