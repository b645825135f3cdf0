package com.autoprof.orchestrator.model;

import com.autoprof.orchestrator.engine.Outcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stores per-image outcomes as a JSON array: a step-to-seconds object for a
 * successful image, {@code null} for a failed one.
 */
@Converter
public class OutcomeListConverter implements AttributeConverter<List<Outcome>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<LinkedHashMap<String, Double>>> TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<Outcome> outcomes) {
        if (outcomes == null) {
            return null;
        }
        List<Map<String, Double>> rows = new ArrayList<>(outcomes.size());
        for (Outcome outcome : outcomes) {
            rows.add(outcome.isSuccess() ? outcome.timing() : null);
        }
        try {
            return MAPPER.writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise run outcomes", e);
        }
    }

    @Override
    public List<Outcome> convertToEntityAttribute(String json) {
        List<Outcome> outcomes = new ArrayList<>();
        if (json == null || json.isBlank()) {
            return outcomes;
        }
        try {
            for (Map<String, Double> timing : MAPPER.readValue(json, TYPE)) {
                outcomes.add(timing == null ? Outcome.failure() : Outcome.success(timing));
            }
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not read run outcomes", e);
        }
        return outcomes;
    }
}
