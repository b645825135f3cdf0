package com.autoprof.orchestrator.api.dto;

import com.autoprof.orchestrator.step.SequenceUpdate;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts the JSON "steps" field into a {@link SequenceUpdate}.
 *
 * <pre>
 *   ["background", "psf", ...]                     → replaces "head"
 *   {"head": [...], "refit": [...]}                 → replaces the whole graph
 * </pre>
 */
public final class SequenceUpdates {

    private SequenceUpdates() {}

    /**
     * @return null when the node is absent or JSON null
     * @throws IllegalArgumentException when the node is neither a list nor an object of lists
     */
    public static SequenceUpdate fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isArray()) {
            return SequenceUpdate.ofHead(stepNames("head", node));
        }
        if (node.isObject()) {
            Map<String, List<String>> graph = new LinkedHashMap<>();
            node.fields().forEachRemaining(e -> graph.put(e.getKey(), stepNames(e.getKey(), e.getValue())));
            return SequenceUpdate.ofGraph(graph);
        }
        throw new IllegalArgumentException("'steps' must be a list of step names or an object of named lists");
    }

    private static List<String> stepNames(String sequence, JsonNode array) {
        if (!array.isArray()) {
            throw new IllegalArgumentException("Sequence '" + sequence + "' must be a list of step names");
        }
        List<String> names = new ArrayList<>();
        for (JsonNode element : array) {
            if (!element.isTextual()) {
                throw new IllegalArgumentException("Sequence '" + sequence + "' contains a non-string step: " + element);
            }
            names.add(element.asText());
        }
        return names;
    }
}
