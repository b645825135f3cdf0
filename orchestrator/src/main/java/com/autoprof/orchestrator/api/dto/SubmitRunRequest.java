package com.autoprof.orchestrator.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Request body for POST /runs.
 *
 * Required: processMode ("image", "image list", "forced image",
 *   "forced image list"), options (must include image_file).
 * Optional: steps: either a list of step names replacing the "head"
 *   sequence, or an object of sequence name to step list replacing the whole
 *   graph (must then include "head").
 */
public record SubmitRunRequest(String processMode, Map<String, Object> options, JsonNode steps) {

    // Compact constructor: default to a single image run if caller omits the mode.
    public SubmitRunRequest {
        if (processMode == null || processMode.isBlank()) processMode = "image";
    }
}
