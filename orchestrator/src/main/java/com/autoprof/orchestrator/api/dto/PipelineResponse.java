package com.autoprof.orchestrator.api.dto;

import java.util.List;
import java.util.Map;

/**
 * Response body for GET /pipeline and PUT /pipeline/sequences.
 */
public record PipelineResponse(List<String> steps, Map<String, List<String>> sequences) {}
