package com.autoprof.orchestrator.api;

import com.autoprof.orchestrator.api.dto.PipelineResponse;
import com.autoprof.orchestrator.api.dto.SequenceUpdates;
import com.autoprof.orchestrator.service.RunService;
import com.autoprof.orchestrator.step.SequenceConfigException;
import com.autoprof.orchestrator.step.SequenceUpdate;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * Inspect and change the default pipeline.
 *
 * GET /pipeline            : registered step names and the default sequences
 * PUT /pipeline/sequences  : replace "head" (list body) or the whole graph (object body)
 */
@RestController
@RequestMapping("/pipeline")
public class PipelineController {

    private final RunService runService;

    public PipelineController(RunService runService) {
        this.runService = runService;
    }

    @GetMapping
    public PipelineResponse getPipeline() {
        return new PipelineResponse(runService.stepNames(), runService.sequences());
    }

    /**
     * HTTP 200 : sequences updated, returns the new pipeline
     * HTTP 400 : body is not a list/object of step names, or an object without "head"
     * HTTP 409 : runs are queued or in progress
     */
    @PutMapping("/sequences")
    public PipelineResponse updateSequences(@RequestBody JsonNode body) {
        SequenceUpdate update;
        try {
            update = SequenceUpdates.fromJson(body);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        if (update == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body must not be null");
        }

        try {
            runService.updateSequences(update);
        } catch (SequenceConfigException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage(), e);
        }
        return getPipeline();
    }
}
