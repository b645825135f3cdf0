package com.autoprof.orchestrator.api;

import com.autoprof.orchestrator.api.dto.RunResponse;
import com.autoprof.orchestrator.api.dto.SequenceUpdates;
import com.autoprof.orchestrator.api.dto.SubmitRunRequest;
import com.autoprof.orchestrator.engine.Options;
import com.autoprof.orchestrator.model.ProcessMode;
import com.autoprof.orchestrator.model.RunRecord;
import com.autoprof.orchestrator.service.RunService;
import com.autoprof.orchestrator.step.SequenceConfigException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

/**
 * REST API for pipeline runs.
 *
 * POST /runs        : submit a single-image or image-list run
 * GET  /runs/{id}   : poll a run; per-image outcomes appear once it finishes
 */
@RestController
@RequestMapping("/runs")
public class RunController {

    private final RunService runService;

    public RunController(RunService runService) {
        this.runService = runService;
    }

    /**
     * Submit a run.
     *
     * Example:
     *   curl -X POST http://localhost:8080/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"processMode":"image list",
     *          "options":{"image_file":["a.png","b.png"],"n_procs":2}}'
     *
     * Returns 400 if the mode, the options or the step override is invalid.
     */
    @PostMapping
    public ResponseEntity<RunResponse> submit(@RequestBody SubmitRunRequest req) {
        try {
            RunRecord run = runService.submit(
                    ProcessMode.fromValue(req.processMode()),
                    Options.of(req.options()),
                    SequenceUpdates.fromJson(req.steps()));
            return ResponseEntity.status(HttpStatus.CREATED).body(RunResponse.from(run));
        } catch (IllegalArgumentException | SequenceConfigException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    /**
     * Poll a run. Returns 404 if the id is unknown (or already evicted).
     */
    @GetMapping("/{id}")
    public RunResponse getRun(@PathVariable UUID id) {
        return runService.findById(id)
                .map(RunResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Run not found: " + id));
    }
}
