package com.autoprof.orchestrator.api.dto;

import com.autoprof.orchestrator.engine.Outcome;
import com.autoprof.orchestrator.model.RunRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Response body for POST /runs and GET /runs/{id}.
 *
 * outcomes is empty until the run finishes; afterwards entry i belongs to
 * imageFiles[i]. A failed image has success=false and no timing.
 */
public record RunResponse(
        UUID                  id,
        String                processMode,
        String                state,
        Instant               createdAt,
        Instant               startedAt,
        Instant               finishedAt,
        List<String>          imageFiles,
        List<ImageOutcome>    outcomes,
        Map<String, Double>   meanTimings,
        String                error
) {

    public record ImageOutcome(int index, String imageFile, boolean success, Map<String, Double> timing) {}

    public static RunResponse from(RunRecord run) {
        List<ImageOutcome> outcomes = new ArrayList<>();
        List<Outcome> raw = run.getOutcomes();
        for (int i = 0; i < raw.size(); i++) {
            Outcome o = raw.get(i);
            outcomes.add(new ImageOutcome(i, run.getImageFiles().get(i), o.isSuccess(),
                    o.isSuccess() ? o.timing() : null));
        }
        return new RunResponse(
                run.getId(),
                run.getProcessMode().value(),
                run.getState().name(),
                run.getCreatedAt(),
                run.getStartedAt(),
                run.getFinishedAt(),
                run.getImageFiles(),
                outcomes,
                run.getMeanTimings(),
                run.getError()
        );
    }
}
