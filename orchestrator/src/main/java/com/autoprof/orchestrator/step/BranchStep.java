package com.autoprof.orchestrator.step;

import com.autoprof.orchestrator.engine.Options;
import com.autoprof.orchestrator.image.ImageData;

import java.util.Map;
import java.util.Optional;

/**
 * A step that decides where execution continues.
 *
 * Returning a sequence name restarts execution at index 0 of that sequence.
 * Returning {@link Optional#empty()} continues with the next step of the
 * current sequence.
 */
@FunctionalInterface
public interface BranchStep extends PipelineStep {

    Optional<String> decide(ImageData image, Map<String, Object> results, Options options) throws Exception;
}
