package com.autoprof.orchestrator.step;

import com.autoprof.orchestrator.engine.Options;
import com.autoprof.orchestrator.image.ImageData;

import java.util.Map;

/**
 * A step that may replace the working image and adds entries to the
 * accumulated results of the current image.
 */
@FunctionalInterface
public interface RegularStep extends PipelineStep {

    /**
     * @param image   the working image as left by the previous Regular step
     * @param results read-only view of everything earlier steps produced
     * @param options per-image options, including the resolved {@code name}
     * @return the (possibly new) image and the partial results to merge
     */
    StepOutput apply(ImageData image, Map<String, Object> results, Options options) throws Exception;
}
