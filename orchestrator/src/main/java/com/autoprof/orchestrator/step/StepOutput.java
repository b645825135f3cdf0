package com.autoprof.orchestrator.step;

import com.autoprof.orchestrator.image.ImageData;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a {@link RegularStep} hands back to the engine.
 *
 * @param image          image passed on to the next step (usually the input image)
 * @param partialResults entries merged into the image's results, overwriting
 *                       any key already present
 */
public record StepOutput(ImageData image, Map<String, Object> partialResults) {

    public StepOutput {
        // Steps may report null values.
        partialResults = partialResults == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(partialResults));
    }

    public static StepOutput of(ImageData image, Map<String, Object> partialResults) {
        return new StepOutput(image, partialResults);
    }

    /** The image is passed through unchanged and nothing is added to the results. */
    public static StepOutput unchanged(ImageData image) {
        return new StepOutput(image, Map.of());
    }
}
