package com.autoprof.orchestrator.step;

import java.util.Objects;

/**
 * Registers a step under a name. Declare one as a Spring {@code @Bean} and the
 * {@link StepRegistry} picks it up at startup.
 *
 * @param name the step name referenced by sequences (e.g. "center forced")
 * @param step the implementation
 */
public record StepBinding(String name, PipelineStep step) {

    public StepBinding {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(step, "step");
    }

    public String kind() {
        return step instanceof BranchStep ? "branch" : "regular";
    }
}
