package com.autoprof.orchestrator.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one image's run: either the per-step timing of a successful run,
 * or the single failure sentinel.
 *
 * Why the image failed is logged by the engine, not carried here.
 */
public final class Outcome {

    private static final Outcome FAILURE = new Outcome(null);

    // Step name -> elapsed seconds, in execution order. Null only for FAILURE.
    private final Map<String, Double> timing;

    private Outcome(Map<String, Double> timing) {
        this.timing = timing;
    }

    public static Outcome success(Map<String, Double> timing) {
        return new Outcome(Collections.unmodifiableMap(new LinkedHashMap<>(timing)));
    }

    public static Outcome failure() {
        return FAILURE;
    }

    public boolean isSuccess() {
        return this != FAILURE;
    }

    public boolean isFailure() {
        return this == FAILURE;
    }

    /**
     * @throws IllegalStateException on the failure sentinel
     */
    public Map<String, Double> timing() {
        if (isFailure()) {
            throw new IllegalStateException("A failed outcome has no timing");
        }
        return timing;
    }

    @Override
    public String toString() {
        return isFailure() ? "Outcome[FAILURE]" : "Outcome[SUCCESS " + timing + "]";
    }
}
