package com.autoprof.orchestrator.batch;

import com.autoprof.orchestrator.engine.Outcome;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Everything a batch produced.
 *
 * @param outcomes       one entry per input image, in input order
 * @param meanTimings    step name to mean seconds over the successes; empty
 *                       when every image failed
 * @param elapsedSeconds wall-clock time of the whole batch
 */
public record BatchResult(
        List<Outcome>       outcomes,
        Map<String, Double> meanTimings,
        double              elapsedSeconds) {

    public BatchResult {
        outcomes    = List.copyOf(outcomes);
        meanTimings = Collections.unmodifiableMap(new LinkedHashMap<>(meanTimings));
    }

    public long successCount() {
        return outcomes.stream().filter(Outcome::isSuccess).count();
    }

    /** Indices of the input images that failed, ascending. */
    public List<Integer> failedIndices() {
        return IntStream.range(0, outcomes.size())
                .filter(i -> outcomes.get(i).isFailure())
                .boxed()
                .toList();
    }

    public boolean allFailed() {
        return successCount() == 0;
    }
}
