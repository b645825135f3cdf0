package com.autoprof.orchestrator.batch;

import com.autoprof.orchestrator.engine.Outcome;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mean step timings over the successful images of a batch.
 *
 * A step's mean is taken only over the successes that actually ran it, so an
 * image that branched around a step does not drag its average down.
 */
public final class TimingAggregator {

    private TimingAggregator() {}

    /**
     * @return step name to mean seconds, in first-seen order; empty when
     *         nothing succeeded
     */
    public static Map<String, Double> meanTimings(List<Outcome> outcomes) {
        Map<String, Double> totals = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();

        for (Outcome outcome : outcomes) {
            if (outcome.isFailure()) {
                continue;
            }
            outcome.timing().forEach((step, seconds) -> {
                totals.merge(step, seconds, Double::sum);
                counts.merge(step, 1, Integer::sum);
            });
        }

        Map<String, Double> means = new LinkedHashMap<>();
        totals.forEach((step, total) -> means.put(step, total / counts.get(step)));
        return means;
    }
}
