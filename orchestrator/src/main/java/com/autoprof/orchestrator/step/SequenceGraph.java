package com.autoprof.orchestrator.step;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Named, ordered lists of step names.
 *
 * Execution always starts at index 0 of {@value #HEAD}. Branch steps can move
 * execution to the start of any other sequence by name, so the same step name
 * may appear in several sequences.
 *
 * <p>The graph is copy-on-write: each update publishes a new immutable map, and
 * readers never observe a half-applied update.
 */
public class SequenceGraph {

    private static final Logger log = LoggerFactory.getLogger(SequenceGraph.class);

    public static final String HEAD = "head";

    private volatile Map<String, List<String>> sequences;

    public SequenceGraph(List<String> head) {
        this(Map.of(HEAD, head));
    }

    public SequenceGraph(Map<String, List<String>> sequences) {
        this.sequences = validated(sequences);
    }

    // ------------------------------------------------------------------
    // Updates
    // ------------------------------------------------------------------

    /**
     * Replace the {@value #HEAD} sequence, keeping every other sequence.
     * A null or empty list is a no-op.
     */
    public synchronized void updateSequences(List<String> head) {
        if (head == null || head.isEmpty()) {
            return;
        }
        log.info("Pipeline new steps: {}", head);
        Map<String, List<String>> next = new LinkedHashMap<>(sequences);
        next.put(HEAD, checkedSteps(HEAD, head));
        sequences = Collections.unmodifiableMap(next);
    }

    /**
     * Replace the whole graph. The new mapping must contain {@value #HEAD};
     * otherwise nothing changes and {@link SequenceConfigException} is thrown.
     * A null or empty mapping is a no-op.
     */
    public synchronized void updateSequences(Map<String, List<String>> replacement) {
        if (replacement == null || replacement.isEmpty()) {
            return;
        }
        Map<String, List<String>> next = validated(replacement);
        log.info("Pipeline new steps: {}", next);
        sequences = next;
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    /**
     * @throws SequenceConfigException if no sequence has this name
     */
    public List<String> sequence(String name) {
        List<String> steps = sequences.get(name);
        if (steps == null) {
            throw new SequenceConfigException("No sequence named '" + name + "'; known sequences: " + names());
        }
        return steps;
    }

    public List<String> head() {
        return sequence(HEAD);
    }

    public Set<String> names() {
        return sequences.keySet();
    }

    /** Snapshot of the current graph. */
    public Map<String, List<String>> asMap() {
        return sequences;
    }

    /** Independent graph starting from the current snapshot; later updates to either side don't affect the other. */
    public SequenceGraph copy() {
        return new SequenceGraph(sequences);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Map<String, List<String>> validated(Map<String, List<String>> candidate) {
        if (candidate == null || !candidate.containsKey(HEAD)) {
            throw new SequenceConfigException(
                    "Sequence mapping must contain a '" + HEAD + "' sequence, got: "
                    + (candidate == null ? "null" : candidate.keySet()));
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        candidate.forEach((name, steps) -> copy.put(name, checkedSteps(name, steps)));
        return Collections.unmodifiableMap(copy);
    }

    private static List<String> checkedSteps(String sequence, List<String> steps) {
        if (steps == null || steps.stream().anyMatch(Objects::isNull)) {
            throw new SequenceConfigException("Sequence '" + sequence + "' has a missing step name: " + steps);
        }
        return List.copyOf(steps);
    }
}
