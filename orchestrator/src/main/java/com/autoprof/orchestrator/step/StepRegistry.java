package com.autoprof.orchestrator.step;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name to implementation mapping for pipeline steps.
 *
 * Every {@link StepBinding} bean is registered at startup; embedding code can
 * add or replace steps later with {@link #updateMethods}. There is no ordering
 * here: the order in which steps run is owned by {@link SequenceGraph}.
 *
 * <p>Updates are meant to happen between runs. The backing map is concurrent,
 * so a lookup racing an update sees either the old or the new step, never a
 * torn state.
 */
public class StepRegistry {

    private static final Logger log = LoggerFactory.getLogger(StepRegistry.class);

    private final Map<String, PipelineStep> steps = new ConcurrentHashMap<>();

    public StepRegistry() {
    }

    public StepRegistry(List<StepBinding> bindings) {
        for (StepBinding binding : bindings) {
            steps.put(binding.name(), binding.step());
            log.info("Registered step '{}' [{}]", binding.name(), binding.kind());
        }
    }

    // ------------------------------------------------------------------
    // Updates
    // ------------------------------------------------------------------

    /**
     * Merge {@code newMethods} into the registry. Existing names are
     * overwritten, new names are added. A null or empty map is a no-op.
     */
    public void updateMethods(Map<String, ? extends PipelineStep> newMethods) {
        if (newMethods == null || newMethods.isEmpty()) {
            return;
        }
        log.info("Updating pipeline methods: {}", newMethods.keySet());
        steps.putAll(newMethods);
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public PipelineStep get(String name) {
        PipelineStep step = name == null ? null : steps.get(name);
        if (step == null) {
            throw new StepNotFoundException(name);
        }
        return step;
    }

    public boolean contains(String name) {
        return name != null && steps.containsKey(name);
    }

    /** Returns all registered step names (sorted). */
    public List<String> stepNames() {
        return steps.keySet().stream().sorted().toList();
    }

    /** Returns the names from {@code referenced} that nothing is registered under, in order, without duplicates. */
    public List<String> missing(Collection<String> referenced) {
        return referenced.stream()
                .filter(name -> !contains(name))
                .distinct()
                .toList();
    }
}
