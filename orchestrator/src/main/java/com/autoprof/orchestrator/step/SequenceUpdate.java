package com.autoprof.orchestrator.step;

import java.util.List;
import java.util.Map;

/**
 * A pending change to a {@link SequenceGraph}, in either of the two accepted
 * shapes: a flat list that replaces only "head", or a full named mapping that
 * replaces everything.
 */
public final class SequenceUpdate {

    private final List<String> head;
    private final Map<String, List<String>> graph;

    private SequenceUpdate(List<String> head, Map<String, List<String>> graph) {
        this.head  = head;
        this.graph = graph;
    }

    public static SequenceUpdate ofHead(List<String> head) {
        return new SequenceUpdate(head, null);
    }

    public static SequenceUpdate ofGraph(Map<String, List<String>> graph) {
        return new SequenceUpdate(null, graph);
    }

    public boolean replacesGraph() {
        return graph != null;
    }

    public void applyTo(SequenceGraph target) {
        if (graph != null) {
            target.updateSequences(graph);
        } else {
            target.updateSequences(head);
        }
    }

    @Override
    public String toString() {
        return graph != null ? "SequenceUpdate" + graph : "SequenceUpdate[head=" + head + "]";
    }
}
