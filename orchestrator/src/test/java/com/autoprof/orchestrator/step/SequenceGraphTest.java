package com.autoprof.orchestrator.step;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SequenceGraphTest {

    SequenceGraph graph;

    @BeforeEach
    void setUp() {
        graph = new SequenceGraph(Map.of(
                "head",  List.of("background", "psf", "branch fit"),
                "refit", List.of("isophotefit", "writeprof")));
    }

    // ------------------------------------------------------------------
    // Flat list update
    // ------------------------------------------------------------------

    @Test
    void updateWithList_replacesOnlyHead() {
        graph.updateSequences(List.of("center", "writeprof"));

        assertThat(graph.head()).containsExactly("center", "writeprof");
        assertThat(graph.sequence("refit")).containsExactly("isophotefit", "writeprof");
    }

    @Test
    void updateWithEmptyList_isNoOp() {
        graph.updateSequences(List.of());
        graph.updateSequences((List<String>) null);

        assertThat(graph.head()).containsExactly("background", "psf", "branch fit");
    }

    // ------------------------------------------------------------------
    // Mapping update
    // ------------------------------------------------------------------

    @Test
    void updateWithMapping_replacesWholeGraph() {
        graph.updateSequences(Map.of("head", List.of("psf"), "other", List.of("center")));

        assertThat(graph.names()).containsExactlyInAnyOrder("head", "other");
        assertThat(graph.head()).containsExactly("psf");
    }

    @Test
    void updateWithMappingWithoutHead_failsAndLeavesGraphUnchanged() {
        Map<String, List<String>> before = graph.asMap();

        assertThatThrownBy(() -> graph.updateSequences(Map.of("main", List.of("psf"))))
                .isInstanceOf(SequenceConfigException.class)
                .hasMessageContaining("head");

        assertThat(graph.asMap()).isEqualTo(before);
        assertThat(graph.sequence("refit")).containsExactly("isophotefit", "writeprof");
    }

    @Test
    void updateWithEmptyMapping_isNoOp() {
        graph.updateSequences(Map.of());
        graph.updateSequences((Map<String, List<String>>) null);

        assertThat(graph.names()).containsExactlyInAnyOrder("head", "refit");
    }

    @Test
    void constructorWithoutHead_throws() {
        assertThatThrownBy(() -> new SequenceGraph(Map.of("main", List.of("psf"))))
                .isInstanceOf(SequenceConfigException.class);
    }

    @Test
    void nullStepName_isRejected() {
        Map<String, List<String>> bad = new LinkedHashMap<>();
        bad.put("head", java.util.Arrays.asList("psf", null));

        assertThatThrownBy(() -> graph.updateSequences(bad))
                .isInstanceOf(SequenceConfigException.class);
        assertThat(graph.head()).containsExactly("background", "psf", "branch fit");
    }

    // ------------------------------------------------------------------
    // Lookup and copies
    // ------------------------------------------------------------------

    @Test
    void sequence_unknownName_throws() {
        assertThatThrownBy(() -> graph.sequence("nope"))
                .isInstanceOf(SequenceConfigException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void copy_isIndependentOfOriginal() {
        SequenceGraph copy = graph.copy();
        copy.updateSequences(List.of("writeprof"));

        assertThat(copy.head()).containsExactly("writeprof");
        assertThat(graph.head()).containsExactly("background", "psf", "branch fit");
    }

    @Test
    void sequenceUpdate_appliesEitherShape() {
        SequenceUpdate.ofHead(List.of("psf")).applyTo(graph);
        assertThat(graph.head()).containsExactly("psf");
        assertThat(graph.names()).contains("refit");

        SequenceUpdate.ofGraph(Map.of("head", List.of("center"))).applyTo(graph);
        assertThat(graph.names()).containsExactly("head");
    }

    @Test
    void builtinForcedSequence_skipsFitCheckAndUsesForcedSteps() {
        assertThat(BuiltinSequences.FORCED).containsExactly(
                "background", "psf", "center forced",
                "isophotefit forced", "isophoteextract forced", "writeprof");
        assertThat(BuiltinSequences.FORCED).doesNotContain(BuiltinSequences.CHECK_FIT);
        assertThat(BuiltinSequences.STANDARD).contains(BuiltinSequences.CHECK_FIT);
    }
}
