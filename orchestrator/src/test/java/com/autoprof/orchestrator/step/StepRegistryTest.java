package com.autoprof.orchestrator.step;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the step registry.
 * No Spring context; bindings are wired by hand.
 */
class StepRegistryTest {

    RegularStep background = (img, res, opt) -> StepOutput.of(img, Map.of("background", 1.0));
    RegularStep psf        = (img, res, opt) -> StepOutput.of(img, Map.of("psf fwhm", 3.2));
    BranchStep  branch     = (img, res, opt) -> Optional.empty();

    StepRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new StepRegistry(List.of(
                new StepBinding("background", background),
                new StepBinding("psf", psf),
                new StepBinding("branch refit", branch)));
    }

    @Test
    void registry_registersAllBindings() {
        assertThat(registry.stepNames()).containsExactly("background", "branch refit", "psf");
        assertThat(registry.get("psf")).isSameAs(psf);
    }

    @Test
    void get_unknownStep_throwsNotFoundException() {
        assertThatThrownBy(() -> registry.get("no_such_step"))
                .isInstanceOf(StepNotFoundException.class)
                .hasMessageContaining("no_such_step");
    }

    @Test
    void updateMethods_overwritesExistingAndAddsNew() {
        RegularStep otherPsf = (img, res, opt) -> StepOutput.unchanged(img);
        RegularStep center   = (img, res, opt) -> StepOutput.unchanged(img);

        registry.updateMethods(Map.of("psf", otherPsf, "center", center));

        assertThat(registry.get("psf")).isSameAs(otherPsf);
        assertThat(registry.get("center")).isSameAs(center);
        assertThat(registry.get("background")).isSameAs(background);
        assertThat(registry.stepNames()).hasSize(4);
    }

    @Test
    void updateMethods_nullOrEmpty_isNoOp() {
        registry.updateMethods(null);
        registry.updateMethods(Map.of());

        assertThat(registry.stepNames()).containsExactly("background", "branch refit", "psf");
    }

    @Test
    void updateMethods_isIdempotent() {
        RegularStep center = (img, res, opt) -> StepOutput.unchanged(img);

        registry.updateMethods(Map.of("center", center));
        registry.updateMethods(Map.of("center", center));

        assertThat(registry.get("center")).isSameAs(center);
        assertThat(registry.stepNames()).hasSize(4);
    }

    @Test
    void missing_reportsUnregisteredNamesOnceInOrder() {
        assertThat(registry.missing(List.of("background", "center", "psf", "writeprof", "center")))
                .containsExactly("center", "writeprof");
    }

    @Test
    void binding_kindDistinguishesBranchFromRegular() {
        assertThat(new StepBinding("b", branch).kind()).isEqualTo("branch");
        assertThat(new StepBinding("r", psf).kind()).isEqualTo("regular");
    }
}
