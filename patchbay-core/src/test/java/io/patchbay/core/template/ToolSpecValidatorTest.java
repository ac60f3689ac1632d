package io.patchbay.core.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.patchbay.core.model.DelegationMode;
import org.junit.jupiter.api.Test;

class ToolSpecValidatorTest {

    @Test
    void shouldAcceptExamples() {
        for (ToolSpec spec : ParameterPresets.examples()) {
            assertThat(ToolSpecValidator.problems(spec)).as(spec.name()).isEmpty();
        }
    }

    @Test
    void shouldListEveryProblem() {
        ToolSpec spec =
                ToolSpec.builder("setTempo")
                        .description("Set\ntempo")
                        .delegated("transport-layer", "set tempo")
                        .parameter(ParameterSpec.required("bpm", "number", "Tempo (60-200)"))
                        .parameter(ParameterSpec.required("bpm", "number", "Tempo again"))
                        .parameter(ParameterSpec.required("handler", "string", ""))
                        .parameter(new ParameterSpec("count", "integer", "Count", false, 3))
                        .build();

        assertThat(ToolSpecValidator.problems(spec))
                .containsExactly(
                        "name 'setTempo' must be a snake_case identifier",
                        "description must be a single line",
                        "handler target 'transport-layer' must be an identifier",
                        "method 'set tempo' must be an identifier",
                        "duplicate parameter 'bpm'",
                        "parameter 'handler' uses a reserved name",
                        "parameter 'handler' needs a description",
                        "parameter 'count' is required but declares a default");
    }

    @Test
    void shouldRejectDefaultsThatDoNotFit() {
        ToolSpec spec =
                ToolSpec.builder("generate_bass_line")
                        .description("Generate a bass line")
                        .delegated("composition", "generate_bass_line")
                        .parameter(ParameterSpec.optional("length", "integer", "Length in bars (4-64)", 128))
                        .parameter(ParameterSpec.optional("bars", "integer", "Bars", 2.5))
                        .parameter(ParameterSpec.optional("density", "string", "Density (sparse, dense)", "medium"))
                        .parameter(ParameterSpec.optional("loop", "boolean", "Loop it", "yes"))
                        .build();

        assertThat(ToolSpecValidator.problems(spec))
                .containsExactly(
                        "parameter 'length' default 128 lies outside its documented domain",
                        "parameter 'bars' default 2.5 does not fit type integer",
                        "parameter 'density' default medium lies outside its documented domain",
                        "parameter 'loop' default yes does not fit type boolean");
    }

    @Test
    void shouldRejectCamelCaseCollisionAndKeywordNames() {
        ToolSpec spec =
                ToolSpec.builder("new")
                        .description("Make something")
                        .parameter(ParameterSpec.required("track_id", "integer", "Track"))
                        .parameter(ParameterSpec.required("track__id", "integer", "Track again"))
                        .parameter(ParameterSpec.required("class", "string", "Class"))
                        .build();

        assertThat(ToolSpecValidator.problems(spec))
                .contains(
                        "name 'new' maps to a Java keyword",
                        "parameter 'track__id' must be a snake_case identifier",
                        "parameter 'class' uses a reserved name");
    }

    @Test
    void shouldRejectSpecBuiltWithoutMode() {
        // Given
        ToolSpec spec =
                ToolSpec.builder("set_track")
                        .description("Select a track")
                        .parameter(ParameterSpec.required("track_id", "integer", "Track index (1-16)"))
                        .build();

        // Then
        assertThat(spec.mode()).isEqualTo(DelegationMode.none());
        assertThat(ToolSpecValidator.problems(spec)).containsExactly("mode must be Delegated or Direct");
    }

    @Test
    void shouldRejectRangeWiderThanParameterType() {
        // Given
        ToolSpec spec =
                ToolSpec.builder("seek")
                        .description("Seek to a sample offset")
                        .direct("seek")
                        .parameter(ParameterSpec.required("offset", "integer", "Sample offset (0-9999999999)"))
                        .parameter(ParameterSpec.required("position", "long", "Sample position (0-9999999999)"))
                        .build();

        // Then
        assertThat(ToolSpecValidator.problems(spec))
                .containsExactly("parameter 'offset' range 0 to 9999999999 does not fit type integer");
    }

    @Test
    void shouldRequireDelegatingMode() {
        ToolSpec spec =
                ToolSpec.builder("tick").description("Tick").mode(DelegationMode.none()).build();

        assertThatThrownBy(() -> ToolSpecValidator.validate(spec))
                .isInstanceOf(ToolSpecException.class)
                .hasMessage("Invalid tool spec: mode must be Delegated or Direct");
    }
}
