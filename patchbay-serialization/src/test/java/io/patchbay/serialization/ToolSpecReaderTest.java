package io.patchbay.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.patchbay.core.model.DelegationMode;
import io.patchbay.core.template.ParameterPresets;
import io.patchbay.core.template.ParameterSpec;
import io.patchbay.core.template.TemplateGenerator;
import io.patchbay.core.template.ToolSpec;
import io.patchbay.core.template.ToolSpecException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class ToolSpecReaderTest {

    private static Path spec(String name) throws URISyntaxException {
        return Path.of(ToolSpecReaderTest.class.getResource("/specs/" + name).toURI());
    }

    @Test
    void shouldReadSingleSpecFile() throws Exception {
        ToolSpec spec = ToolSpecReader.read(spec("set-tempo.json"));

        assertThat(spec.name()).isEqualTo("set_tempo");
        assertThat(spec.description()).isEqualTo("Set the session tempo");
        assertThat(spec.mode()).isEqualTo(DelegationMode.delegated("transport", "set_tempo"));
        assertThat(spec.parameters()).containsExactly(ParameterPresets.BPM);
    }

    @Test
    void shouldReadCatalogAndGenerateEveryTool() throws Exception {
        // Given
        List<ToolSpec> specs = ToolSpecReader.readAll(spec("live-tools.json"));

        // Then
        assertThat(specs).extracting(ToolSpec::name)
                .containsExactly("set_tempo", "create_audio_track", "record");
        assertThat(specs.get(1).mode()).isEqualTo(DelegationMode.delegated("track", "create_track"));
        assertThat(specs.get(1).parameters())
                .containsExactly(
                        ParameterSpec.optional("track_type", "string", "Type of track (audio)", "audio"),
                        ParameterSpec.optional("name", "string", "Optional name", null));
        assertThat(specs.get(2).mode()).isEqualTo(DelegationMode.direct("record"));

        TemplateGenerator generator = new TemplateGenerator();
        for (ToolSpec spec : specs) {
            assertThat(generator.generate(spec).source()).contains("@McpTool(name = \"" + spec.name() + "\")");
        }
    }

    @Test
    void shouldReadScalarDefaults() throws Exception {
        ToolSpec spec =
                ToolSpecReader.read(
                        """
                        {"name": "generate_bass_line", "description": "Generate a bass line",
                         "mode": {"type": "direct", "method": "generate_bass_line"},
                         "parameters": [
                           {"name": "length", "type": "integer", "description": "Bars", "default": 4},
                           {"name": "swing", "type": "number", "description": "Swing", "default": 0.5},
                           {"name": "loop", "type": "boolean", "description": "Loop", "default": true},
                           {"name": "seed", "type": "long", "description": "Seed", "default": 9000000000},
                           {"name": "scale", "type": "string", "description": "Scale", "optional": true}
                         ]}
                        """);

        assertThat(spec.parameters())
                .extracting(ParameterSpec::defaultValue)
                .containsExactly(4, 0.5, true, 9000000000L, null);
        assertThat(spec.parameters()).allMatch(ParameterSpec::optional);
    }

    @Test
    void shouldCollectStructuralProblems() {
        String json =
                """
                [
                  {"description": "No name"},
                  {"name": "set_tempo", "parameters": [{"name": "bpm"}, {"type": "number"}]},
                  {"name": "mute", "description": "Mute", "parameters": [
                    {"name": "tracks", "type": "string", "description": "Tracks", "default": [1, 2]}
                  ]},
                  42
                ]
                """;

        assertThatThrownBy(() -> ToolSpecReader.readAll(json))
                .isInstanceOfSatisfying(
                        ToolSpecException.class,
                        e ->
                                assertThat(e.getProblems())
                                        .containsExactly(
                                                "[0]: missing \"name\"",
                                                "[0]: missing \"mode\"",
                                                "[0]: missing \"parameters\"",
                                                "[1]: set_tempo: missing \"description\"",
                                                "[1]: set_tempo: missing \"mode\"",
                                                "[1]: set_tempo: parameter 0 (bpm): missing \"type\"",
                                                "[1]: set_tempo: parameter 1: missing \"name\"",
                                                "[2]: mute: missing \"mode\"",
                                                "[2]: mute: parameter 0 (tracks): \"default\" must be a scalar",
                                                "[3]: expected a JSON object"));
    }

    @Test
    void shouldRejectMalformedDocuments() {
        assertThatThrownBy(() -> ToolSpecReader.read("{\"name\": "))
                .isInstanceOf(ToolSpecException.class)
                .hasMessageStartingWith("Invalid tool spec: malformed JSON: ");
        assertThatThrownBy(() -> ToolSpecReader.read("[]"))
                .isInstanceOf(ToolSpecException.class)
                .hasMessage("Invalid tool spec: expected a JSON object");
        assertThatThrownBy(() -> ToolSpecReader.readAll("\"set_tempo\""))
                .isInstanceOf(ToolSpecException.class)
                .hasMessage("Invalid tool spec: expected a JSON object or array");
    }

    @Test
    void shouldReportUnknownModeType() {
        String json =
                "{\"name\": \"tick\", \"description\": \"Tick\", \"mode\": {\"type\": \"broadcast\"},"
                        + " \"parameters\": []}";

        assertThatThrownBy(() -> ToolSpecReader.read(json))
                .isInstanceOf(ToolSpecException.class)
                .hasMessageContaining("tick: invalid \"mode\"")
                .hasMessageContaining("unknown mode type");
    }

    @Test
    void shouldRejectSpecWithoutModeOrParameters() {
        // Given
        String noMode =
                """
                {"name": "set_track", "description": "Select a track",
                 "parameters": [{"name": "track_id", "type": "integer", "description": "Track index (1-16)"}]}
                """;
        String noParameters =
                """
                {"name": "set_track", "description": "Select a track",
                 "mode": {"type": "delegated", "target": "track", "method": "set_track"}}
                """;

        // When / Then
        assertThatThrownBy(() -> ToolSpecReader.read(noMode))
                .isInstanceOfSatisfying(
                        ToolSpecException.class,
                        e -> assertThat(e.getProblems()).containsExactly("set_track: missing \"mode\""));
        assertThatThrownBy(() -> ToolSpecReader.read(noParameters))
                .isInstanceOfSatisfying(
                        ToolSpecException.class,
                        e -> assertThat(e.getProblems()).containsExactly("set_track: missing \"parameters\""));
    }

    @Test
    void shouldAcceptExplicitlyEmptyParameterList() throws Exception {
        ToolSpec spec =
                ToolSpecReader.read(
                        """
                        {"name": "record", "description": "Start recording",
                         "mode": {"type": "direct", "method": "record"}, "parameters": []}
                        """);

        assertThat(spec.mode()).isEqualTo(DelegationMode.direct("record"));
        assertThat(spec.parameters()).isEmpty();
    }

    @Test
    void roundTrip_examples() throws Exception {
        for (ToolSpec original : ParameterPresets.examples()) {
            ToolSpec restored = ToolSpecReader.read(ToolSpecReader.write(original));

            assertThat(restored).isEqualTo(original);
        }
    }
}
