package io.patchbay.core.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Frequently used parameters of music-production tools, plus example specs covering
/// the three common tool shapes.
public final class ParameterPresets {

    public static final ParameterSpec TRACK_ID =
            ParameterSpec.required("track_id", "integer", "Target track index");

    public static final ParameterSpec CLIP_SLOT =
            ParameterSpec.required("clip_slot", "integer", "Clip slot index");

    public static final ParameterSpec BPM =
            ParameterSpec.required("bpm", "number", "Tempo in beats per minute (60-200)");

    public static final ParameterSpec TRACK_TYPE =
            ParameterSpec.required(
                    "track_type", "string", "Type of track to create (audio, midi, return)");

    public static final ParameterSpec NAME =
            ParameterSpec.optional("name", "string", "Optional name", null);

    public static final ParameterSpec KEY =
            ParameterSpec.required("key", "string", "Musical key (e.g., 'C', 'Am', 'F#')");

    public static final ParameterSpec GENRE =
            ParameterSpec.required(
                    "genre", "string", "Genre style (techno, industrial, house, minimal)");

    public static final ParameterSpec LENGTH =
            ParameterSpec.optional("length", "integer", "Length in bars (4-64)", 4);

    private ParameterPresets() {}

    /// Returns the common parameters keyed by name, in a stable order.
    public static Map<String, ParameterSpec> common() {
        Map<String, ParameterSpec> presets = new LinkedHashMap<>();
        for (ParameterSpec preset :
                List.of(TRACK_ID, CLIP_SLOT, BPM, TRACK_TYPE, NAME, KEY, GENRE, LENGTH)) {
            presets.put(preset.name(), preset);
        }
        return Collections.unmodifiableMap(presets);
    }

    /// Example specs: a simple direct tool, a handler tool with an optional parameter and
    /// a handler tool with several restricted parameters.
    public static List<ToolSpec> examples() {
        ToolSpec record =
                ToolSpec.builder("record")
                        .description("Start recording in Ableton Live")
                        .direct("record")
                        .build();

        ToolSpec createAudioTrack =
                ToolSpec.builder("create_audio_track")
                        .description("Create a new audio track")
                        .delegated("track", "create_track")
                        .parameter(
                                ParameterSpec.optional(
                                        "track_type", "string", "Type of track (audio)", "audio"))
                        .parameter(NAME)
                        .build();

        ToolSpec generateBassLine =
                ToolSpec.builder("generate_bass_line")
                        .description("Generate a bass line with specific characteristics")
                        .delegated("composition", "generate_bass_line")
                        .parameter(KEY)
                        .parameter(GENRE)
                        .parameter(LENGTH)
                        .parameter(
                                ParameterSpec.optional(
                                        "note_density",
                                        "string",
                                        "Note density (sparse, medium, dense)",
                                        "medium"))
                        .build();

        return List.of(record, createAudioTrack, generateBassLine);
    }
}
