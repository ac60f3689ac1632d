package com.example.live;

import io.patchbay.core.runtime.DelegationHandle;
import io.patchbay.core.runtime.McpTool;
import io.patchbay.core.runtime.Param;
import io.patchbay.core.runtime.ToolArguments;
import io.patchbay.core.runtime.ToolContext;
import io.patchbay.core.runtime.ToolResults;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

public class TransportTools {

    private static final Logger logger = Logger.getLogger(TransportTools.class.getName());

    public TransportTools() {
        logger.fine("Transport tools ready");
    }

    /// Set the session tempo
    ///
    /// @param bpm Tempo in beats per minute (60-200)
    @McpTool(name = "set_tempo")
    public CompletableFuture<String> setTempo(ToolContext context, double bpm) {
        if (bpm < 60 || bpm > 200) {
            return CompletableFuture.completedFuture("Error: bpm must be between 60 and 200");
        }
        try {
            DelegationHandle handler = context.handler("transport");
            if (handler == null) {
                return CompletableFuture.completedFuture("Error: Server not initialized");
            }
            return handler.call("set_tempo", ToolArguments.of("bpm", bpm))
                    .thenApply(result -> ToolResults.firstText(result, "Set the session tempo completed"))
                    .exceptionally(e -> "Error: " + ToolResults.describe(e));
        } catch (Exception e) {
            return CompletableFuture.completedFuture("Error: " + e.getMessage());
        }
    }

    /// Start recording in Ableton Live
    @McpTool(name = "record")
    public CompletableFuture<String> record(ToolContext context) {
        try {
            DelegationHandle backend = context.direct();
            if (backend == null) {
                return CompletableFuture.completedFuture("Error: Server initialization failed");
            }
            return backend.call("record", ToolArguments.of())
                    .thenApply(result -> ToolResults.firstText(result, "Start recording in Ableton Live completed"))
                    .exceptionally(e -> "Error: " + ToolResults.describe(e));
        } catch (Exception e) {
            return CompletableFuture.completedFuture("Error: " + e.getMessage());
        }
    }

    /**
     * Create a new track.
     *
     * @param trackType Kind of track to create (audio, midi, return)
     * @param name Track name, or null for an automatic one
     */
    @McpTool(name = "create_track")
    public CompletableFuture<String> createTrack(
            ToolContext context,
            @Param(defaultValue = "\"audio\"") String trackType,
            @Param(defaultValue = "null") String name) {
        if (trackType == null || !List.of("audio", "midi", "return").contains(trackType)) {
            return CompletableFuture.completedFuture(
                    "Error: track_type must be one of: audio, midi, return");
        }
        try {
            DelegationHandle handler = context.handler("track");
            if (handler == null) {
                return CompletableFuture.completedFuture("Error: Server not initialized");
            }
            return handler.call("create_track", ToolArguments.of("track_type", trackType, "name", name))
                    .thenApply(result -> ToolResults.firstText(result, "Create a new track completed"))
                    .exceptionally(e -> "Error: " + ToolResults.describe(e));
        } catch (Exception e) {
            return CompletableFuture.completedFuture("Error: " + e.getMessage());
        }
    }

    private String describe(double bpm) {
        return "Tempo " + bpm;
    }
}
