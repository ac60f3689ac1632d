package io.patchbay.core;

import io.patchbay.core.runtime.DelegationHandle;
import io.patchbay.core.runtime.McpTool;
import io.patchbay.core.runtime.ToolArguments;
import io.patchbay.core.runtime.ToolContext;
import io.patchbay.core.runtime.ToolResults;
import java.util.concurrent.CompletableFuture;

/// Hand-written counterpart of the generated `record` tool.
public class RecordTools {

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
}
