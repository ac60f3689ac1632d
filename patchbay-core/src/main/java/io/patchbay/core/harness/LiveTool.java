package io.patchbay.core.harness;

import io.patchbay.core.model.ToolDefinition;
import io.patchbay.core.runtime.ToolFunction;
import java.util.Objects;

/// A tool that can be both inspected and invoked.
///
/// @param definition structural facts, drive the standard battery, not null
/// @param function the invocable tool, not null
public record LiveTool(ToolDefinition definition, ToolFunction function) {

    public LiveTool {
        Objects.requireNonNull(definition, "definition must not be null");
        Objects.requireNonNull(function, "function must not be null");
    }

    public String name() {
        return definition.name();
    }
}
