package io.patchbay.core.template;

import io.patchbay.core.runtime.ToolFunction;
import java.util.Objects;

/// Result of generating one tool.
///
/// @param spec the originating spec, not null
/// @param source method source text: doc comment, marker, signature and body, not null
/// @param function executable form with the same behavior as `source`, not null
public record GeneratedTool(ToolSpec spec, String source, ToolFunction function) {

    public GeneratedTool {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(function, "function must not be null");
    }

    public String name() {
        return spec.name();
    }
}
