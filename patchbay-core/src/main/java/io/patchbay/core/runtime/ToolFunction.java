package io.patchbay.core.runtime;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/// A live, invocable tool.
///
/// Arguments are keyed by the declared parameter name. Missing optional arguments
/// take their declared defaults.
@FunctionalInterface
public interface ToolFunction {

    /// Invokes the tool.
    ///
    /// @param context delegation registry, not null
    /// @param arguments named arguments, not null
    /// @return future of the textual result
    CompletableFuture<String> invoke(ToolContext context, Map<String, Object> arguments);
}
