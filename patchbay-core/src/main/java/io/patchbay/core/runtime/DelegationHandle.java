package io.patchbay.core.runtime;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/// Asynchronous entry point into the delegation layer.
///
/// A handle stands for one backend object (a named handler or the direct backend).
/// The returned future completes with one of:
/// - a textual payload (`String`)
/// - a structured result whose first element carries a textual field
///   (`List<Map<String, Object>>` with a `"text"` entry, or a `Map` with `"message"`/`"text"`)
/// - exceptionally, when the operation fails
///
/// Implementations may also throw synchronously; conformant tools guard against both.
@FunctionalInterface
public interface DelegationHandle {

    /// Invokes an operation on the backend object.
    ///
    /// @param method operation name, not null
    /// @param arguments named arguments in declaration order, not null
    /// @return future of the raw backend result, never null
    CompletableFuture<Object> call(String method, Map<String, Object> arguments);
}
