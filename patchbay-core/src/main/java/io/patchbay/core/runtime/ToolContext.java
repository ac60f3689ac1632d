package io.patchbay.core.runtime;

/// Delegation registry passed explicitly to every tool invocation.
///
/// Replaces the ambient "handlers" map a tool server would otherwise keep in global
/// state, so tests can substitute a {@link io.patchbay.core.harness.MockRegistry}.
///
/// Both lookups return `null` while the backend is not initialized; conformant tools
/// check the handle before the first call.
public interface ToolContext {

    /// Target name of the direct backend in registries and reports.
    String DIRECT_TARGET = "backend";

    /// Returns the named handler, e.g. `"transport"` or `"track"`.
    ///
    /// @param name handler name, not null
    /// @return the handle, or null when unavailable
    DelegationHandle handler(String name);

    /// Returns the single directly reachable backend.
    ///
    /// @return the handle, or null when unavailable
    DelegationHandle direct();
}
