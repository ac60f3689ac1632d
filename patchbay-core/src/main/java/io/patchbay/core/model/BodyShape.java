package io.patchbay.core.model;

/// Surface structure of a tool body.
///
/// @param hasGuardedInitializationCheck the delegation handle is null-checked before its first use
/// @param hasSurroundingFailureBoundary a try/catch plus an async recovery stage enclose delegation
/// @param errorMessagePrefixConsistent every error-path return starts with the canonical prefix
public record BodyShape(
        boolean hasGuardedInitializationCheck,
        boolean hasSurroundingFailureBoundary,
        boolean errorMessagePrefixConsistent) {

    /// Shape of a fully conformant body.
    public static BodyShape conformant() {
        return new BodyShape(true, true, true);
    }
}
