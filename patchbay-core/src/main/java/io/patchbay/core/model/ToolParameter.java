package io.patchbay.core.model;

import java.util.Objects;

/// One declared tool parameter, as written in the signature.
///
/// @param name Java parameter name, not null
/// @param declaredType type as written in source (`double`, `String`, `List<String>`), not null
/// @param optional whether a default is declared
/// @param defaultValue the declared default as a Java literal, null when required
public record ToolParameter(String name, String declaredType, boolean optional, String defaultValue) {

    public ToolParameter {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(declaredType, "declaredType must not be null");
    }

    public static ToolParameter required(String name, String declaredType) {
        return new ToolParameter(name, declaredType, false, null);
    }

    public static ToolParameter optional(String name, String declaredType, String defaultValue) {
        return new ToolParameter(name, declaredType, true, defaultValue);
    }
}
