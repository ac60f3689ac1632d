package io.patchbay.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Documentation facts of one tool.
///
/// @param summary first sentence or line of the doc comment, empty when absent
/// @param argSections parameter name to description, in documentation order
public record Docstring(String summary, Map<String, String> argSections) {

    public Docstring {
        summary = summary != null ? summary.strip() : "";
        argSections =
                argSections != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(argSections))
                        : Map.of();
    }

    /// Returns an empty docstring (no doc comment present).
    public static Docstring empty() {
        return new Docstring("", Map.of());
    }

    public boolean hasSummary() {
        return !summary.isBlank();
    }

    /// Returns the non-blank description of a parameter, or null.
    ///
    /// @param parameterName the parameter to look up, not null
    /// @return description, or null when missing or blank
    public String describe(String parameterName) {
        String description = argSections.get(parameterName);
        return description != null && !description.isBlank() ? description : null;
    }
}
