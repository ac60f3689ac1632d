package io.patchbay.core.template;

import java.util.Objects;

/// Declarative description of one tool parameter.
///
/// @param name snake_case name exposed to callers, not null
/// @param type abstract type: `string`, `integer`, `long`, `number`, `boolean` (aliases `str`,
///     `int`, `float`, `double`, `bool` accepted)
/// @param description prose description; a range such as `(60-200)` or a choice list such as
///     `(audio, midi, return)` makes the parameter restricted
/// @param optional whether callers may omit the parameter
/// @param defaultValue default for an optional parameter: `String`, `Number`, `Boolean` or null
public record ParameterSpec(
        String name, String type, String description, boolean optional, Object defaultValue) {

    public ParameterSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        description = description != null ? description : "";
    }

    public static ParameterSpec required(String name, String type, String description) {
        return new ParameterSpec(name, type, description, false, null);
    }

    public static ParameterSpec optional(
            String name, String type, String description, Object defaultValue) {
        return new ParameterSpec(name, type, description, true, defaultValue);
    }
}
