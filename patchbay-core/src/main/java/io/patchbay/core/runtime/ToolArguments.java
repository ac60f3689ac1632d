package io.patchbay.core.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Builds ordered argument maps for delegation calls.
///
/// Unlike `Map.of`, preserves declaration order and accepts `null` values, which
/// optional parameters commonly default to.
public final class ToolArguments {

    private ToolArguments() {}

    /// Creates an argument map from alternating names and values.
    ///
    /// {@snippet :
    /// ToolArguments.of("track_type", trackType, "name", name)
    /// }
    ///
    /// @param namesAndValues alternating `String` names and values, not null
    /// @return unmodifiable ordered map, never null
    /// @throws IllegalArgumentException if the array length is odd or a name is not a String
    public static Map<String, Object> of(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Arguments must be name/value pairs");
        }
        Map<String, Object> arguments = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            if (!(namesAndValues[i] instanceof String name)) {
                throw new IllegalArgumentException("Argument name at " + i + " is not a String");
            }
            arguments.put(name, namesAndValues[i + 1]);
        }
        return Collections.unmodifiableMap(arguments);
    }
}
