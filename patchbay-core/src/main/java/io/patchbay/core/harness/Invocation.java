package io.patchbay.core.harness;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// One call recorded by a {@link MockRegistry}.
///
/// @param target handler name, or {@link io.patchbay.core.runtime.ToolContext#DIRECT_TARGET}
/// @param method operation name
/// @param arguments arguments as passed, order preserved, nulls allowed
public record Invocation(String target, String method, Map<String, Object> arguments) {

    public Invocation {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(method, "method must not be null");
        arguments =
                arguments != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
                        : Map.of();
    }
}
