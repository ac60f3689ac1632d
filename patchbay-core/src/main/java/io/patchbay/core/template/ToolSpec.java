package io.patchbay.core.template;

import io.patchbay.core.model.DelegationMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Declarative description of a tool to generate.
///
/// ### Usage
/// {@snippet :
/// ToolSpec spec = ToolSpec.builder("set_tempo")
///         .description("Set the session tempo")
///         .delegated("transport", "set_tempo")
///         .parameter(ParameterSpec.required("bpm", "number", "Tempo in beats per minute (60-200)"))
///         .build();
/// }
///
/// @param name snake_case tool name, not null
/// @param description one-line description, used as doc summary, not null
/// @param mode {@link DelegationMode.Delegated} or {@link DelegationMode.Direct}, not null
/// @param parameters parameters in signature order, not null
/// @see ToolSpecValidator for the accepted value space
public record ToolSpec(
        String name, String description, DelegationMode mode, List<ParameterSpec> parameters) {

    public ToolSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        description = description != null ? description : "";
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private String description = "";
        private DelegationMode mode;
        private final List<ParameterSpec> parameters = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder delegated(String target, String method) {
            this.mode = DelegationMode.delegated(target, method);
            return this;
        }

        public Builder direct(String method) {
            this.mode = DelegationMode.direct(method);
            return this;
        }

        public Builder mode(DelegationMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder parameter(ParameterSpec parameter) {
            this.parameters.add(parameter);
            return this;
        }

        /// Builds the spec. A spec built without a mode carries {@link DelegationMode#none()},
        /// which {@link ToolSpecValidator} rejects before anything is emitted.
        public ToolSpec build() {
            return new ToolSpec(
                    name, description, mode != null ? mode : DelegationMode.none(), parameters);
        }
    }
}
