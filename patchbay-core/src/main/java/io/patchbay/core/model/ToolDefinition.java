package io.patchbay.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Structural facts about one tool, as extracted from its source.
///
/// A definition is a snapshot: re-extracting changed source produces a new instance.
/// It carries shape only; nothing here was obtained by executing or type-checking the body.
///
/// ### Contracts
/// - **Precondition**: `name` must not be null or blank
/// - **Postcondition**: all collections are unmodifiable copies, order preserved
///
/// ### Usage
/// {@snippet :
/// ToolDefinition broken = ToolDefinition.builder("set_tempo")
///         .parameter(ToolParameter.required("bpm", "double"))
///         .hasRegistrationMarker(false)
///         .build();
/// }
///
/// @param name tool name, unique within a catalog, not null
/// @param methodName Java method name, not null
/// @param location source unit and line, e.g. `TransportTools.java:42`, not null
/// @param isAsyncCallable return type is a future or completion stage
/// @param hasRegistrationMarker the canonical marker is present and well formed
/// @param parameters declared parameters excluding the injected context, in order
/// @param returnsPlainText the (eventual) return value is a `String`
/// @param docstring documentation facts, not null
/// @param bodyShape body surface structure, not null
/// @param parameterValidationGuards parameters checked before delegation, in order
/// @param delegation how the body reaches the delegation layer, not null
/// @see io.patchbay.core.extract.ToolModelExtractor for extraction
/// @see io.patchbay.core.rule.RuleEngine for validation
public record ToolDefinition(
        String name,
        String methodName,
        String location,
        boolean isAsyncCallable,
        boolean hasRegistrationMarker,
        List<ToolParameter> parameters,
        boolean returnsPlainText,
        Docstring docstring,
        BodyShape bodyShape,
        Set<String> parameterValidationGuards,
        DelegationMode delegation) {

    public ToolDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        methodName = methodName != null ? methodName : name;
        location = location != null ? location : "<memory>";
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        docstring = docstring != null ? docstring : Docstring.empty();
        bodyShape = bodyShape != null ? bodyShape : new BodyShape(false, false, false);
        parameterValidationGuards =
                parameterValidationGuards != null
                        ? Collections.unmodifiableSet(new LinkedHashSet<>(parameterValidationGuards))
                        : Set.of();
        delegation = delegation != null ? delegation : DelegationMode.none();
    }

    /// Returns the names of all declared parameters, in order.
    public List<String> parameterNames() {
        return parameters.stream().map(ToolParameter::name).toList();
    }

    /// Starts a builder for a tool that is conformant in every respect except the
    /// ones the caller changes.
    ///
    /// @param name tool name, not null
    /// @return new builder, never null
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /// Returns a builder pre-filled with this definition's values.
    public Builder toBuilder() {
        Builder builder =
                new Builder(name)
                        .methodName(methodName)
                        .location(location)
                        .isAsyncCallable(isAsyncCallable)
                        .hasRegistrationMarker(hasRegistrationMarker)
                        .returnsPlainText(returnsPlainText)
                        .docstring(docstring)
                        .bodyShape(bodyShape)
                        .delegation(delegation);
        parameters.forEach(builder::parameter);
        parameterValidationGuards.forEach(builder::guard);
        return builder;
    }

    /// Fluent builder for hand-crafted definitions.
    ///
    /// @implNote Defaults describe a conformant direct-mode tool with no parameters,
    /// so a test changes exactly the facts it cares about.
    public static final class Builder {
        private final String name;
        private String methodName;
        private String location = "<memory>";
        private boolean isAsyncCallable = true;
        private boolean hasRegistrationMarker = true;
        private final List<ToolParameter> parameters = new ArrayList<>();
        private boolean returnsPlainText = true;
        private Docstring docstring;
        private BodyShape bodyShape = BodyShape.conformant();
        private final Set<String> guards = new LinkedHashSet<>();
        private DelegationMode delegation;

        private Builder(String name) {
            this.name = name;
            this.methodName = name;
            this.delegation = DelegationMode.direct(name);
        }

        public Builder methodName(String methodName) {
            this.methodName = methodName;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder isAsyncCallable(boolean isAsyncCallable) {
            this.isAsyncCallable = isAsyncCallable;
            return this;
        }

        public Builder hasRegistrationMarker(boolean hasRegistrationMarker) {
            this.hasRegistrationMarker = hasRegistrationMarker;
            return this;
        }

        public Builder parameter(ToolParameter parameter) {
            this.parameters.add(parameter);
            return this;
        }

        public Builder returnsPlainText(boolean returnsPlainText) {
            this.returnsPlainText = returnsPlainText;
            return this;
        }

        public Builder docstring(Docstring docstring) {
            this.docstring = docstring;
            return this;
        }

        public Builder bodyShape(BodyShape bodyShape) {
            this.bodyShape = bodyShape;
            return this;
        }

        public Builder guard(String parameterName) {
            this.guards.add(parameterName);
            return this;
        }

        public Builder clearGuards() {
            this.guards.clear();
            return this;
        }

        public Builder delegation(DelegationMode delegation) {
            this.delegation = delegation;
            return this;
        }

        /// Builds the definition. Without an explicit docstring, one is synthesized that
        /// documents every parameter with its name.
        public ToolDefinition build() {
            Docstring docs = docstring;
            if (docs == null) {
                Map<String, String> sections = new LinkedHashMap<>();
                parameters.forEach(p -> sections.put(p.name(), p.name()));
                docs = new Docstring("Runs " + name + ".", sections);
            }
            return new ToolDefinition(
                    name,
                    methodName,
                    location,
                    isAsyncCallable,
                    hasRegistrationMarker,
                    parameters,
                    returnsPlainText,
                    docs,
                    bodyShape,
                    guards,
                    delegation);
        }
    }
}
