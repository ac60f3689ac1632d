package io.patchbay.core.template;

import io.patchbay.core.convention.ParameterDomain;
import io.patchbay.core.convention.ParameterDomains;
import io.patchbay.core.convention.ToolConventions;
import io.patchbay.core.model.DelegationMode;
import java.util.List;
import java.util.Optional;

/// Resolved form of a valid {@link ToolSpec}, shared by the source renderer and the
/// executable tool function.
///
/// Both read the same guards, the same delegation target and the same messages, so the
/// emitted text and the in-memory behavior cannot drift apart.
///
/// @param spec the originating spec, not null
/// @param methodName Java method name, not null
/// @param parameters resolved parameters in signature order, not null
/// @param successFallback message returned when the delegation result carries no text
record ToolBlueprint(
        ToolSpec spec, String methodName, List<Slot> parameters, String successFallback) {

    /// One resolved parameter.
    ///
    /// @param specName name exposed to callers and passed to the delegation layer
    /// @param javaName Java identifier in the generated signature
    /// @param javaType Java type in the generated signature
    /// @param documentation `@param` text including any default note
    /// @param optional whether the parameter has a default
    /// @param defaultValue runtime default, null when required or defaulting to null
    /// @param defaultLiteral default as a Java literal, null when required
    /// @param domain restricted domain, empty when unrestricted
    record Slot(
            String specName,
            String javaName,
            String javaType,
            String documentation,
            boolean optional,
            Object defaultValue,
            String defaultLiteral,
            Optional<ParameterDomain> domain) {

        /// Whether `null` is a legal value for this parameter.
        boolean nullAllowed() {
            return optional && defaultValue == null;
        }
    }

    /// Resolves a spec that already passed {@link ToolSpecValidator}.
    static ToolBlueprint of(ToolSpec spec) {
        List<Slot> slots =
                spec.parameters().stream().map(ToolBlueprint::slot).toList();
        String description = spec.description().strip();
        String subject =
                description.endsWith(".")
                        ? description.substring(0, description.length() - 1)
                        : description;
        return new ToolBlueprint(
                spec, ToolConventions.toCamelCase(spec.name()), slots, subject + " completed");
    }

    private static Slot slot(ParameterSpec parameter) {
        boolean nullable = parameter.optional() && parameter.defaultValue() == null;
        String javaType = TypeMapping.javaType(parameter.type(), nullable).orElseThrow();
        String description = parameter.description().strip();
        String literal = null;
        Object defaultValue = null;
        if (parameter.optional()) {
            literal = TypeMapping.literal(parameter.defaultValue(), javaType);
            defaultValue =
                    parameter.defaultValue() == null
                            ? null
                            : TypeMapping.coerce(parameter.defaultValue(), javaType);
            description = description + " (default: " + literal + ")";
        }
        return new Slot(
                parameter.name(),
                ToolConventions.toCamelCase(parameter.name()),
                javaType,
                description,
                parameter.optional(),
                defaultValue,
                literal,
                ParameterDomains.forParameter(parameter.description(), javaType));
    }

    DelegationMode mode() {
        return spec.mode();
    }

    /// Message returned when the delegation handle is unavailable.
    String unavailableMessage() {
        return spec.mode() instanceof DelegationMode.Delegated
                ? ToolConventions.HANDLER_UNAVAILABLE
                : ToolConventions.BACKEND_UNAVAILABLE;
    }

    /// Local variable holding the delegation handle in generated code.
    String handleVariable() {
        return spec.mode() instanceof DelegationMode.Delegated ? "handler" : "backend";
    }

    boolean hasChoiceGuard() {
        return parameters.stream()
                .anyMatch(p -> p.domain().filter(ParameterDomain.Choice.class::isInstance).isPresent());
    }

    boolean hasOptionalParameter() {
        return parameters.stream().anyMatch(Slot::optional);
    }
}
