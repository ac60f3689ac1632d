package io.patchbay.core.harness;

import io.patchbay.core.convention.ParameterDomain;
import io.patchbay.core.convention.ParameterDomains;
import io.patchbay.core.model.ToolDefinition;
import io.patchbay.core.model.ToolParameter;
import io.patchbay.core.template.TypeMapping;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/// Builds plausible arguments for a tool from its definition.
///
/// Per parameter, in order of preference: a sample from its documented domain, its
/// declared default, then a fixed value for its type.
public final class SampleArguments {

    private SampleArguments() {}

    /// Returns valid arguments keyed by parameter name.
    public static Map<String, Object> valid(ToolDefinition definition) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        for (ToolParameter parameter : definition.parameters()) {
            arguments.put(parameter.name(), sample(definition, parameter));
        }
        return arguments;
    }

    /// Returns valid arguments except for one parameter, which gets an out-of-domain value.
    ///
    /// @param definition the tool, not null
    /// @param parameter a restricted parameter of the tool, not null
    /// @return arguments keyed by parameter name
    /// @throws IllegalArgumentException if the parameter has no documented domain
    public static Map<String, Object> invalidFor(ToolDefinition definition, ToolParameter parameter) {
        ParameterDomain domain =
                domainOf(definition, parameter)
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "Parameter has no restricted domain: "
                                                        + parameter.name()));
        Map<String, Object> arguments = valid(definition);
        arguments.put(parameter.name(), domain.invalidValue(parameter.declaredType()));
        return arguments;
    }

    /// Returns the documented domain of a parameter, if it restricts the declared type.
    public static Optional<ParameterDomain> domainOf(ToolDefinition definition, ToolParameter parameter) {
        return ParameterDomains.forParameter(
                definition.docstring().describe(parameter.name()), parameter.declaredType());
    }

    private static Object sample(ToolDefinition definition, ToolParameter parameter) {
        Optional<ParameterDomain> domain = domainOf(definition, parameter);
        if (domain.isPresent()) {
            return domain.get().sampleValue(parameter.declaredType());
        }
        if (parameter.optional() && parameter.defaultValue() != null) {
            try {
                return TypeMapping.parseLiteral(parameter.defaultValue(), parameter.declaredType());
            } catch (IllegalArgumentException e) {
                return byType(parameter.declaredType());
            }
        }
        return byType(parameter.declaredType());
    }

    static Object byType(String javaType) {
        return switch (javaType) {
            case "int", "Integer" -> 1;
            case "long", "Long" -> 1L;
            case "short", "Short" -> (short) 1;
            case "byte", "Byte" -> (byte) 1;
            case "double", "Double", "Number" -> 1.0;
            case "float", "Float" -> 1.0f;
            case "boolean", "Boolean" -> true;
            case "String", "CharSequence" -> "test_value";
            default -> null;
        };
    }
}
