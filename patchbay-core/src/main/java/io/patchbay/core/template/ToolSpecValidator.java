package io.patchbay.core.template;

import io.patchbay.core.convention.ParameterDomain;
import io.patchbay.core.convention.ParameterDomains;
import io.patchbay.core.convention.ToolConventions;
import io.patchbay.core.model.DelegationMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/// Checks a {@link ToolSpec} before any source is emitted.
///
/// Collects every problem instead of stopping at the first one.
public final class ToolSpecValidator {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /// Names the generated body declares itself.
    static final Set<String> RESERVED_NAMES = Set.of("context", "handler", "backend", "result", "e");

    private static final Set<String> JAVA_KEYWORDS =
            Set.of(
                    "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char",
                    "class", "const", "continue", "default", "do", "double", "else", "enum",
                    "extends", "final", "finally", "float", "for", "goto", "if", "implements",
                    "import", "instanceof", "int", "interface", "long", "native", "new", "package",
                    "private", "protected", "public", "return", "short", "static", "strictfp",
                    "super", "switch", "synchronized", "this", "throw", "throws", "transient",
                    "try", "void", "volatile", "while", "true", "false", "null", "yield");

    private ToolSpecValidator() {}

    /// Validates a spec.
    ///
    /// @param spec the spec to check, not null
    /// @throws ToolSpecException listing every problem found
    public static void validate(ToolSpec spec) throws ToolSpecException {
        List<String> problems = problems(spec);
        if (!problems.isEmpty()) {
            throw new ToolSpecException(problems);
        }
    }

    /// Returns every problem of a spec, empty when it is valid.
    public static List<String> problems(ToolSpec spec) {
        List<String> problems = new ArrayList<>();

        if (!ToolConventions.isSnakeCase(spec.name())) {
            problems.add("name '" + spec.name() + "' must be a snake_case identifier");
        } else if (JAVA_KEYWORDS.contains(ToolConventions.toCamelCase(spec.name()))) {
            problems.add("name '" + spec.name() + "' maps to a Java keyword");
        }
        if (spec.description().isBlank()) {
            problems.add("description must not be blank");
        } else if (spec.description().contains("\n")) {
            problems.add("description must be a single line");
        }

        DelegationMode mode = spec.mode();
        if (!mode.delegates()) {
            problems.add("mode must be Delegated or Direct");
        } else {
            if (mode instanceof DelegationMode.Delegated delegated
                    && !IDENTIFIER.matcher(delegated.target()).matches()) {
                problems.add("handler target '" + delegated.target() + "' must be an identifier");
            }
            if (!IDENTIFIER.matcher(mode.method()).matches()) {
                problems.add("method '" + mode.method() + "' must be an identifier");
            }
        }

        Set<String> seen = new HashSet<>();
        Set<String> javaNames = new HashSet<>();
        for (ParameterSpec parameter : spec.parameters()) {
            problems.addAll(parameterProblems(parameter));
            if (!seen.add(parameter.name())) {
                problems.add("duplicate parameter '" + parameter.name() + "'");
            } else if (ToolConventions.isSnakeCase(parameter.name())
                    && !javaNames.add(ToolConventions.toCamelCase(parameter.name()))) {
                problems.add(
                        "parameter '" + parameter.name() + "' collides with another parameter in Java");
            }
        }
        return problems;
    }

    private static List<String> parameterProblems(ParameterSpec parameter) {
        List<String> problems = new ArrayList<>();
        String label = "parameter '" + parameter.name() + "'";

        if (!ToolConventions.isSnakeCase(parameter.name())) {
            problems.add(label + " must be a snake_case identifier");
        } else {
            String javaName = ToolConventions.toCamelCase(parameter.name());
            if (RESERVED_NAMES.contains(javaName) || JAVA_KEYWORDS.contains(javaName)) {
                problems.add(label + " uses a reserved name");
            }
        }
        if (parameter.description().isBlank()) {
            problems.add(label + " needs a description");
        } else if (parameter.description().contains("\n")) {
            problems.add(label + " description must be a single line");
        }

        if (!TypeMapping.isKnown(parameter.type())) {
            problems.add(label + " has unknown type '" + parameter.type() + "'");
            return problems;
        }
        boolean nullable = parameter.optional() && parameter.defaultValue() == null;
        String declared = TypeMapping.javaType(parameter.type(), nullable).orElseThrow();
        if (ParameterDomains.forParameter(parameter.description(), declared).orElse(null)
                        instanceof ParameterDomain.NumericRange range
                && !range.fitsType(declared)) {
            problems.add(
                    label + " range " + ParameterDomain.NumericRange.format(range.min()) + " to "
                            + ParameterDomain.NumericRange.format(range.max())
                            + " does not fit type " + parameter.type());
        }
        if (!parameter.optional()) {
            if (parameter.defaultValue() != null) {
                problems.add(label + " is required but declares a default");
            }
            return problems;
        }

        Object value = parameter.defaultValue();
        String javaType = TypeMapping.javaType(parameter.type(), value == null).orElseThrow();
        if (!TypeMapping.accepts(javaType, value)) {
            problems.add(label + " default " + value + " does not fit type " + parameter.type());
            return problems;
        }
        Optional<ParameterDomain> domain =
                ParameterDomains.forParameter(parameter.description(), javaType);
        if (domain.isPresent() && domain.get().rejects(value, true)) {
            problems.add(label + " default " + value + " lies outside its documented domain");
        }
        return problems;
    }
}
