package io.patchbay.core.template;

import io.patchbay.core.convention.ParameterDomain;
import io.patchbay.core.convention.ToolConventions;
import io.patchbay.core.model.DelegationMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// Generates convention-correct tool source from a {@link ToolSpec}.
///
/// Output is deterministic: the same spec yields byte-identical text. Nothing time- or
/// environment-dependent is emitted and parameters keep their declared order.
///
/// ### Contracts
/// - **Precondition**: the spec passes {@link ToolSpecValidator}, otherwise
///   {@link ToolSpecException} is thrown before anything is emitted
/// - **Postcondition**: extracting the emitted source and validating it passes every
///   default rule
///
/// ### Usage
/// {@snippet :
/// GeneratedTool tool = new TemplateGenerator().generate(spec);
/// Files.writeString(target, tool.source());
/// CompletableFuture<String> reply = tool.function().invoke(context, Map.of("bpm", 120.0));
/// }
///
/// @implNote Stateless and thread-safe.
public class TemplateGenerator {

    private static final Logger logger = Logger.getLogger(TemplateGenerator.class.getName());

    private static final String INDENT = "    ";

    private static final Pattern PACKAGE_NAME =
            Pattern.compile("[a-z_][a-z0-9_]*(?:\\.[a-z_][a-z0-9_]*)*");

    private static final Pattern CLASS_NAME = Pattern.compile("[A-Z][A-Za-z0-9_]*");

    /// Generates one tool.
    ///
    /// @param spec tool description, not null
    /// @return source text plus its executable form, never null
    /// @throws ToolSpecException if the spec is invalid
    public GeneratedTool generate(ToolSpec spec) throws ToolSpecException {
        Objects.requireNonNull(spec, "spec must not be null");
        ToolSpecValidator.validate(spec);
        ToolBlueprint blueprint = ToolBlueprint.of(spec);
        String source = render(blueprint);
        logger.fine("Generated tool " + spec.name());
        return new GeneratedTool(spec, source, new BlueprintToolFunction(blueprint));
    }

    /// Generates a complete compilation unit holding several tools.
    ///
    /// @param packageName package of the unit, empty for the default package, not null
    /// @param className simple class name, not null
    /// @param specs tools in emission order, not empty
    /// @return compilation unit source, never null
    /// @throws ToolSpecException if any spec is invalid, names repeat, or the unit names are
    ///     not valid Java names; all problems are reported together
    public String generateUnit(String packageName, String className, List<ToolSpec> specs)
            throws ToolSpecException {
        List<String> problems = new ArrayList<>();
        if (!packageName.isEmpty() && !PACKAGE_NAME.matcher(packageName).matches()) {
            problems.add("package '" + packageName + "' is not a valid package name");
        }
        if (!CLASS_NAME.matcher(className).matches()) {
            problems.add("class '" + className + "' is not a valid class name");
        }
        if (specs.isEmpty()) {
            problems.add("a unit needs at least one tool");
        }
        Set<String> names = new HashSet<>();
        for (ToolSpec spec : specs) {
            if (!names.add(spec.name())) {
                problems.add("duplicate tool '" + spec.name() + "'");
            }
            ToolSpecValidator.problems(spec).forEach(p -> problems.add(spec.name() + ": " + p));
        }
        if (!problems.isEmpty()) {
            throw new ToolSpecException(problems);
        }

        List<ToolBlueprint> blueprints = specs.stream().map(ToolBlueprint::of).toList();
        StringBuilder out = new StringBuilder();
        if (!packageName.isEmpty()) {
            out.append("package ").append(packageName).append(";\n\n");
        }
        out.append("import io.patchbay.core.runtime.DelegationHandle;\n");
        out.append("import io.patchbay.core.runtime.McpTool;\n");
        if (blueprints.stream().anyMatch(ToolBlueprint::hasOptionalParameter)) {
            out.append("import io.patchbay.core.runtime.Param;\n");
        }
        out.append("import io.patchbay.core.runtime.ToolArguments;\n");
        out.append("import io.patchbay.core.runtime.ToolContext;\n");
        out.append("import io.patchbay.core.runtime.ToolResults;\n");
        if (blueprints.stream().anyMatch(ToolBlueprint::hasChoiceGuard)) {
            out.append("import java.util.List;\n");
        }
        out.append("import java.util.concurrent.CompletableFuture;\n\n");
        out.append("public class ").append(className).append(" {\n");
        for (ToolBlueprint blueprint : blueprints) {
            out.append('\n');
            for (String line : render(blueprint).split("\n")) {
                out.append(line.isEmpty() ? "" : INDENT + line).append('\n');
            }
        }
        out.append("}\n");
        logger.info("Generated unit " + className + " with " + specs.size() + " tools");
        return out.toString();
    }

    private String render(ToolBlueprint blueprint) {
        ToolSpec spec = blueprint.spec();
        StringBuilder out = new StringBuilder();

        out.append("/// ").append(spec.description().strip()).append('\n');
        if (!blueprint.parameters().isEmpty()) {
            out.append("///\n");
            for (ToolBlueprint.Slot slot : blueprint.parameters()) {
                out.append("/// @param ")
                        .append(slot.javaName())
                        .append(' ')
                        .append(slot.documentation())
                        .append('\n');
            }
        }

        out.append("@").append(ToolConventions.MARKER).append("(name = \"").append(spec.name())
                .append("\")\n");
        out.append("public CompletableFuture<String> ").append(blueprint.methodName())
                .append("(ToolContext context");
        for (ToolBlueprint.Slot slot : blueprint.parameters()) {
            out.append(", ");
            if (slot.optional()) {
                out.append("@Param(defaultValue = ")
                        .append(TypeMapping.quote(slot.defaultLiteral()))
                        .append(") ");
            }
            out.append(slot.javaType()).append(' ').append(slot.javaName());
        }
        out.append(") {\n");

        for (ToolBlueprint.Slot slot : blueprint.parameters()) {
            if (slot.domain().isEmpty()) {
                continue;
            }
            ParameterDomain domain = slot.domain().get();
            line(out, 1, "if (" + domain.violationCondition(slot.javaName(), slot.javaType(), slot.nullAllowed()) + ") {");
            line(out, 2, "return CompletableFuture.completedFuture("
                    + TypeMapping.quote(domain.violationMessage(slot.specName())) + ");");
            line(out, 1, "}");
        }

        String handle = blueprint.handleVariable();
        DelegationMode mode = blueprint.mode();
        String acquire =
                mode instanceof DelegationMode.Delegated delegated
                        ? "context.handler(" + TypeMapping.quote(delegated.target()) + ")"
                        : "context.direct()";

        line(out, 1, "try {");
        line(out, 2, "DelegationHandle " + handle + " = " + acquire + ";");
        line(out, 2, "if (" + handle + " == null) {");
        line(out, 3, "return CompletableFuture.completedFuture("
                + TypeMapping.quote(blueprint.unavailableMessage()) + ");");
        line(out, 2, "}");
        line(out, 2, "return " + handle + ".call(" + TypeMapping.quote(mode.method()) + ", "
                + argumentsExpression(blueprint) + ")");
        line(out, 4, ".thenApply(result -> ToolResults.firstText(result, "
                + TypeMapping.quote(blueprint.successFallback()) + "))");
        line(out, 4, ".exceptionally(e -> " + TypeMapping.quote(ToolConventions.ERROR_PREFIX)
                + " + ToolResults.describe(e));");
        line(out, 1, "} catch (Exception e) {");
        line(out, 2, "return CompletableFuture.completedFuture("
                + TypeMapping.quote(ToolConventions.ERROR_PREFIX) + " + e.getMessage());");
        line(out, 1, "}");
        out.append("}\n");
        return out.toString();
    }

    private static String argumentsExpression(ToolBlueprint blueprint) {
        List<String> pairs = new ArrayList<>();
        for (ToolBlueprint.Slot slot : blueprint.parameters()) {
            pairs.add(TypeMapping.quote(slot.specName()) + ", " + slot.javaName());
        }
        return "ToolArguments.of(" + String.join(", ", pairs) + ")";
    }

    private static void line(StringBuilder out, int depth, String text) {
        out.append(INDENT.repeat(depth)).append(text).append('\n');
    }
}
