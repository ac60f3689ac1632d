package io.patchbay.core.rule;

import io.patchbay.core.convention.ParameterDomain;
import io.patchbay.core.convention.ParameterDomains;
import io.patchbay.core.model.ToolDefinition;
import io.patchbay.core.model.ToolParameter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// Every restricted-domain parameter is guarded before delegation.
///
/// A parameter is restricted when its documentation names a numeric range or a choice
/// set that fits its declared type. Recognition is a prose heuristic, hence
/// {@link RuleKind#HEURISTIC}.
///
/// @see ParameterDomains#forParameter(String, String)
public final class ParameterGuardRule implements ToolRule {

    public static final String ID = "parameter-guards";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Restricted-domain parameters are validated before delegation";
    }

    @Override
    public RuleKind kind() {
        return RuleKind.HEURISTIC;
    }

    @Override
    public Verdict evaluate(ToolDefinition definition) {
        List<String> unguarded = new ArrayList<>();
        List<String> hints = new ArrayList<>();
        for (ToolParameter parameter : definition.parameters()) {
            Optional<ParameterDomain> domain =
                    ParameterDomains.forParameter(
                            definition.docstring().describe(parameter.name()),
                            parameter.declaredType());
            if (domain.isEmpty()
                    || definition.parameterValidationGuards().contains(parameter.name())) {
                continue;
            }
            unguarded.add(parameter.name());
            boolean nullAllowed = parameter.optional() && "null".equals(parameter.defaultValue());
            hints.add(
                    "if ("
                            + domain.get()
                                    .violationCondition(
                                            parameter.name(), parameter.declaredType(), nullAllowed)
                            + ") return \""
                            + domain.get().violationMessage(parameter.name())
                            + "\"");
        }
        if (unguarded.isEmpty()) {
            return Verdict.pass(ID, "Restricted parameters are guarded");
        }
        return Verdict.fail(
                ID,
                "Unguarded restricted parameters: " + String.join(", ", unguarded),
                "Before delegating, add " + String.join("; ", hints));
    }
}
