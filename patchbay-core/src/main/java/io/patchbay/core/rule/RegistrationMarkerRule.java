package io.patchbay.core.rule;

import io.patchbay.core.convention.ToolConventions;
import io.patchbay.core.model.ToolDefinition;

/// The tool carries the canonical `@McpTool` marker, bare or with a snake_case name.
public final class RegistrationMarkerRule implements ToolRule {

    public static final String ID = "registration-marker";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Tool is registered with the canonical @" + ToolConventions.MARKER + " marker";
    }

    @Override
    public Verdict evaluate(ToolDefinition definition) {
        if (definition.hasRegistrationMarker()) {
            return Verdict.pass(ID, "Registration marker present");
        }
        return Verdict.fail(
                ID,
                "Tool " + definition.name() + " lacks a well-formed registration marker",
                "Annotate " + definition.methodName() + " with @" + ToolConventions.MARKER
                        + "(name = \"" + definition.name() + "\")");
    }
}
