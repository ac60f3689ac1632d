package io.patchbay.core.rule;

import io.patchbay.core.convention.ToolConventions;
import io.patchbay.core.model.ToolDefinition;

/// Every error-path return begins with the canonical prefix.
public final class ErrorPrefixRule implements ToolRule {

    public static final String ID = "error-prefix";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Error messages start with \"" + ToolConventions.ERROR_PREFIX + "\"";
    }

    @Override
    public Verdict evaluate(ToolDefinition definition) {
        if (definition.bodyShape().errorMessagePrefixConsistent()) {
            return Verdict.pass(ID, "Error messages use the canonical prefix");
        }
        return Verdict.fail(
                ID,
                "Tool " + definition.name() + " returns an error message without the canonical prefix",
                "Start every error-path return in " + definition.methodName() + " with \""
                        + ToolConventions.ERROR_PREFIX + "\"");
    }
}
