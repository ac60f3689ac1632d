package io.patchbay.core.rule;

import io.patchbay.core.model.ToolDefinition;

/// The tool's eventual result is plain text.
public final class TextReturnRule implements ToolRule {

    public static final String ID = "text-return";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Tool result is a String";
    }

    @Override
    public Verdict evaluate(ToolDefinition definition) {
        if (definition.returnsPlainText()) {
            return Verdict.pass(ID, "Tool returns text");
        }
        return Verdict.fail(
                ID,
                "Tool " + definition.name() + " does not declare a String result",
                "Declare CompletableFuture<String> and format structured results as text");
    }
}
