package io.patchbay.core.rule;

import io.patchbay.core.model.ToolDefinition;

/// The tool is asynchronously invocable.
public final class AsyncCallableRule implements ToolRule {

    public static final String ID = "async-callable";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Tool returns a CompletableFuture or CompletionStage";
    }

    @Override
    public Verdict evaluate(ToolDefinition definition) {
        if (definition.isAsyncCallable()) {
            return Verdict.pass(ID, "Tool is asynchronous");
        }
        return Verdict.fail(
                ID,
                "Tool " + definition.name() + " is synchronous",
                "Change the return type of " + definition.methodName()
                        + " to CompletableFuture<String>");
    }
}
