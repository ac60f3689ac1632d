package io.patchbay.core.rule;

import io.patchbay.core.convention.ToolConventions;
import io.patchbay.core.model.DelegationMode;
import io.patchbay.core.model.ToolDefinition;

/// The delegation handle is checked for availability before use.
///
/// Vacuously satisfied by tools that do not delegate.
public final class InitializationGuardRule implements ToolRule {

    public static final String ID = "initialization-guard";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Delegation handle is null-checked before its first use";
    }

    @Override
    public Verdict evaluate(ToolDefinition definition) {
        DelegationMode mode = definition.delegation();
        if (!mode.delegates()) {
            return Verdict.pass(ID, "Tool does not delegate");
        }
        if (definition.bodyShape().hasGuardedInitializationCheck()) {
            return Verdict.pass(ID, "Availability check precedes delegation");
        }
        String acquire;
        String message;
        if (mode instanceof DelegationMode.Delegated delegated) {
            acquire = "context.handler(\"" + delegated.target() + "\")";
            message = ToolConventions.HANDLER_UNAVAILABLE;
        } else {
            acquire = "context.direct()";
            message = ToolConventions.BACKEND_UNAVAILABLE;
        }
        return Verdict.fail(
                ID,
                "Tool " + definition.name() + " uses its delegation handle without checking it",
                "Assign " + acquire + " to a variable and return \"" + message
                        + "\" when it is null, before calling it");
    }
}
