package io.patchbay.core.rule;

import io.patchbay.core.model.ToolDefinition;

/// Failures, synchronous and asynchronous, are converted to error text.
///
/// For a delegating tool the delegation call must sit inside a `try` with a broad
/// `catch`, and the delegation future must carry a recovery stage. A pure tool needs the
/// `try` only.
public final class FailureBoundaryRule implements ToolRule {

    public static final String ID = "failure-boundary";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Delegation is enclosed by a boundary that turns failures into text";
    }

    @Override
    public Verdict evaluate(ToolDefinition definition) {
        if (definition.bodyShape().hasSurroundingFailureBoundary()) {
            return Verdict.pass(ID, "Failure boundary present");
        }
        if (!definition.delegation().delegates()) {
            return Verdict.fail(
                    ID,
                    "Tool " + definition.name() + " has no failure boundary",
                    "Wrap the body in try { ... } catch (Exception e) and return "
                            + "\"Error: \" + e.getMessage()");
        }
        return Verdict.fail(
                ID,
                "Delegation in " + definition.name() + " is not enclosed by a failure boundary",
                "Wrap the call in try { ... } catch (Exception e) and add "
                        + ".exceptionally(e -> \"Error: \" + ToolResults.describe(e)) to the call");
    }
}
