package io.patchbay.core.template;

import io.patchbay.core.convention.ToolConventions;
import io.patchbay.core.model.DelegationMode;
import io.patchbay.core.runtime.DelegationHandle;
import io.patchbay.core.runtime.ToolContext;
import io.patchbay.core.runtime.ToolFunction;
import io.patchbay.core.runtime.ToolResults;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/// Executes a {@link ToolBlueprint} the way its rendered source would.
///
/// Step for step: parameter guards, acquisition and availability check, delegation with
/// the first-text unwrap, and the two-level failure boundary. Arguments are keyed by the
/// Java parameter names.
final class BlueprintToolFunction implements ToolFunction {

    private final ToolBlueprint blueprint;

    BlueprintToolFunction(ToolBlueprint blueprint) {
        this.blueprint = blueprint;
    }

    @Override
    public CompletableFuture<String> invoke(ToolContext context, Map<String, Object> arguments) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (ToolBlueprint.Slot slot : blueprint.parameters()) {
            Object value;
            if (arguments.containsKey(slot.javaName())) {
                value = TypeMapping.coerce(arguments.get(slot.javaName()), slot.javaType());
            } else if (slot.optional()) {
                value = slot.defaultValue();
            } else {
                throw new IllegalArgumentException("Missing required argument: " + slot.javaName());
            }
            values.put(slot.specName(), value);
        }

        for (ToolBlueprint.Slot slot : blueprint.parameters()) {
            if (slot.domain().isPresent()
                    && slot.domain().get().rejects(values.get(slot.specName()), slot.nullAllowed())) {
                return CompletableFuture.completedFuture(
                        slot.domain().get().violationMessage(slot.specName()));
            }
        }

        try {
            DelegationMode mode = blueprint.mode();
            DelegationHandle handle =
                    mode instanceof DelegationMode.Delegated delegated
                            ? context.handler(delegated.target())
                            : context.direct();
            if (handle == null) {
                return CompletableFuture.completedFuture(blueprint.unavailableMessage());
            }
            return handle.call(mode.method(), Collections.unmodifiableMap(values))
                    .thenApply(result -> ToolResults.firstText(result, blueprint.successFallback()))
                    .exceptionally(e -> ToolConventions.ERROR_PREFIX + ToolResults.describe(e));
        } catch (Exception e) {
            return CompletableFuture.completedFuture(ToolConventions.ERROR_PREFIX + e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "BlueprintToolFunction[" + blueprint.spec().name() + "]";
    }
}
