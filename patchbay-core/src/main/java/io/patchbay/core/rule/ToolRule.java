package io.patchbay.core.rule;

import io.patchbay.core.model.ToolDefinition;

/// A single convention predicate over a {@link ToolDefinition}.
///
/// Rules are pure and independent: a verdict depends only on the definition, never on
/// another rule's verdict or on evaluation order.
///
/// @see RuleEngine for aggregation
public interface ToolRule {

    /// Stable identifier, e.g. `registration-marker`.
    String id();

    /// One-line human description.
    String description();

    default RuleKind kind() {
        return RuleKind.STRUCTURAL;
    }

    /// Evaluates the rule.
    ///
    /// @param definition the tool to check, not null
    /// @return verdict carrying this rule's id, never null
    Verdict evaluate(ToolDefinition definition);
}
