package io.patchbay.core.rule;

import java.util.List;
import java.util.Objects;

/// All verdicts for one tool, in rule-engine order.
///
/// @param toolName validated tool, not null
/// @param verdicts one verdict per rule, in engine order, not null
/// @param overallPassed true iff every verdict passed
public record ValidationReport(String toolName, List<Verdict> verdicts, boolean overallPassed) {

    public ValidationReport {
        Objects.requireNonNull(toolName, "toolName must not be null");
        verdicts = verdicts != null ? List.copyOf(verdicts) : List.of();
        boolean all = verdicts.stream().allMatch(Verdict::passed);
        if (overallPassed != all) {
            throw new IllegalArgumentException("overallPassed must equal the AND of all verdicts");
        }
    }

    /// Aggregates verdicts into a report.
    public static ValidationReport of(String toolName, List<Verdict> verdicts) {
        return new ValidationReport(
                toolName, verdicts, verdicts.stream().allMatch(Verdict::passed));
    }

    /// Returns the ids of the failed rules, in engine order.
    public List<String> failedRuleIds() {
        return verdicts.stream().filter(v -> !v.passed()).map(Verdict::ruleId).toList();
    }
}
