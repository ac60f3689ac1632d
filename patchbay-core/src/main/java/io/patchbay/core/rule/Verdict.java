package io.patchbay.core.rule;

import java.util.Objects;

/// Outcome of one rule against one tool.
///
/// @param ruleId id of the rule that produced the verdict, not null
/// @param passed whether the tool satisfies the rule
/// @param message what was found, not null
/// @param suggestion remediation for a failure, empty when passed
public record Verdict(String ruleId, boolean passed, String message, String suggestion) {

    public Verdict {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        message = message != null ? message : "";
        suggestion = suggestion != null ? suggestion : "";
    }

    public static Verdict pass(String ruleId, String message) {
        return new Verdict(ruleId, true, message, "");
    }

    public static Verdict fail(String ruleId, String message, String suggestion) {
        return new Verdict(ruleId, false, message, suggestion);
    }
}
