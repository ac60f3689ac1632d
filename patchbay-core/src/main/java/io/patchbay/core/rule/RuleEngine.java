package io.patchbay.core.rule;

import io.patchbay.core.model.ToolDefinition;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Evaluates every rule against a tool and aggregates the verdicts.
///
/// Evaluation is exhaustive: all rules run even after a failure, so one report lists
/// every violation. The report passes iff every verdict passed.
///
/// ### Contracts
/// - **Precondition**: rule ids are unique
/// - **Postcondition**: one verdict per rule, in registration order
/// - **Invariant**: a rule that throws yields a failed verdict, never an exception
///
/// ### Usage
/// {@snippet :
/// RuleEngine engine = RuleEngine.builder()
///         .withDefaultRules()
///         .rule(new MyProjectRule())
///         .build();
/// ValidationReport report = engine.validate(definition);
/// }
///
/// @implNote Thread-safe. The rule list is fixed at construction and rules are stateless.
/// @see ToolRule for the predicate contract
public final class RuleEngine {

    private static final Logger logger = Logger.getLogger(RuleEngine.class.getName());

    private final List<ToolRule> rules;

    private RuleEngine(List<ToolRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /// Returns an engine with the canonical rules in canonical order.
    public static RuleEngine withDefaults() {
        return builder().withDefaultRules().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the canonical rules in canonical order.
    public static List<ToolRule> defaultRules() {
        return List.of(
                new RegistrationMarkerRule(),
                new AsyncCallableRule(),
                new TextReturnRule(),
                new FailureBoundaryRule(),
                new InitializationGuardRule(),
                new ErrorPrefixRule(),
                new DocstringRule(),
                new ParameterGuardRule());
    }

    public List<ToolRule> rules() {
        return rules;
    }

    /// Validates one tool against every rule.
    ///
    /// @param definition tool to validate, not null
    /// @return report with one verdict per rule, never null
    public ValidationReport validate(ToolDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        List<Verdict> verdicts = new ArrayList<>(rules.size());
        for (ToolRule rule : rules) {
            verdicts.add(evaluate(rule, definition));
        }
        ValidationReport report = ValidationReport.of(definition.name(), verdicts);
        logger.fine(
                "Validated " + definition.name() + ": "
                        + (report.overallPassed() ? "passed" : "failed " + report.failedRuleIds()));
        return report;
    }

    private Verdict evaluate(ToolRule rule, ToolDefinition definition) {
        try {
            Verdict verdict = rule.evaluate(definition);
            if (verdict == null) {
                return Verdict.fail(rule.id(), "Rule returned no verdict", "Fix rule " + rule.id());
            }
            return verdict;
        } catch (RuntimeException e) {
            logger.log(
                    Level.WARNING,
                    "Rule " + rule.id() + " failed on tool " + definition.name(),
                    e);
            return Verdict.fail(
                    rule.id(),
                    "Rule crashed: " + e.getClass().getSimpleName() + ": " + e.getMessage(),
                    "Fix rule " + rule.id());
        }
    }

    /// Collects rules in evaluation order.
    public static final class Builder {
        private final List<ToolRule> rules = new ArrayList<>();
        private final Set<String> ids = new HashSet<>();

        private Builder() {}

        public Builder withDefaultRules() {
            defaultRules().forEach(this::rule);
            return this;
        }

        /// Appends a rule after the ones already added.
        ///
        /// @throws IllegalArgumentException if a rule with the same id is present
        public Builder rule(ToolRule rule) {
            Objects.requireNonNull(rule, "rule must not be null");
            if (!ids.add(rule.id())) {
                throw new IllegalArgumentException("Duplicate rule id: " + rule.id());
            }
            rules.add(rule);
            return this;
        }

        public RuleEngine build() {
            return new RuleEngine(rules);
        }
    }
}
