package io.patchbay.core.harness;

import io.patchbay.core.convention.ParameterDomain;
import io.patchbay.core.model.ToolDefinition;
import io.patchbay.core.model.ToolParameter;
import io.patchbay.core.runtime.ToolContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// The standard cases every tool is run through.
///
/// 0. registration: marker, asynchronous, plain text
/// 1. unavailable dependency: error text, no raise, registry untouched
/// 2. happy path: the registry payload comes back as the result
/// 3. delegation failure: error text, no raise
/// 4. invalid parameter, one per restricted parameter: error text, registry untouched
///
/// Pure tools skip 1 and 3. Tools without restricted parameters skip 4, as does a parameter
/// whose documented domain covers its whole type.
public final class StandardBattery {

    /// Failure message of simulated delegation failures.
    public static final String SIMULATED_FAILURE = "Simulated delegation failure";

    private final Set<String> knownTargets;

    /// @param knownTargets handler names the available registry resolves, empty for any
    public StandardBattery(Set<String> knownTargets) {
        this.knownTargets = Set.copyOf(knownTargets);
    }

    public StandardBattery() {
        this(Set.of());
    }

    /// Payload the happy-path registry returns for a tool.
    public static String happyPayload(ToolDefinition definition) {
        return "Mock result for " + definition.name();
    }

    /// Builds the cases for a tool.
    ///
    /// @param definition the tool, not null
    /// @return cases in battery order, never empty
    public List<TestCase> casesFor(ToolDefinition definition) {
        List<TestCase> cases = new ArrayList<>();
        boolean delegates = definition.delegation().delegates();
        Map<String, Object> valid = SampleArguments.valid(definition);

        cases.add(
                TestCase.builder("registration")
                        .kind(CaseKind.REGISTRATION)
                        .registry(MockRegistryConfig.unavailable())
                        .expect(OutcomeKind.SUCCESS)
                        .build());

        if (delegates) {
            cases.add(
                    TestCase.builder("unavailable dependency")
                            .kind(CaseKind.UNAVAILABLE_DEPENDENCY)
                            .registry(MockRegistryConfig.unavailable())
                            .arguments(valid)
                            .expect(OutcomeKind.ERROR_MESSAGE)
                            .requireUntouchedRegistry()
                            .build());
        } else {
            cases.add(
                    TestCase.skipped(
                            "unavailable dependency",
                            CaseKind.UNAVAILABLE_DEPENDENCY,
                            "tool does not delegate"));
        }

        TestCase.Builder happy =
                TestCase.builder("happy path")
                        .kind(CaseKind.HAPPY_PATH)
                        .registry(registry(MockBehavior.returns(happyPayload(definition))))
                        .arguments(valid)
                        .expect(OutcomeKind.SUCCESS);
        if (delegates) {
            happy.expectResult(happyPayload(definition));
        }
        cases.add(happy.build());

        if (delegates) {
            cases.add(
                    TestCase.builder("delegation failure")
                            .kind(CaseKind.DELEGATION_FAILURE)
                            .registry(registry(MockBehavior.failsAsync(SIMULATED_FAILURE)))
                            .arguments(valid)
                            .expect(OutcomeKind.ERROR_MESSAGE)
                            .build());
        } else {
            cases.add(
                    TestCase.skipped(
                            "delegation failure",
                            CaseKind.DELEGATION_FAILURE,
                            "tool does not delegate"));
        }

        boolean anyRestricted = false;
        for (ToolParameter parameter : definition.parameters()) {
            Optional<ParameterDomain> domain = SampleArguments.domainOf(definition, parameter);
            if (domain.isEmpty()) {
                continue;
            }
            anyRestricted = true;
            if (!domain.get().hasInvalidValue(parameter.declaredType())) {
                cases.add(
                        TestCase.skipped(
                                "invalid " + parameter.name(),
                                CaseKind.INVALID_PARAMETER,
                                "no " + parameter.declaredType() + " value lies outside the documented domain"));
                continue;
            }
            cases.add(
                    TestCase.builder("invalid " + parameter.name())
                            .kind(CaseKind.INVALID_PARAMETER)
                            .registry(registry(MockBehavior.returns(happyPayload(definition))))
                            .arguments(SampleArguments.invalidFor(definition, parameter))
                            .expect(OutcomeKind.ERROR_MESSAGE)
                            .requireUntouchedRegistry()
                            .build());
        }
        if (!anyRestricted) {
            cases.add(
                    TestCase.skipped(
                            "invalid parameter",
                            CaseKind.INVALID_PARAMETER,
                            "no restricted parameters"));
        }
        return cases;
    }

    private MockRegistryConfig registry(MockBehavior behavior) {
        MockRegistryConfig.Builder builder = MockRegistryConfig.available().fallback(behavior);
        if (!knownTargets.isEmpty()) {
            builder.knownTargets(knownTargets).knownTargets(Set.of(ToolContext.DIRECT_TARGET));
        }
        return builder.build();
    }
}
