package io.patchbay.core.harness;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// One scenario to run a tool through.
///
/// ### Usage
/// {@snippet :
/// TestCase tooFast = TestCase.builder("rejects out-of-range tempo")
///         .registry(MockRegistryConfig.available().build())
///         .argument("bpm", 999.0)
///         .expect(OutcomeKind.ERROR_MESSAGE)
///         .expectResult("Error: bpm must be between 60 and 200")
///         .requireUntouchedRegistry()
///         .build();
/// }
///
/// @param description human-readable name, not null
/// @param kind which check the case performs, not null
/// @param registryConfig recipe for the fresh registry, not null
/// @param invocationArgs arguments keyed by Java parameter name, nulls allowed
/// @param expectedOutcomeKind expected outcome, not null
/// @param expectedResult exact expected text, null to check the kind only
/// @param requireUntouchedRegistry whether any delegation call is a failure
/// @param skipReason why the case does not apply, null for runnable cases
public record TestCase(
        String description,
        CaseKind kind,
        MockRegistryConfig registryConfig,
        Map<String, Object> invocationArgs,
        OutcomeKind expectedOutcomeKind,
        String expectedResult,
        boolean requireUntouchedRegistry,
        String skipReason) {

    public TestCase {
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(expectedOutcomeKind, "expectedOutcomeKind must not be null");
        registryConfig = registryConfig != null ? registryConfig : MockRegistryConfig.unavailable();
        invocationArgs =
                invocationArgs != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(invocationArgs))
                        : Map.of();
    }

    /// A case that is reported as skipped without running.
    public static TestCase skipped(String description, CaseKind kind, String reason) {
        return new TestCase(
                description, kind, null, null, OutcomeKind.SKIPPED, null, false, reason);
    }

    public boolean isSkipped() {
        return skipReason != null;
    }

    public static Builder builder(String description) {
        return new Builder(description);
    }

    public static final class Builder {
        private final String description;
        private CaseKind kind = CaseKind.CUSTOM;
        private MockRegistryConfig registryConfig = MockRegistryConfig.available().build();
        private final Map<String, Object> invocationArgs = new LinkedHashMap<>();
        private OutcomeKind expectedOutcomeKind = OutcomeKind.SUCCESS;
        private String expectedResult;
        private boolean requireUntouchedRegistry;

        private Builder(String description) {
            this.description = description;
        }

        public Builder kind(CaseKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder registry(MockRegistryConfig registryConfig) {
            this.registryConfig = registryConfig;
            return this;
        }

        public Builder argument(String name, Object value) {
            this.invocationArgs.put(name, value);
            return this;
        }

        public Builder arguments(Map<String, Object> arguments) {
            this.invocationArgs.putAll(arguments);
            return this;
        }

        public Builder expect(OutcomeKind expectedOutcomeKind) {
            this.expectedOutcomeKind = expectedOutcomeKind;
            return this;
        }

        public Builder expectResult(String expectedResult) {
            this.expectedResult = expectedResult;
            return this;
        }

        public Builder requireUntouchedRegistry() {
            this.requireUntouchedRegistry = true;
            return this;
        }

        public TestCase build() {
            return new TestCase(
                    description,
                    kind,
                    registryConfig,
                    invocationArgs,
                    expectedOutcomeKind,
                    expectedResult,
                    requireUntouchedRegistry,
                    null);
        }
    }
}
