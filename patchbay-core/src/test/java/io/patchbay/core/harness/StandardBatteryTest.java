package io.patchbay.core.harness;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.patchbay.core.extract.ToolExtractionException;
import io.patchbay.core.extract.ToolModelExtractor;
import io.patchbay.core.model.Docstring;
import io.patchbay.core.model.ToolDefinition;
import io.patchbay.core.model.ToolParameter;
import io.patchbay.core.runtime.ToolContext;
import io.patchbay.core.template.ParameterPresets;
import io.patchbay.core.template.TemplateGenerator;
import io.patchbay.core.template.ToolSpec;
import io.patchbay.core.template.ToolSpecException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StandardBatteryTest {

    private static final String PING =
            """
            /// Answer with pong
            @McpTool(name = "ping")
            public CompletableFuture<String> ping(ToolContext context) {
                try {
                    return CompletableFuture.completedFuture("pong");
                } catch (Exception e) {
                    return CompletableFuture.completedFuture("Error: " + e.getMessage());
                }
            }
            """;

    private ToolDefinition setTempo;
    private StandardBattery battery;

    @BeforeEach
    void setUp() throws ToolSpecException, ToolExtractionException {
        ToolSpec spec =
                ToolSpec.builder("set_tempo")
                        .description("Set the session tempo")
                        .delegated("transport", "set_tempo")
                        .parameter(ParameterPresets.BPM)
                        .build();
        setTempo =
                new ToolModelExtractor()
                        .extract("set_tempo", new TemplateGenerator().generate(spec).source());
        battery = new StandardBattery();
    }

    @Test
    void shouldBuildEveryCaseForDelegatingRestrictedTool() {
        // When
        List<TestCase> cases = battery.casesFor(setTempo);

        // Then
        assertThat(cases)
                .extracting(TestCase::kind)
                .containsExactly(
                        CaseKind.REGISTRATION,
                        CaseKind.UNAVAILABLE_DEPENDENCY,
                        CaseKind.HAPPY_PATH,
                        CaseKind.DELEGATION_FAILURE,
                        CaseKind.INVALID_PARAMETER);
        assertThat(cases).noneMatch(TestCase::isSkipped);

        TestCase unavailable = cases.get(1);
        assertThat(unavailable.registryConfig().online()).isFalse();
        assertThat(unavailable.invocationArgs()).containsEntry("bpm", 60.0);
        assertThat(unavailable.requireUntouchedRegistry()).isTrue();

        TestCase happy = cases.get(2);
        assertThat(happy.expectedResult()).isEqualTo("Mock result for set_tempo");
        assertThat(happy.registryConfig().behaviorOf("transport", "set_tempo"))
                .isEqualTo(MockBehavior.returns("Mock result for set_tempo"));

        assertThat(cases.get(3).registryConfig().behaviorOf("transport", "set_tempo"))
                .isEqualTo(MockBehavior.failsAsync(StandardBattery.SIMULATED_FAILURE));

        TestCase invalid = cases.get(4);
        assertThat(invalid.description()).isEqualTo("invalid bpm");
        assertThat(invalid.invocationArgs()).containsEntry("bpm", 201.0);
        assertThat(invalid.expectedOutcomeKind()).isEqualTo(OutcomeKind.ERROR_MESSAGE);
        assertThat(invalid.requireUntouchedRegistry()).isTrue();
    }

    @Test
    void shouldSkipDelegationCasesForPureTool() throws ToolExtractionException {
        ToolDefinition ping = new ToolModelExtractor().extract("ping", PING);

        List<TestCase> cases = battery.casesFor(ping);

        assertThat(cases)
                .extracting(TestCase::description, TestCase::isSkipped)
                .containsExactly(
                        tuple("registration", false),
                        tuple("unavailable dependency", true),
                        tuple("happy path", false),
                        tuple("delegation failure", true),
                        tuple("invalid parameter", true));
        // Without delegation the payload cannot surface, so only the kind is checked
        assertThat(cases.get(2).expectedResult()).isNull();
    }

    @Test
    void shouldSendInvalidValueTheDeclaredTypeCanHold() {
        // Given
        ToolDefinition seek =
                ToolDefinition.builder("seek")
                        .parameter(ToolParameter.required("offset", "int"))
                        .docstring(new Docstring("Seek", Map.of("offset", "Sample offset (0-9999999999)")))
                        .guard("offset")
                        .build();

        // When
        TestCase invalid = battery.casesFor(seek).get(4);

        // Then
        assertThat(invalid.isSkipped()).isFalse();
        assertThat(invalid.invocationArgs()).containsEntry("offset", -1);
    }

    @Test
    void shouldSkipInvalidCaseWhenDomainCoversWholeType() {
        // Given
        ToolDefinition velocity =
                ToolDefinition.builder("set_velocity")
                        .parameter(ToolParameter.required("velocity", "byte"))
                        .docstring(new Docstring("Set velocity", Map.of("velocity", "Velocity (-128-127)")))
                        .guard("velocity")
                        .build();

        // When
        List<TestCase> cases = battery.casesFor(velocity);

        // Then
        assertThat(cases.get(4).description()).isEqualTo("invalid velocity");
        assertThat(cases.get(4).isSkipped()).isTrue();
        assertThat(cases).hasSize(5);
    }

    @Test
    void shouldRestrictRegistriesToKnownTargets() {
        StandardBattery restricted = new StandardBattery(Set.of("track"));

        MockRegistryConfig happy = restricted.casesFor(setTempo).get(2).registryConfig();

        assertThat(happy.resolves("track")).isTrue();
        assertThat(happy.resolves(ToolContext.DIRECT_TARGET)).isTrue();
        assertThat(happy.resolves("transport")).isFalse();
    }
}
