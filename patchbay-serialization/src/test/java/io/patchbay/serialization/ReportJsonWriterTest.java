package io.patchbay.serialization;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.patchbay.core.catalog.CatalogEntry;
import io.patchbay.core.catalog.CatalogReport;
import io.patchbay.core.harness.CaseKind;
import io.patchbay.core.harness.Invocation;
import io.patchbay.core.harness.OutcomeKind;
import io.patchbay.core.harness.TestCase;
import io.patchbay.core.harness.TestReport;
import io.patchbay.core.harness.TestResult;
import io.patchbay.core.model.ToolDefinition;
import io.patchbay.core.rule.ValidationReport;
import io.patchbay.core.rule.Verdict;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ReportJsonWriterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private final ValidationReport report =
            ValidationReport.of(
                    "set_volume",
                    List.of(
                            Verdict.pass("async-callable", "Tool returns a completion stage"),
                            Verdict.fail(
                                    "registration-marker",
                                    "Missing @McpTool marker",
                                    "Annotate the method with @McpTool")));

    @Test
    void shouldWriteVerdictsWithSuggestionsOnFailuresOnly() throws Exception {
        JsonNode root = mapper.readTree(ReportJsonWriter.toJson(report));

        assertThat(root.get("toolName").asText()).isEqualTo("set_volume");
        assertThat(root.get("overallPassed").asBoolean()).isFalse();
        JsonNode verdicts = root.get("verdicts");
        assertThat(verdicts).hasSize(2);
        assertThat(verdicts.get(0).has("suggestion")).isFalse();
        assertThat(verdicts.get(1).get("ruleId").asText()).isEqualTo("registration-marker");
        assertThat(verdicts.get(1).get("suggestion").asText())
                .isEqualTo("Annotate the method with @McpTool");
    }

    @Test
    void shouldWriteSeveralReportsAsArray() throws Exception {
        JsonNode root = mapper.readTree(ReportJsonWriter.toJson(List.of(report, report)));

        assertThat(root.isArray()).isTrue();
        assertThat(root).hasSize(2);
    }

    @Test
    void shouldWriteCatalogEntriesByType() throws Exception {
        // Given
        CatalogReport catalog =
                new CatalogReport(
                        List.of(
                                new CatalogEntry.Validated(
                                        ToolDefinition.builder("set_volume")
                                                .methodName("setVolume")
                                                .location("MixerTools.java:18")
                                                .build(),
                                        report),
                                new CatalogEntry.Unextractable("Broken.java", "Broken.java: no body")),
                        Set.of());

        // When
        JsonNode root = mapper.readTree(ReportJsonWriter.toJson(catalog));

        // Then
        assertThat(root.get("total").asInt()).isEqualTo(2);
        assertThat(root.get("invalid").asInt()).isEqualTo(2);
        assertThat(root.get("allPassed").asBoolean()).isFalse();
        JsonNode validated = root.get("entries").get(0);
        assertThat(validated.get("type").asText()).isEqualTo("validated");
        assertThat(validated.get("methodName").asText()).isEqualTo("setVolume");
        assertThat(validated.get("location").asText()).isEqualTo("MixerTools.java:18");
        assertThat(validated.get("delegation").get("type").asText()).isEqualTo("direct");
        assertThat(validated.get("report").get("verdicts")).hasSize(2);
        JsonNode unextractable = root.get("entries").get(1);
        assertThat(unextractable.get("type").asText()).isEqualTo("unextractable");
        assertThat(unextractable.get("unitId").asText()).isEqualTo("Broken.java");
        assertThat(unextractable.get("valid").asBoolean()).isFalse();
    }

    @Test
    void shouldWriteCasesWithDurationsAndInvocations() throws Exception {
        // Given
        TestCase happy = TestCase.builder("happy path").kind(CaseKind.HAPPY_PATH).build();
        TestCase skipped =
                TestCase.skipped("invalid parameter", CaseKind.INVALID_PARAMETER, "no restricted parameters");
        TestReport testReport =
                new TestReport(
                        "set_tempo",
                        List.of(
                                new TestResult(
                                        happy,
                                        OutcomeKind.SUCCESS,
                                        "Tempo set",
                                        List.of(new Invocation("transport", "set_tempo", Map.of("bpm", 60.0))),
                                        null,
                                        Duration.ofMillis(12)),
                                TestResult.skipped(skipped)));

        // When
        JsonNode root = mapper.readTree(ReportJsonWriter.toJson(testReport));

        // Then
        assertThat(root.get("passed").asInt()).isEqualTo(1);
        assertThat(root.get("skipped").asInt()).isEqualTo(1);
        assertThat(root.get("successRate").asDouble()).isEqualTo(100.0);
        JsonNode first = root.get("cases").get(0);
        assertThat(first.get("status").asText()).isEqualTo("PASSED");
        assertThat(first.get("kind").asText()).isEqualTo("HAPPY_PATH");
        assertThat(first.get("elapsed").asText()).isEqualTo("PT0.012S");
        assertThat(first.has("mismatch")).isFalse();
        JsonNode call = first.get("invocations").get(0);
        assertThat(call.get("target").asText()).isEqualTo("transport");
        assertThat(call.get("arguments").get("bpm").asDouble()).isEqualTo(60.0);
        JsonNode second = root.get("cases").get(1);
        assertThat(second.get("status").asText()).isEqualTo("SKIPPED");
        assertThat(second.get("result").asText()).isEqualTo("no restricted parameters");
    }
}
