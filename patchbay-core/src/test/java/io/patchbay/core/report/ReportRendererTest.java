package io.patchbay.core.report;

import static org.assertj.core.api.Assertions.assertThat;

import io.patchbay.core.catalog.CatalogEntry;
import io.patchbay.core.catalog.CatalogReport;
import io.patchbay.core.harness.CaseKind;
import io.patchbay.core.harness.OutcomeKind;
import io.patchbay.core.harness.TestCase;
import io.patchbay.core.harness.TestReport;
import io.patchbay.core.harness.TestResult;
import io.patchbay.core.model.ToolDefinition;
import io.patchbay.core.rule.ValidationReport;
import io.patchbay.core.rule.Verdict;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ReportRendererTest {

    private final ValidationReport failing =
            ValidationReport.of(
                    "set_volume",
                    List.of(
                            Verdict.pass("async-callable", "Tool returns a completion stage"),
                            Verdict.fail(
                                    "registration-marker",
                                    "Missing @McpTool marker",
                                    "Annotate the method with @McpTool(name = \"set_volume\")")));

    private final ValidationReport passing =
            ValidationReport.of("record", List.of(Verdict.pass("docstring", "Documented")));

    @Test
    void shouldRenderValidationReport() {
        assertThat(ReportRenderer.render(failing))
                .isEqualTo(
                        """
                        Tool Validation Report: set_volume
                        ============================================================
                        Overall Status: INVALID
                         [OK] async-callable: Tool returns a completion stage
                         [FAIL] registration-marker: Missing @McpTool marker
                                -> Annotate the method with @McpTool(name = "set_volume")
                        """);
    }

    @Test
    void shouldRenderCatalogReport() {
        CatalogReport report =
                new CatalogReport(
                        List.of(
                                new CatalogEntry.Validated(
                                        ToolDefinition.builder("record").location("LiveTools.java:12").build(),
                                        passing),
                                new CatalogEntry.Unextractable(
                                        "Broken.java", "Broken.java: tool method pending has no body")),
                        Set.of("record"));

        String text = ReportRenderer.render(report);

        assertThat(text)
                .startsWith("Tool Catalog Report\n")
                .contains("Overall Status: INVALID\n")
                .contains("Tools: 2 total, 1 valid, 1 invalid\n")
                .contains(" [FAIL] duplicate tool name: record\n")
                .contains("Tool: record (LiveTools.java:12) VALID\n [OK] docstring: Documented\n")
                .endsWith(" [FAIL] Broken.java: Broken.java: tool method pending has no body\n");
        assertThat(ReportRenderer.exitCode(report)).isEqualTo(1);
    }

    @Test
    void shouldRenderTestReport() {
        TestCase happy = TestCase.builder("happy path").kind(CaseKind.HAPPY_PATH).build();
        TestCase failure = TestCase.builder("delegation failure").expect(OutcomeKind.ERROR_MESSAGE).build();
        TestCase skipped =
                TestCase.skipped("invalid parameter", CaseKind.INVALID_PARAMETER, "no restricted parameters");
        TestReport report =
                new TestReport(
                        "record",
                        List.of(
                                new TestResult(
                                        happy, OutcomeKind.SUCCESS, "ok", List.of(), null, Duration.ofMillis(3)),
                                new TestResult(
                                        failure,
                                        OutcomeKind.RAISED,
                                        "IllegalStateException: boom",
                                        List.of(),
                                        "expected ERROR_MESSAGE but was RAISED (IllegalStateException: boom)",
                                        Duration.ofMillis(7)),
                                TestResult.skipped(skipped)));

        assertThat(ReportRenderer.render(report))
                .isEqualTo(
                        """
                        Tool Test Report: record
                        ============================================================
                        Overall Status: FAILED
                        Tests: 1/2 passed (50.0% success rate), 1 skipped
                         [OK] happy path
                         [FAIL] delegation failure: expected ERROR_MESSAGE but was RAISED (IllegalStateException: boom)
                         [SKIP] invalid parameter: no restricted parameters
                        """);
        assertThat(ReportRenderer.testExitCode(List.of(report))).isEqualTo(1);
    }

    @Test
    void shouldExitZeroOnlyWhenEverythingPassed() {
        assertThat(ReportRenderer.exitCode(List.of(passing))).isZero();
        assertThat(ReportRenderer.exitCode(List.of(passing, failing))).isEqualTo(1);
        assertThat(ReportRenderer.exitCode(new CatalogReport(List.of(), Set.of()))).isZero();
        assertThat(ReportRenderer.testExitCode(List.of())).isZero();
    }
}
