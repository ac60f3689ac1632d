package io.patchbay.core.report;

import io.patchbay.core.catalog.CatalogEntry;
import io.patchbay.core.catalog.CatalogReport;
import io.patchbay.core.harness.TestReport;
import io.patchbay.core.harness.TestResult;
import io.patchbay.core.rule.ValidationReport;
import io.patchbay.core.rule.Verdict;
import java.util.Collection;
import java.util.Locale;

/// Canonical text rendering of reports, plus the exit code a command-line wrapper returns.
///
/// One line per verdict or case, each starting with a glyph: `[OK]`, `[FAIL]` or `[SKIP]`.
/// Failures carry their remediation on an indented `->` line. Output is deterministic;
/// elapsed times are not rendered.
public final class ReportRenderer {

    public static final String OK = " [OK] ";
    public static final String FAIL = " [FAIL] ";
    public static final String SKIP = " [SKIP] ";

    private static final String RULE = "=".repeat(60);

    private ReportRenderer() {}

    public static String render(ValidationReport report) {
        StringBuilder out = new StringBuilder();
        out.append("Tool Validation Report: ").append(report.toolName()).append('\n');
        out.append(RULE).append('\n');
        out.append("Overall Status: ").append(report.overallPassed() ? "VALID" : "INVALID").append('\n');
        appendVerdicts(out, report);
        return out.toString();
    }

    public static String render(CatalogReport report) {
        StringBuilder out = new StringBuilder();
        out.append("Tool Catalog Report").append('\n');
        out.append(RULE).append('\n');
        out.append("Overall Status: ").append(report.allPassed() ? "VALID" : "INVALID").append('\n');
        out.append("Tools: ")
                .append(report.total())
                .append(" total, ")
                .append(report.validCount())
                .append(" valid, ")
                .append(report.invalidCount())
                .append(" invalid")
                .append('\n');
        for (String name : report.duplicateNames()) {
            out.append(FAIL).append("duplicate tool name: ").append(name).append('\n');
        }
        for (CatalogEntry entry : report.entries()) {
            out.append('\n');
            if (entry instanceof CatalogEntry.Validated validated) {
                ValidationReport tool = validated.report();
                out.append("Tool: ")
                        .append(tool.toolName())
                        .append(" (")
                        .append(validated.definition().location())
                        .append(") ")
                        .append(tool.overallPassed() ? "VALID" : "INVALID")
                        .append('\n');
                appendVerdicts(out, tool);
            } else {
                CatalogEntry.Unextractable failed = (CatalogEntry.Unextractable) entry;
                out.append(FAIL)
                        .append(failed.unitId())
                        .append(": ")
                        .append(failed.message())
                        .append('\n');
            }
        }
        return out.toString();
    }

    public static String render(TestReport report) {
        StringBuilder out = new StringBuilder();
        out.append("Tool Test Report: ").append(report.toolName()).append('\n');
        out.append(RULE).append('\n');
        out.append("Overall Status: ").append(report.allPassed() ? "PASSED" : "FAILED").append('\n');
        long executed = report.passedCount() + report.failedCount();
        out.append("Tests: ")
                .append(report.passedCount())
                .append('/')
                .append(executed)
                .append(" passed (")
                .append(String.format(Locale.ROOT, "%.1f%%", report.successRate()))
                .append(" success rate), ")
                .append(report.skippedCount())
                .append(" skipped")
                .append('\n');
        for (TestResult result : report.results()) {
            String description = result.testCase().description();
            if (result.skipped()) {
                out.append(SKIP).append(description).append(": ").append(result.actualResult());
            } else if (result.passed()) {
                out.append(OK).append(description);
            } else {
                out.append(FAIL).append(description).append(": ").append(result.mismatch());
            }
            out.append('\n');
        }
        return out.toString();
    }

    /// Returns 0 iff every report passed, 1 otherwise.
    public static int exitCode(Collection<ValidationReport> reports) {
        return reports.stream().allMatch(ValidationReport::overallPassed) ? 0 : 1;
    }

    public static int exitCode(CatalogReport report) {
        return report.allPassed() ? 0 : 1;
    }

    /// Returns 0 iff no executed case of any report failed, 1 otherwise.
    public static int testExitCode(Collection<TestReport> reports) {
        return reports.stream().allMatch(TestReport::allPassed) ? 0 : 1;
    }

    private static void appendVerdicts(StringBuilder out, ValidationReport report) {
        for (Verdict verdict : report.verdicts()) {
            out.append(verdict.passed() ? OK : FAIL)
                    .append(verdict.ruleId())
                    .append(": ")
                    .append(verdict.message())
                    .append('\n');
            if (!verdict.passed() && !verdict.suggestion().isEmpty()) {
                out.append("        -> ").append(verdict.suggestion()).append('\n');
            }
        }
    }
}
