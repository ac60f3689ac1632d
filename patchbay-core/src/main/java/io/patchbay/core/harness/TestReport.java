package io.patchbay.core.harness;

import java.util.List;
import java.util.Objects;

/// Results of running one tool through its cases.
///
/// @param toolName exercised tool, not null
/// @param results one result per case, in case order, not null
public record TestReport(String toolName, List<TestResult> results) {

    public TestReport {
        Objects.requireNonNull(toolName, "toolName must not be null");
        results = results != null ? List.copyOf(results) : List.of();
    }

    public long passedCount() {
        return results.stream().filter(TestResult::passed).count();
    }

    public long failedCount() {
        return results.stream().filter(TestResult::failed).count();
    }

    public long skippedCount() {
        return results.stream().filter(TestResult::skipped).count();
    }

    /// Whether no executed case failed. Skipped cases never fail a report.
    public boolean allPassed() {
        return failedCount() == 0;
    }

    /// Percentage of executed cases that passed, 100 when nothing was executed.
    public double successRate() {
        long executed = passedCount() + failedCount();
        return executed == 0 ? 100.0 : passedCount() * 100.0 / executed;
    }
}
