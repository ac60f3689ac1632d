package io.patchbay.core.harness;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/// Outcome of one {@link TestCase}.
///
/// @param testCase the case that ran, not null
/// @param actualOutcomeKind how the invocation ended, not null
/// @param actualResult returned text, exception description, or null
/// @param invocations delegation calls observed, in order
/// @param mismatch why the case failed, null when it passed or was skipped
/// @param elapsed wall time of the invocation
public record TestResult(
        TestCase testCase,
        OutcomeKind actualOutcomeKind,
        String actualResult,
        List<Invocation> invocations,
        String mismatch,
        Duration elapsed) {

    public TestResult {
        Objects.requireNonNull(testCase, "testCase must not be null");
        Objects.requireNonNull(actualOutcomeKind, "actualOutcomeKind must not be null");
        invocations = invocations != null ? List.copyOf(invocations) : List.of();
        elapsed = elapsed != null ? elapsed : Duration.ZERO;
    }

    public static TestResult skipped(TestCase testCase) {
        return new TestResult(
                testCase, OutcomeKind.SKIPPED, testCase.skipReason(), List.of(), null, Duration.ZERO);
    }

    public boolean skipped() {
        return actualOutcomeKind == OutcomeKind.SKIPPED;
    }

    public boolean passed() {
        return !skipped() && mismatch == null;
    }

    public boolean failed() {
        return !skipped() && mismatch != null;
    }
}
