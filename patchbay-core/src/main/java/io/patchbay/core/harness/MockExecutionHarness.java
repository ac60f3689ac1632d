package io.patchbay.core.harness;

import io.patchbay.core.model.ToolDefinition;
import io.patchbay.core.runtime.ToolResults;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/// Runs live tools against simulated delegation layers.
///
/// Cases run one at a time, each against a fresh {@link MockRegistry}. An invocation is
/// submitted to the executor and awaited for at most the case timeout; on timeout the
/// worker and the tool's future are cancelled and the case is {@link OutcomeKind#HUNG}.
///
/// ### Contracts
/// - **Precondition**: the executor is not shut down
/// - **Postcondition**: one result per case, in case order
/// - **Invariant**: an exception thrown by a tool becomes a {@link OutcomeKind#RAISED}
///   outcome, never an exception out of the harness
///
/// @implNote Thread-safe; holds no per-run state.
/// @see StandardBattery for the default cases
public class MockExecutionHarness {

    private static final Logger logger = Logger.getLogger(MockExecutionHarness.class.getName());

    private final ExecutorService executor;
    private final Duration caseTimeout;
    private final StandardBattery battery;

    /// @param executor runs invocations, not null
    /// @param caseTimeout time allowed per case, positive
    /// @param battery source of the standard cases, not null
    public MockExecutionHarness(
            ExecutorService executor, Duration caseTimeout, StandardBattery battery) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.caseTimeout = Objects.requireNonNull(caseTimeout, "caseTimeout must not be null");
        this.battery = Objects.requireNonNull(battery, "battery must not be null");
        if (caseTimeout.isZero() || caseTimeout.isNegative()) {
            throw new IllegalArgumentException("caseTimeout must be positive");
        }
    }

    /// Runs the standard battery.
    ///
    /// @param tool the tool to exercise, not null
    /// @return report with one result per case, never null
    public TestReport run(LiveTool tool) {
        return run(tool, battery.casesFor(tool.definition()));
    }

    /// Runs custom cases instead of the standard battery.
    ///
    /// @param tool the tool to exercise, not null
    /// @param cases cases in run order, not null
    /// @return report with one result per case, never null
    public TestReport run(LiveTool tool, List<TestCase> cases) {
        logger.info("Testing tool " + tool.name() + " with " + cases.size() + " cases");
        List<TestResult> results = new ArrayList<>(cases.size());
        for (TestCase testCase : cases) {
            TestResult result = runCase(tool, testCase);
            if (result.failed()) {
                logger.fine(
                        "Case '" + testCase.description() + "' failed for " + tool.name() + ": "
                                + result.mismatch());
            }
            results.add(result);
        }
        TestReport report = new TestReport(tool.name(), results);
        logger.info(
                "Tool " + tool.name() + ": " + report.passedCount() + " passed, "
                        + report.failedCount() + " failed, " + report.skippedCount() + " skipped");
        return report;
    }

    private TestResult runCase(LiveTool tool, TestCase testCase) {
        if (testCase.isSkipped()) {
            return TestResult.skipped(testCase);
        }
        if (testCase.kind() == CaseKind.REGISTRATION) {
            return registration(tool.definition(), testCase);
        }

        MockRegistry registry = MockRegistry.from(testCase.registryConfig());
        AtomicReference<CompletableFuture<String>> toolFuture = new AtomicReference<>();
        long start = System.nanoTime();
        OutcomeKind kind;
        String actual;

        Future<String> task =
                executor.submit(
                        () -> {
                            CompletableFuture<String> future =
                                    tool.function().invoke(registry, testCase.invocationArgs());
                            if (future == null) {
                                throw new IllegalStateException("tool returned no future");
                            }
                            toolFuture.set(future);
                            return future.get();
                        });
        try {
            actual = task.get(caseTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (actual == null) {
                kind = OutcomeKind.RAISED;
                actual = "tool completed without a result";
            } else {
                kind = ToolResults.isError(actual) ? OutcomeKind.ERROR_MESSAGE : OutcomeKind.SUCCESS;
            }
        } catch (TimeoutException e) {
            logger.warning(
                    "Case '" + testCase.description() + "' of " + tool.name() + " timed out after "
                            + caseTimeout.toMillis() + "ms");
            task.cancel(true);
            CompletableFuture<String> pending = toolFuture.get();
            if (pending != null) {
                pending.cancel(true);
            }
            kind = OutcomeKind.HUNG;
            actual = null;
        } catch (ExecutionException e) {
            kind = OutcomeKind.RAISED;
            actual = describeRaised(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel(true);
            kind = OutcomeKind.RAISED;
            actual = "interrupted";
        } finally {
            registry.cancelPending();
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        return new TestResult(
                testCase,
                kind,
                actual,
                registry.invocations(),
                mismatch(testCase, kind, actual, registry),
                elapsed);
    }

    private static TestResult registration(ToolDefinition definition, TestCase testCase) {
        List<String> missing = new ArrayList<>();
        if (!definition.hasRegistrationMarker()) {
            missing.add("registration marker");
        }
        if (!definition.isAsyncCallable()) {
            missing.add("asynchronous signature");
        }
        if (!definition.returnsPlainText()) {
            missing.add("text result");
        }
        if (missing.isEmpty()) {
            return new TestResult(
                    testCase, OutcomeKind.SUCCESS, "registrable", List.of(), null, Duration.ZERO);
        }
        String problem = "missing " + String.join(", ", missing);
        return new TestResult(
                testCase,
                OutcomeKind.ERROR_MESSAGE,
                ToolResults.ERROR_PREFIX + problem,
                List.of(),
                "tool is not registrable: " + problem,
                Duration.ZERO);
    }

    private static String describeRaised(Throwable failure) {
        Throwable cause = failure;
        while (cause instanceof ExecutionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getClass().getSimpleName() + ": " + ToolResults.describe(cause);
    }

    private static String mismatch(
            TestCase testCase, OutcomeKind kind, String actual, MockRegistry registry) {
        List<String> problems = new ArrayList<>();
        if (kind != testCase.expectedOutcomeKind()) {
            problems.add(
                    "expected " + testCase.expectedOutcomeKind() + " but was " + kind
                            + (actual != null ? " (" + actual + ")" : ""));
        } else if (testCase.expectedResult() != null
                && !testCase.expectedResult().equals(actual)) {
            problems.add("expected \"" + testCase.expectedResult() + "\" but got \"" + actual + "\"");
        }
        if (testCase.requireUntouchedRegistry() && !registry.untouched()) {
            problems.add("registry was called: " + registry.invocations());
        }
        return problems.isEmpty() ? null : String.join("; ", problems);
    }
}
