/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.flunit.run;

import io.flunit.config.RunSettings;
import io.flunit.config.TestConfiguration;
import io.flunit.core.Assertion;
import io.flunit.core.Case;
import io.flunit.core.TestContext;
import io.flunit.core.TestDefinition;
import io.flunit.core.TestFailureDetails;
import io.flunit.log.LogContext;
import org.slf4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Executes a set of discovered tests.
 * <p>
 * For each test: arrange, then for each case act once and evaluate every assertion in
 * order, recording one {@link AssertionResult} per assertion. A test whose arrangement
 * fails gets a single result with the configured arrangement failure outcome.
 * <p>
 * Different tests may run on different threads (see {@link RunSettings#isParallel()}); the
 * cases of one test always run sequentially on one thread.
 * <pre>
 * RunResult result = new TestRun(TestDiscovery.findTests(MyTests.class), settings)
 *         .resultListener(listener)
 *         .execute();
 * </pre>
 */
public class TestRun {

    public static final String ARRANGEMENT_FAILURE_PREFIX = "Test arrangement failed: ";

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final List<TestMetadata> tests;
    private final RunSettings settings;
    private final List<ResultListener> resultListeners = new ArrayList<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private boolean printSummary;

    public TestRun(List<TestMetadata> tests, RunSettings settings) {
        this.tests = List.copyOf(tests);
        this.settings = settings != null ? settings : new RunSettings();
    }

    public static TestRun of(RunSettings settings, Class<?>... classes) {
        return new TestRun(TestDiscovery.findTests(classes), settings);
    }

    public TestRun resultListener(ResultListener listener) {
        resultListeners.add(listener);
        return this;
    }

    public TestRun printSummary(boolean printSummary) {
        this.printSummary = printSummary;
        return this;
    }

    public List<TestMetadata> getTests() {
        return tests;
    }

    public RunSettings getSettings() {
        return settings;
    }

    public int getThreadCount() {
        return settings.isParallel() ? settings.getThreads() : 1;
    }

    /**
     * Stops the run from starting any more tests. Tests already running finish normally,
     * except that their "Given" clauses can observe the request through
     * {@link TestContext#isCancellationRequested()}.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            logger.info("test run cancellation requested");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public RunResult execute() {
        RunResult result = new RunResult();
        result.setStartTime(System.currentTimeMillis());
        String logLevel = settings.getOutput().getLogLevel();
        if (logLevel != null) {
            LogContext.setRuntimeLogLevel(logLevel);
        }
        List<ResultListener> listeners = new ArrayList<>(resultListeners);
        if (settings.getOutput().isJsonLines()) {
            listeners.add(new JsonLinesReportListener(Path.of(settings.getOutput().getDir())));
        }
        try {
            for (ResultListener listener : listeners) {
                listener.onRunStart(this);
            }
            logger.debug("running {} test(s) on {} thread(s)", tests.size(), getThreadCount());
            if (getThreadCount() > 1) {
                runParallel(result, listeners);
            } else {
                runSequential(result, listeners);
            }
        } finally {
            result.setCancelled(cancelled.get());
            result.setEndTime(System.currentTimeMillis());
            for (ResultListener listener : listeners) {
                listener.onRunEnd(result);
            }
            if (printSummary) {
                result.printSummary(getThreadCount());
            }
        }
        return result;
    }

    private void runSequential(RunResult result, List<ResultListener> listeners) {
        for (TestMetadata test : tests) {
            if (cancelled.get()) {
                break;
            }
            result.addTestResult(runTest(test, listeners));
        }
    }

    private void runParallel(RunResult result, List<ResultListener> listeners) {
        ExecutorService executor = Executors.newFixedThreadPool(settings.getThreads());
        try {
            List<Future<TestResult>> futures = new ArrayList<>();
            for (TestMetadata test : tests) {
                futures.add(executor.submit(() -> cancelled.get() ? null : runTest(test, listeners)));
            }
            for (Future<TestResult> future : futures) {
                TestResult testResult = future.get();
                if (testResult != null) {
                    result.addTestResult(testResult);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
        } catch (ExecutionException e) {
            throw new RuntimeException("Test execution failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    TestResult runTest(TestMetadata metadata, List<ResultListener> listeners) {
        for (ResultListener listener : listeners) {
            listener.onTestStart(metadata);
        }
        TestResult result = new TestResult(metadata);
        result.setStartTime(System.currentTimeMillis());
        TestConfiguration configuration = settings.getTestConfiguration();
        TestDefinition<?> test;
        try {
            test = metadata.getTest();
        } catch (RuntimeException | LinkageError e) {
            recordArrangementFailure(metadata, result, configuration, e);
            return finish(result, listeners);
        }
        if (test.hasConfigurationOverrides()) {
            configuration = configuration.copy();
            test.applyConfigurationOverrides(configuration);
        }
        TestContext context = new TestContext(configuration, cancelled::get);
        boolean arranged;
        try {
            test.arrange(context);
            arranged = true;
        } catch (RuntimeException e) {
            recordArrangementFailure(metadata, result, configuration, e);
            arranged = false;
        }
        if (arranged) {
            boolean allPassed = runCases(metadata, test, configuration, result);
            result.setOutcome(allPassed ? TestOutcome.PASSED : TestOutcome.FAILED);
        }
        return finish(result, listeners);
    }

    private <R> boolean runCases(TestMetadata metadata, TestDefinition<R> test, TestConfiguration configuration, TestResult result) {
        boolean allPassed = true;
        for (Case<R> testCase : test.getCases()) {
            long actStart = System.currentTimeMillis();
            testCase.act();
            long actEnd = System.currentTimeMillis();
            for (Assertion<R> assertion : testCase.getAssertions()) {
                String displayName = configuration.getResultNamingStrategy()
                        .getResultName(metadata.getDisplayName(), test, testCase, assertion);
                try {
                    assertion.evaluate();
                    result.addResult(AssertionResult.passed(displayName, actStart, actEnd));
                } catch (RuntimeException | AssertionError e) {
                    allPassed = false;
                    result.addResult(new AssertionResult(displayName, TestOutcome.FAILED, e,
                            TestFailureDetails.messageOf(e), TestFailureDetails.stackTraceOf(e), actStart, actEnd));
                }
            }
        }
        return allPassed;
    }

    private void recordArrangementFailure(TestMetadata metadata, TestResult result, TestConfiguration configuration, Throwable error) {
        TestOutcome outcome = configuration.getArrangementFailureOutcome();
        Throwable cause = error.getCause() != null ? error.getCause() : error;
        logger.warn("arrangement of {} failed: {}", metadata.getDisplayName(), cause.getMessage());
        result.addResult(new AssertionResult(null, outcome, error,
                ARRANGEMENT_FAILURE_PREFIX + cause.getMessage(), TestFailureDetails.stackTraceOf(error),
                result.getStartTime(), System.currentTimeMillis()));
        result.setOutcome(outcome);
    }

    private static TestResult finish(TestResult result, List<ResultListener> listeners) {
        result.setEndTime(System.currentTimeMillis());
        for (ResultListener listener : listeners) {
            listener.onTestEnd(result);
        }
        return result;
    }

}
