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

import io.flunit.log.LogContext;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class RunResult {

    private static final Logger console = LogContext.CONSOLE_LOGGER;

    private final List<TestResult> testResults = Collections.synchronizedList(new ArrayList<>());
    private long startTime;
    private long endTime;
    private boolean cancelled;

    public void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    public void setEndTime(long endTime) {
        this.endTime = endTime;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public void addTestResult(TestResult result) {
        testResults.add(result);
    }

    /**
     * Results in completion order, which only matches discovery order for sequential runs.
     */
    public List<TestResult> getTestResults() {
        synchronized (testResults) {
            return new ArrayList<>(testResults);
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void setCancelled(boolean cancelled) {
        this.cancelled = cancelled;
    }

    // ========== Aggregation ==========

    public int getTestCount() {
        return testResults.size();
    }

    public int getPassedCount() {
        return count(TestOutcome.PASSED);
    }

    public int getFailedCount() {
        return count(TestOutcome.FAILED);
    }

    public int getSkippedCount() {
        return count(TestOutcome.SKIPPED);
    }

    public int getResultCount() {
        return getTestResults().stream().mapToInt(tr -> tr.getResults().size()).sum();
    }

    public int getResultFailedCount() {
        return getTestResults().stream().mapToInt(TestResult::getFailedCount).sum();
    }

    public boolean isFailed() {
        return getFailedCount() > 0;
    }

    public long getDurationMillis() {
        return endTime - startTime;
    }

    private int count(TestOutcome outcome) {
        return (int) getTestResults().stream().filter(tr -> tr.getOutcome() == outcome).count();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("tests", getTestCount());
        map.put("passed", getPassedCount());
        map.put("failed", getFailedCount());
        map.put("skipped", getSkippedCount());
        map.put("results", getResultCount());
        map.put("resultsFailed", getResultFailedCount());
        map.put("ms", getDurationMillis());
        if (cancelled) {
            map.put("cancelled", true);
        }
        return map;
    }

    // ========== Console Output ==========

    public void printSummary() {
        printSummary(1);
    }

    public void printSummary(int threadCount) {
        console.info("elapsed: {}s | threads: {}", String.format("%.2f", getDurationMillis() / 1000.0), threadCount);
        console.info("tests: {} | passed: {} | failed: {} | skipped: {}",
                getTestCount(), getPassedCount(), getFailedCount(), getSkippedCount());
        for (TestResult tr : getTestResults()) {
            if (!tr.isFailed()) {
                continue;
            }
            for (AssertionResult ar : tr.getResults()) {
                if (ar.isFailed()) {
                    console.info("failed: {} | {} | {}", tr.getName(), ar.getDisplayName(), ar.getErrorMessage());
                }
            }
        }
        if (cancelled) {
            console.info("run was cancelled before all tests started");
        }
    }

}
