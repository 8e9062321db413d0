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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The result of one assertion of one case, or of a failed arrangement (in which case
 * there is no display name of its own).
 * <p>
 * Start and end times are those of the operation of the case: assertions are expected to
 * be quick and are not timed separately.
 */
public class AssertionResult {

    private final String displayName;
    private final TestOutcome outcome;
    private final String errorMessage;
    private final String errorStackTrace;
    private final Throwable error;
    private final long startTime;
    private final long endTime;

    public AssertionResult(String displayName, TestOutcome outcome, Throwable error,
                           String errorMessage, String errorStackTrace, long startTime, long endTime) {
        this.displayName = displayName;
        this.outcome = outcome;
        this.error = error;
        this.errorMessage = errorMessage;
        this.errorStackTrace = errorStackTrace;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public static AssertionResult passed(String displayName, long startTime, long endTime) {
        return new AssertionResult(displayName, TestOutcome.PASSED, null, null, null, startTime, endTime);
    }

    public String getDisplayName() {
        return displayName;
    }

    public TestOutcome getOutcome() {
        return outcome;
    }

    public boolean isPassed() {
        return outcome == TestOutcome.PASSED;
    }

    public boolean isFailed() {
        return outcome == TestOutcome.FAILED;
    }

    public boolean isSkipped() {
        return outcome == TestOutcome.SKIPPED;
    }

    /**
     * The error behind a failed or skipped result, null when passed.
     */
    public Throwable getError() {
        return error;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getErrorStackTrace() {
        return errorStackTrace;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public long getDurationMillis() {
        return endTime - startTime;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (displayName != null) {
            map.put("name", displayName);
        }
        map.put("outcome", outcome.getValue());
        map.put("ms", getDurationMillis());
        if (errorMessage != null) {
            map.put("error", errorMessage);
        }
        return map;
    }

    @Override
    public String toString() {
        return (displayName == null ? "(arrangement)" : displayName) + ": " + outcome.getValue();
    }

}
