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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class TestResult {

    private final TestMetadata metadata;
    private final List<AssertionResult> results = new ArrayList<>();
    private TestOutcome outcome;
    private long startTime;
    private long endTime;

    public TestResult(TestMetadata metadata) {
        this.metadata = metadata;
    }

    public TestMetadata getMetadata() {
        return metadata;
    }

    public String getName() {
        return metadata.getName();
    }

    public void addResult(AssertionResult result) {
        results.add(result);
    }

    public List<AssertionResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    public TestOutcome getOutcome() {
        return outcome;
    }

    public void setOutcome(TestOutcome outcome) {
        this.outcome = outcome;
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

    public int getFailedCount() {
        return (int) results.stream().filter(AssertionResult::isFailed).count();
    }

    public int getPassedCount() {
        return (int) results.stream().filter(AssertionResult::isPassed).count();
    }

    public long getStartTime() {
        return startTime;
    }

    public void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public void setEndTime(long endTime) {
        this.endTime = endTime;
    }

    public long getDurationMillis() {
        return endTime - startTime;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", getName());
        if (!metadata.getTraits().isEmpty()) {
            List<Map<String, Object>> traits = new ArrayList<>();
            metadata.getTraits().forEach(t -> traits.add(t.toMap()));
            map.put("traits", traits);
        }
        map.put("outcome", outcome == null ? null : outcome.getValue());
        List<Map<String, Object>> list = new ArrayList<>();
        for (AssertionResult result : results) {
            list.add(result.toMap());
        }
        map.put("results", list);
        map.put("ms", getDurationMillis());
        return map;
    }

    @Override
    public String toString() {
        return getName() + ": " + (outcome == null ? "running" : outcome.getValue());
    }

}
