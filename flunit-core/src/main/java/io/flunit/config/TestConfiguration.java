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
package io.flunit.config;

import io.flunit.run.TestOutcome;

/**
 * Per-test settings. The run holds one shared instance; a test with overrides gets its
 * own {@link #copy()} with the overrides applied.
 */
public class TestConfiguration {

    private TestOutcome arrangementFailureOutcome = TestOutcome.SKIPPED;
    private ResultNamingStrategy resultNamingStrategy = DefaultResultNamingStrategy.INSTANCE;

    public TestConfiguration copy() {
        TestConfiguration copy = new TestConfiguration();
        copy.arrangementFailureOutcome = arrangementFailureOutcome;
        copy.resultNamingStrategy = resultNamingStrategy;
        return copy;
    }

    /**
     * The outcome recorded for a test whose "Given" clauses fail.
     */
    public TestOutcome getArrangementFailureOutcome() {
        return arrangementFailureOutcome;
    }

    public void setArrangementFailureOutcome(TestOutcome arrangementFailureOutcome) {
        if (arrangementFailureOutcome == null || arrangementFailureOutcome == TestOutcome.PASSED) {
            throw new IllegalArgumentException("arrangement failure outcome must be skipped or failed: " + arrangementFailureOutcome);
        }
        this.arrangementFailureOutcome = arrangementFailureOutcome;
    }

    public ResultNamingStrategy getResultNamingStrategy() {
        return resultNamingStrategy;
    }

    public void setResultNamingStrategy(ResultNamingStrategy resultNamingStrategy) {
        this.resultNamingStrategy = resultNamingStrategy != null ? resultNamingStrategy : DefaultResultNamingStrategy.INSTANCE;
    }

}
