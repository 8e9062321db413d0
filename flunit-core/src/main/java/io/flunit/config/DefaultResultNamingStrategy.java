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

import io.flunit.core.Assertion;
import io.flunit.core.Case;
import io.flunit.core.TestDefinition;

/**
 * Names a result after whatever distinguishes it from its siblings: the case when the
 * test has several, the assertion when the case has several, both when both vary, and
 * the test itself when neither does.
 */
public class DefaultResultNamingStrategy implements ResultNamingStrategy {

    public static final DefaultResultNamingStrategy INSTANCE = new DefaultResultNamingStrategy();

    @Override
    public String getResultName(String testName, TestDefinition<?> test, Case<?> testCase, Assertion<?> assertion) {
        boolean manyCases = test.getCases().size() > 1;
        boolean manyAssertions = testCase.getAssertions().size() > 1;
        if (manyCases && manyAssertions) {
            return assertion.getDescription() + " for test case " + testCase.describe();
        } else if (manyCases) {
            return testCase.describe();
        } else if (manyAssertions) {
            return assertion.getDescription();
        } else {
            return testName;
        }
    }

}
