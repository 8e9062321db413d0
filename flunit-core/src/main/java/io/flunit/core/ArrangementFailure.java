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
package io.flunit.core;

/**
 * Thrown by {@link TestDefinition#arrange(TestContext)} when a "Given" clause (or the
 * construction of a case) fails. Fatal for the whole definition: no cases are produced.
 */
public class ArrangementFailure extends RuntimeException implements TestFailureDetails {

    public static final String MESSAGE_PREFIX = "Arrangement failed: ";

    private final String resultStackTrace;

    public ArrangementFailure(Throwable cause) {
        super(MESSAGE_PREFIX + cause.getMessage(), cause);
        this.resultStackTrace = TestFailureDetails.toStackTrace(cause);
    }

    @Override
    public String getResultMessage() {
        return getMessage();
    }

    @Override
    public String getResultStackTrace() {
        return resultStackTrace;
    }

}
