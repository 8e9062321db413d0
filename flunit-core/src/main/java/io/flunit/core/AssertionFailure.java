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
 * Thrown by {@link Assertion#evaluate()} when a check fails, or when the outcome of the
 * case contradicts the expectation of the assertion (returned when a throw was expected,
 * or the reverse). Scoped to a single assertion.
 */
public class AssertionFailure extends AssertionError implements TestFailureDetails {

    private final String resultStackTrace;

    public AssertionFailure(String message) {
        super(message);
        this.resultStackTrace = null;
    }

    public AssertionFailure(String message, Throwable cause) {
        super(message, cause);
        this.resultStackTrace = TestFailureDetails.toStackTrace(cause);
    }

    /**
     * Wraps an error raised by a user check, keeping its message and stack trace.
     */
    public static AssertionFailure wrap(Throwable cause) {
        return new AssertionFailure(cause.getMessage(), cause);
    }

    public static AssertionFailure unexpectedError(Throwable error) {
        return new AssertionFailure("Expected the operation to return, but it threw "
                + error.getClass().getName() + ": " + error.getMessage(), error);
    }

    public static AssertionFailure missingError() {
        return new AssertionFailure("Expected the operation to throw, but it returned normally");
    }

    @Override
    public String getResultMessage() {
        return getMessage();
    }

    @Override
    public String getResultStackTrace() {
        return resultStackTrace != null ? resultStackTrace : TestFailureDetails.toStackTrace(this);
    }

}
