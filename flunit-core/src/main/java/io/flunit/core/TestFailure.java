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
 * Error for test code that wants fine control over the message and stack trace of a
 * failed result. Passes through assertion evaluation without being wrapped.
 */
public class TestFailure extends AssertionError implements TestFailureDetails {

    private final String resultMessage;
    private final String resultStackTrace;

    public TestFailure(String resultMessage) {
        super("FlUnit test failed with error message: " + resultMessage);
        this.resultMessage = resultMessage;
        this.resultStackTrace = null;
    }

    public TestFailure(String resultMessage, String resultStackTrace, Throwable cause) {
        super("FlUnit test failed with error message: " + resultMessage, cause);
        this.resultMessage = resultMessage;
        this.resultStackTrace = resultStackTrace;
    }

    @Override
    public String getResultMessage() {
        return resultMessage;
    }

    @Override
    public String getResultStackTrace() {
        return resultStackTrace;
    }

}
