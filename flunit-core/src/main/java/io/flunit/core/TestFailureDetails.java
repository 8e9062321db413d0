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

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Implemented by errors that control the message and stack trace recorded in a test result.
 * <p>
 * Assertion evaluation passes errors implementing this interface through unchanged,
 * so a richer failure-reporting layer can attach its own details without them being
 * wrapped a second time.
 */
public interface TestFailureDetails {

    /**
     * The error message that should be recorded in the test result.
     */
    String getResultMessage();

    /**
     * The stack trace that should be recorded in the test result, may be null.
     */
    String getResultStackTrace();

    static String messageOf(Throwable error) {
        if (error instanceof TestFailureDetails) {
            return ((TestFailureDetails) error).getResultMessage();
        }
        return error.getMessage();
    }

    static String stackTraceOf(Throwable error) {
        if (error instanceof TestFailureDetails) {
            return ((TestFailureDetails) error).getResultStackTrace();
        }
        return toStackTrace(error);
    }

    static String toStackTrace(Throwable error) {
        if (error == null) {
            return null;
        }
        StringWriter sw = new StringWriter();
        error.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

}
