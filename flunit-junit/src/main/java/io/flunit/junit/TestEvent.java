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
package io.flunit.junit;

import io.flunit.run.RunResult;
import io.flunit.run.TestResult;

/**
 * Events flowing from the run thread to the JUnit thread through a blocking queue.
 */
public sealed interface TestEvent permits
        TestEvent.TestEnd,
        TestEvent.RunEnd,
        TestEvent.RunError {

    /**
     * Fired when a test (all its cases) completes. Becomes one node of the JUnit tree.
     */
    record TestEnd(TestResult result) implements TestEvent {
    }

    /**
     * Fired when the run completes. Ends the event stream.
     */
    record RunEnd(RunResult result) implements TestEvent {
    }

    /**
     * Fired when the run itself breaks. Reported as a failed node, then ends the stream.
     */
    record RunError(Throwable error) implements TestEvent {
    }

}
