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

import io.flunit.run.ResultListener;
import io.flunit.run.TestResult;

import java.util.concurrent.BlockingQueue;

/**
 * Publishes the results of a {@link io.flunit.run.TestRun} to the queue consumed by
 * {@link StreamingTestIterator} on the JUnit thread. The end of the stream is published
 * by {@link FlUnit} once the run has returned (or thrown).
 */
public class JUnitBridgeListener implements ResultListener {

    private final BlockingQueue<TestEvent> eventQueue;

    public JUnitBridgeListener(BlockingQueue<TestEvent> eventQueue) {
        this.eventQueue = eventQueue;
    }

    @Override
    public void onTestEnd(TestResult result) {
        putEvent(new TestEvent.TestEnd(result));
    }

    void putEvent(TestEvent event) {
        try {
            eventQueue.put(event);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while publishing test event", e);
        }
    }

}
