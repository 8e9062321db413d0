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

import io.flunit.run.AssertionResult;
import io.flunit.run.TestMetadata;
import io.flunit.run.TestResult;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DynamicContainer;
import org.junit.jupiter.api.DynamicNode;
import org.junit.jupiter.api.DynamicTest;
import org.opentest4j.TestAbortedException;

import java.net.URI;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A blocking iterator that yields {@link DynamicNode}s as the tests of a run complete.
 * <p>
 * Supports two modes:
 * <ul>
 *   <li><b>Flat mode</b>: each result becomes a top-level {@link DynamicTest}</li>
 *   <li><b>Hierarchical mode</b>: each test becomes a {@link DynamicContainer} of its results</li>
 * </ul>
 * A failed result rethrows the recorded error, so that JUnit reports the original
 * message and stack trace. A skipped result (a test whose arrangement failed) aborts.
 */
public class StreamingTestIterator implements Iterator<DynamicNode> {

    private static final long DEFAULT_TIMEOUT_MINUTES = 30;

    private final BlockingQueue<TestEvent> eventQueue;
    private final boolean hierarchical;
    private final long timeoutMinutes;

    private final List<DynamicNode> buffered = new ArrayList<>();
    private boolean finished;

    public StreamingTestIterator(BlockingQueue<TestEvent> eventQueue, boolean hierarchical) {
        this(eventQueue, hierarchical, DEFAULT_TIMEOUT_MINUTES);
    }

    public StreamingTestIterator(BlockingQueue<TestEvent> eventQueue, boolean hierarchical, long timeoutMinutes) {
        this.eventQueue = eventQueue;
        this.hierarchical = hierarchical;
        this.timeoutMinutes = timeoutMinutes;
    }

    @Override
    public boolean hasNext() {
        if (!buffered.isEmpty()) {
            return true;
        }
        try {
            while (buffered.isEmpty() && !finished) {
                TestEvent event = eventQueue.poll(timeoutMinutes, TimeUnit.MINUTES);
                if (event == null) {
                    throw new RuntimeException("Timeout waiting for FlUnit test events after " + timeoutMinutes + " minutes");
                }
                processEvent(event);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return !buffered.isEmpty();
    }

    @Override
    public DynamicNode next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more test events");
        }
        return buffered.remove(0);
    }

    public Stream<DynamicNode> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED),
                false
        );
    }

    private void processEvent(TestEvent event) {
        if (event instanceof TestEvent.TestEnd) {
            TestResult result = ((TestEvent.TestEnd) event).result();
            if (hierarchical) {
                buffered.add(createContainer(result));
            } else {
                for (AssertionResult ar : result.getResults()) {
                    buffered.add(createDynamicTest(flatName(result.getMetadata(), ar), ar));
                }
            }
        } else if (event instanceof TestEvent.RunError) {
            Throwable error = ((TestEvent.RunError) event).error();
            buffered.add(DynamicTest.dynamicTest("FlUnit run", () -> {
                throw error;
            }));
            finished = true;
        } else if (event instanceof TestEvent.RunEnd) {
            finished = true;
        }
    }

    private DynamicContainer createContainer(TestResult result) {
        TestMetadata metadata = result.getMetadata();
        List<DynamicTest> tests = new ArrayList<>();
        for (AssertionResult ar : result.getResults()) {
            String name = ar.getDisplayName() != null ? ar.getDisplayName() : metadata.getMemberName();
            tests.add(createDynamicTest(name, ar));
        }
        URI source = URI.create("class:" + metadata.getDeclaringClass().getName());
        return DynamicContainer.dynamicContainer(metadata.getDisplayName(), source, tests.stream());
    }

    private static String flatName(TestMetadata metadata, AssertionResult result) {
        if (result.getDisplayName() == null || result.getDisplayName().equals(metadata.getDisplayName())) {
            return metadata.getDisplayName();
        }
        return metadata.getDisplayName() + ": " + result.getDisplayName();
    }

    static DynamicTest createDynamicTest(String displayName, AssertionResult result) {
        return DynamicTest.dynamicTest(displayName, () -> {
            if (result.isSkipped()) {
                throw new TestAbortedException(result.getErrorMessage(), result.getError());
            }
            if (result.isFailed()) {
                Throwable error = result.getError();
                if (error != null) {
                    throw error;
                }
                String message = result.getErrorMessage();
                Assertions.fail(message != null ? message : "Test failed");
            }
        });
    }

}
