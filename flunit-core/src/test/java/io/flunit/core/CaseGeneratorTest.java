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

import io.flunit.config.TestConfiguration;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class CaseGeneratorTest {

    private static List<Prerequisites> generate(List<PrerequisiteSource<?>> sources) {
        return CaseGenerator.generate(sources, TestContext.defaults()).join();
    }

    @Test
    void testNoSourcesYieldsSingleEmptyTuple() {
        List<Prerequisites> tuples = generate(List.of());
        assertEquals(1, tuples.size());
        assertTrue(tuples.get(0).isEmpty());
    }

    @Test
    void testNestedLoopOrder() {
        List<Prerequisites> tuples = generate(List.of(
                PrerequisiteSource.eachOf(() -> List.of(1, 2)),
                PrerequisiteSource.eachOf(() -> List.of("a", "b", "c")),
                PrerequisiteSource.single(() -> true)));
        assertEquals(6, tuples.size());
        assertEquals(Prerequisites.of(1, "a", true), tuples.get(0));
        assertEquals(Prerequisites.of(1, "b", true), tuples.get(1));
        assertEquals(Prerequisites.of(1, "c", true), tuples.get(2));
        assertEquals(Prerequisites.of(2, "a", true), tuples.get(3));
        assertEquals(Prerequisites.of(2, "c", true), tuples.get(5));
    }

    @Test
    void testEmptySourceYieldsNoTuples() {
        List<Prerequisites> tuples = generate(List.of(
                PrerequisiteSource.eachOf(() -> List.of(1, 2)),
                PrerequisiteSource.eachOf(Collections::emptyList)));
        assertTrue(tuples.isEmpty());
    }

    @Test
    void testEachSourceEvaluatedOnceInOrder() {
        List<String> calls = new ArrayList<>();
        generate(List.of(
                PrerequisiteSource.eachOf(() -> {
                    calls.add("first");
                    return List.of(1, 2, 3);
                }),
                PrerequisiteSource.eachOf(() -> {
                    calls.add("second");
                    return List.of(4, 5);
                })));
        assertEquals(List.of("first", "second"), calls);
    }

    @Test
    void testSecondSourceStartsAfterFirstCompletes() {
        CompletableFuture<List<Integer>> first = new CompletableFuture<>();
        List<String> calls = new ArrayList<>();
        CompletableFuture<List<Prerequisites>> result = CaseGenerator.generate(List.of(
                PrerequisiteSource.async(context -> first),
                PrerequisiteSource.eachOf(() -> {
                    calls.add("second");
                    return List.of("x");
                })), TestContext.defaults());
        assertTrue(calls.isEmpty());
        assertFalse(result.isDone());
        first.complete(List.of(7));
        assertEquals(List.of(Prerequisites.of(7, "x")), result.join());
        assertEquals(List.of("second"), calls);
    }

    @Test
    void testThrowingSourceFailsGeneration() {
        List<PrerequisiteSource<?>> sources = List.of(
                PrerequisiteSource.single(() -> 1),
                PrerequisiteSource.single(() -> {
                    throw new IllegalArgumentException("db down");
                }));
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> CaseGenerator.generate(sources, TestContext.defaults()).get());
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertEquals("db down", e.getCause().getMessage());
    }

    @Test
    void testFailedStageFailsGeneration() {
        List<PrerequisiteSource<?>> sources = List.of(
                PrerequisiteSource.async(context -> CompletableFuture.failedFuture(new IllegalStateException("async boom"))));
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> CaseGenerator.generate(sources, TestContext.defaults()).get());
        assertEquals("async boom", Futures.unwrap(e).getMessage());
    }

    @Test
    void testNullSequenceFailsGeneration() {
        List<PrerequisiteSource<?>> sources = List.of(PrerequisiteSource.eachOf(() -> null));
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> CaseGenerator.generate(sources, TestContext.defaults()).get());
        assertInstanceOf(IllegalStateException.class, Futures.unwrap(e));
    }

    @Test
    void testIterationErrorFailsGeneration() {
        Iterable<Integer> broken = () -> new Iterator<Integer>() {
            private int count;

            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public Integer next() {
                if (count++ == 2) {
                    throw new IllegalStateException("cursor closed");
                }
                return count;
            }
        };
        List<PrerequisiteSource<?>> sources = List.of(PrerequisiteSource.eachOf(() -> broken));
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> CaseGenerator.generate(sources, TestContext.defaults()).get());
        assertEquals("cursor closed", Futures.unwrap(e).getMessage());
    }

    @Test
    void testContextualSourceSeesCancellation() {
        TestContext context = new TestContext(new TestConfiguration(), () -> true);
        List<PrerequisiteSource<?>> sources = List.of(PrerequisiteSource.contextual(ctx -> {
            ctx.throwIfCancellationRequested();
            return List.of(1);
        }));
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> CaseGenerator.generate(sources, context).get());
        assertEquals("Test run cancelled", Futures.unwrap(e).getMessage());
    }

}
