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

import io.flunit.config.ConfigOverride;
import io.flunit.config.TestConfiguration;
import io.flunit.run.TestOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class TestDefinitionTest {

    private static <R> Function<Case<R>, List<Assertion<R>>> assertions(String description, Assertion.Expectation expectation,
                                                                        Assertion.Check<R> check) {
        return c -> List.of(Assertion.of(c, description, expectation, check));
    }

    private static <R> void runAll(TestDefinition<R> test) {
        for (Case<R> c : test.getCases()) {
            c.act();
            for (Assertion<R> assertion : c.getAssertions()) {
                assertion.evaluate();
            }
        }
    }

    @Test
    void testNoGivenReturning42() {
        TestDefinition<Integer> test = new TestDefinition<>(List.of(), List.of(),
                Operation.function(given -> 42),
                assertions("returns 42", Assertion.Expectation.MUST_RETURN,
                        (given, outcome) -> assertEquals(42, outcome.getValue())));
        test.arrange(TestContext.defaults());
        assertEquals(1, test.getCases().size());
        Case<Integer> c = test.getCases().get(0);
        c.act();
        assertEquals(42, c.getOutcome().getValue());
        assertDoesNotThrow(() -> c.getAssertions().get(0).evaluate());
    }

    @Test
    void testTwoGivensProduceFourCasesInOrder() {
        TestDefinition<String> test = new TestDefinition<>(List.of(),
                List.of(PrerequisiteSource.eachOf(() -> List.of(1, 2)), PrerequisiteSource.eachOf(() -> List.of("a", "b"))),
                Operation.function(given -> "" + given.get(0) + given.get(1)),
                assertions("returns", Assertion.Expectation.MUST_RETURN, null));
        test.arrange(TestContext.defaults());
        List<Case<String>> cases = test.getCases();
        assertEquals(4, cases.size());
        assertEquals(Prerequisites.of(1, "a"), cases.get(0).getPrerequisites());
        assertEquals(Prerequisites.of(1, "b"), cases.get(1).getPrerequisites());
        assertEquals(Prerequisites.of(2, "a"), cases.get(2).getPrerequisites());
        assertEquals(Prerequisites.of(2, "b"), cases.get(3).getPrerequisites());
        runAll(test);
        assertEquals("2b", cases.get(3).getOutcome().getValue());
    }

    @Test
    void testThrowingOperation() {
        Operation<Integer> boom = Operation.function(given -> {
            throw new IllegalStateException("boom");
        });
        TestDefinition<Integer> throwsTest = new TestDefinition<>(List.of(), List.of(), boom,
                assertions("throws", Assertion.Expectation.MUST_THROW, null));
        throwsTest.arrange(TestContext.defaults());
        Case<Integer> c = throwsTest.getCases().get(0);
        c.act();
        assertEquals("boom", c.getOutcome().getError().getMessage());
        assertDoesNotThrow(() -> c.getAssertions().get(0).evaluate());

        TestDefinition<Integer> returnsTest = new TestDefinition<>(List.of(), List.of(), boom,
                assertions("returns", Assertion.Expectation.MUST_RETURN, null));
        returnsTest.arrange(TestContext.defaults());
        AssertionFailure e = assertThrows(AssertionFailure.class, () -> runAll(returnsTest));
        assertTrue(e.getMessage().contains("boom"), e.getMessage());
    }

    @Test
    void testThrowingGivenFailsArrangement() {
        TestDefinition<Integer> test = new TestDefinition<>(List.of(),
                List.of(PrerequisiteSource.single(() -> {
                    throw new IllegalStateException("db down");
                })),
                Operation.function(given -> 1),
                assertions("returns", Assertion.Expectation.MUST_RETURN, null));
        ArrangementFailure e = assertThrows(ArrangementFailure.class, () -> test.arrange(TestContext.defaults()));
        assertEquals("Arrangement failed: db down", e.getMessage());
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertTrue(e.getResultStackTrace().contains("db down"), e.getResultStackTrace());
        assertFalse(test.isArranged());
        IllegalStateException notArranged = assertThrows(IllegalStateException.class, test::getCases);
        assertEquals("Test not yet arranged", notArranged.getMessage());
    }

    @Test
    void testAssertionFactoryErrorFailsArrangement() {
        TestDefinition<Integer> test = new TestDefinition<>(List.of(), List.of(),
                Operation.function(given -> 1),
                c -> {
                    throw new IllegalArgumentException("bad assertion");
                });
        ArrangementFailure e = assertThrows(ArrangementFailure.class, () -> test.arrange(TestContext.defaults()));
        assertEquals("Arrangement failed: bad assertion", e.getMessage());
    }

    @Test
    void testGetCasesBeforeArrange() {
        TestDefinition<Integer> test = new TestDefinition<>(List.of(), List.of(), Operation.function(given -> 1),
                assertions("returns", Assertion.Expectation.MUST_RETURN, null));
        assertThrows(IllegalStateException.class, test::getCases);
    }

    @Test
    void testRearrangeBuildsFreshCases() {
        AtomicInteger evaluations = new AtomicInteger();
        TestDefinition<Integer> test = new TestDefinition<>(List.of(),
                List.of(PrerequisiteSource.single(evaluations::incrementAndGet)),
                Operation.function(given -> given.<Integer>value(0)),
                assertions("returns", Assertion.Expectation.MUST_RETURN, null));
        test.arrange(TestContext.defaults());
        List<Case<Integer>> first = test.getCases();
        first.get(0).act();
        test.arrange(TestContext.defaults());
        List<Case<Integer>> second = test.getCases();
        assertNotSame(first, second);
        assertEquals(2, evaluations.get());
        assertEquals(Prerequisites.of(1), first.get(0).getPrerequisites());
        assertEquals(Prerequisites.of(2), second.get(0).getPrerequisites());
        assertNull(second.get(0).getOutcome());
        assertThrows(UnsupportedOperationException.class, () -> second.add(second.get(0)));
    }

    @Test
    void testFailedRearrangeWithdrawsCases() {
        AtomicInteger calls = new AtomicInteger();
        TestDefinition<Integer> test = new TestDefinition<>(List.of(),
                List.of(PrerequisiteSource.single(() -> {
                    if (calls.incrementAndGet() > 1) {
                        throw new IllegalStateException("second time");
                    }
                    return 1;
                })),
                Operation.function(given -> 1),
                assertions("returns", Assertion.Expectation.MUST_RETURN, null));
        test.arrange(TestContext.defaults());
        List<Case<Integer>> first = test.getCases();
        assertThrows(ArrangementFailure.class, () -> test.arrange(TestContext.defaults()));
        assertThrows(IllegalStateException.class, test::getCases);
        assertEquals(1, first.size());
    }

    @Test
    void testOverlappingArrangementsPublishLatest() {
        AtomicInteger calls = new AtomicInteger();
        CompletableFuture<List<Integer>> slow = new CompletableFuture<>();
        TestDefinition<Integer> test = new TestDefinition<>(List.of(),
                List.of(PrerequisiteSource.<Integer>async(context -> calls.incrementAndGet() == 1
                        ? slow : CompletableFuture.completedFuture(List.of(2)))),
                Operation.function(given -> given.<Integer>value(0)),
                assertions("returns", Assertion.Expectation.MUST_RETURN, null));
        CompletableFuture<List<Case<Integer>>> older = test.arrangeAsync(TestContext.defaults());
        CompletableFuture<List<Case<Integer>>> newer = test.arrangeAsync(TestContext.defaults());
        assertTrue(newer.isDone());
        slow.complete(List.of(1));
        assertEquals(Prerequisites.of(1), older.join().get(0).getPrerequisites());
        assertSame(newer.join(), test.getCases());
        assertEquals(Prerequisites.of(2), test.getCases().get(0).getPrerequisites());
    }

    @Test
    void testConfigurationOverridesAppliedInOrder() {
        ConfigOverride fail = config -> config.setArrangementFailureOutcome(TestOutcome.FAILED);
        ConfigOverride skip = config -> config.setArrangementFailureOutcome(TestOutcome.SKIPPED);
        TestDefinition<Integer> test = new TestDefinition<>(List.of(skip, fail), List.of(),
                Operation.function(given -> 1), assertions("returns", Assertion.Expectation.MUST_RETURN, null));
        assertTrue(test.hasConfigurationOverrides());
        TestConfiguration configuration = new TestConfiguration();
        test.applyConfigurationOverrides(configuration);
        assertEquals(TestOutcome.FAILED, configuration.getArrangementFailureOutcome());
    }

}
