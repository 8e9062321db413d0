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

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AssertionTest {

    private static <R> Assertion<R> single(Operation<R> operation, Assertion.Expectation expectation, Assertion.Check<R> check) {
        Case<R> testCase = new Case<>(Prerequisites.of(3), operation,
                c -> List.of(Assertion.of(c, "check", expectation, check)));
        return testCase.getAssertions().get(0);
    }

    private static Operation<Integer> returning(int value) {
        return Operation.function(given -> value);
    }

    private static Operation<Integer> throwing(String message) {
        return Operation.function(given -> {
            throw new IllegalStateException(message);
        });
    }

    @Test
    void testEvaluateBeforeActIsProgrammingError() {
        Assertion<Integer> assertion = single(returning(1), Assertion.Expectation.NONE, null);
        assertThrows(IllegalStateException.class, assertion::evaluate);
    }

    @Test
    void testCheckReceivesPrerequisitesAndOutcome() {
        Assertion<Integer> assertion = single(returning(6), Assertion.Expectation.NONE, (given, outcome) -> {
            assertEquals(Prerequisites.of(3), given);
            assertEquals(6, outcome.getValue());
        });
        assertion.getCase().act();
        assertDoesNotThrow(assertion::evaluate);
    }

    @Test
    void testNoneExpectationSeesFailure() {
        Assertion<Integer> assertion = single(throwing("boom"), Assertion.Expectation.NONE,
                (given, outcome) -> assertEquals("boom", outcome.getError().getMessage()));
        assertion.getCase().act();
        assertDoesNotThrow(assertion::evaluate);
    }

    @Test
    void testMustReturnFailsOnThrownErrorWithoutRunningCheck() {
        AtomicInteger calls = new AtomicInteger();
        Assertion<Integer> assertion = single(throwing("boom"), Assertion.Expectation.MUST_RETURN,
                (given, outcome) -> calls.incrementAndGet());
        assertion.getCase().act();
        AssertionFailure e = assertThrows(AssertionFailure.class, assertion::evaluate);
        assertTrue(e.getMessage().contains("boom"), e.getMessage());
        assertTrue(e.getMessage().contains(IllegalStateException.class.getName()), e.getMessage());
        assertEquals(0, calls.get());
    }

    @Test
    void testMustThrowFailsOnReturnWithoutRunningCheck() {
        AtomicInteger calls = new AtomicInteger();
        Assertion<Integer> assertion = single(returning(1), Assertion.Expectation.MUST_THROW,
                (given, outcome) -> calls.incrementAndGet());
        assertion.getCase().act();
        AssertionFailure e = assertThrows(AssertionFailure.class, assertion::evaluate);
        assertEquals("Expected the operation to throw, but it returned normally", e.getMessage());
        assertEquals(0, calls.get());
    }

    @Test
    void testMustThrowPassesErrorToCheck() {
        Assertion<Integer> assertion = single(throwing("boom"), Assertion.Expectation.MUST_THROW,
                (given, outcome) -> assertInstanceOf(IllegalStateException.class, outcome.getError()));
        assertion.getCase().act();
        assertDoesNotThrow(assertion::evaluate);
    }

    @Test
    void testCheckErrorIsWrapped() {
        Assertion<Integer> assertion = single(returning(1), Assertion.Expectation.MUST_RETURN,
                (given, outcome) -> assertEquals(2, outcome.getValue(), "wrong value"));
        assertion.getCase().act();
        AssertionFailure e = assertThrows(AssertionFailure.class, assertion::evaluate);
        assertInstanceOf(AssertionError.class, e.getCause());
        assertEquals(e.getCause().getMessage(), e.getMessage());
        assertTrue(e.getResultStackTrace().contains("AssertionFailedError"), e.getResultStackTrace());
    }

    @Test
    void testCheckExceptionIsWrapped() {
        Assertion<Integer> assertion = single(returning(1), Assertion.Expectation.NONE, (given, outcome) -> {
            throw new IOException("disk full");
        });
        assertion.getCase().act();
        AssertionFailure e = assertThrows(AssertionFailure.class, assertion::evaluate);
        assertEquals("disk full", e.getMessage());
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void testCheckJvmErrorIsWrapped() {
        Assertion<Integer> assertion = single(returning(1), Assertion.Expectation.NONE, (given, outcome) -> {
            throw new NoClassDefFoundError("missing");
        });
        assertion.getCase().act();
        AssertionFailure e = assertThrows(AssertionFailure.class, assertion::evaluate);
        assertEquals("missing", e.getMessage());
        assertInstanceOf(NoClassDefFoundError.class, e.getCause());
    }

    @Test
    void testFailureDetailsPassThrough() {
        TestFailure failure = new TestFailure("custom");
        Assertion<Integer> assertion = single(returning(1), Assertion.Expectation.NONE, (given, outcome) -> {
            throw failure;
        });
        assertion.getCase().act();
        TestFailure e = assertThrows(TestFailure.class, assertion::evaluate);
        assertSame(failure, e);
    }

    @Test
    void testAsyncCheckFailure() {
        Case<Integer> testCase = new Case<>(Prerequisites.empty(), returning(1), c -> List.of(
                new Assertion<>(c, "async", Assertion.Expectation.NONE,
                        (given, outcome) -> CompletableFuture.failedFuture(new IllegalStateException("later")))));
        testCase.act();
        AssertionFailure e = assertThrows(AssertionFailure.class, () -> testCase.getAssertions().get(0).evaluate());
        assertEquals("later", e.getMessage());
    }

    @Test
    void testEvaluationIsNotCached() {
        AtomicInteger calls = new AtomicInteger();
        Assertion<Integer> assertion = single(returning(1), Assertion.Expectation.NONE,
                (given, outcome) -> calls.incrementAndGet());
        assertion.getCase().act();
        assertion.evaluate();
        assertion.evaluate();
        assertEquals(2, calls.get());
    }

    @Test
    void testImplicitCheckPassesWhenExpectationMet() {
        Assertion<Integer> assertion = single(returning(1), Assertion.Expectation.MUST_RETURN, null);
        assertion.getCase().act();
        assertDoesNotThrow(assertion::evaluate);
        assertEquals("check", assertion.getDescription());
        assertEquals(Assertion.Expectation.MUST_RETURN, assertion.getExpectation());
    }

}
