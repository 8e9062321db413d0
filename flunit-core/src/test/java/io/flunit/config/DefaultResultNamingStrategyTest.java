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
package io.flunit.config;

import io.flunit.builder.TestThat;
import io.flunit.core.Case;
import io.flunit.core.TestContext;
import io.flunit.core.TestDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefaultResultNamingStrategyTest {

    private static final ResultNamingStrategy strategy = DefaultResultNamingStrategy.INSTANCE;

    private static <R> String nameOf(TestDefinition<R> test, int caseIndex, int assertionIndex) {
        test.arrange(TestContext.defaults());
        Case<R> c = test.getCases().get(caseIndex);
        return strategy.getResultName("MathTests.ADDITION", test, c, c.getAssertions().get(assertionIndex));
    }

    @Test
    void testSingleCaseSingleAssertionUsesTestName() {
        TestDefinition<Integer> test = TestThat.given(() -> 1).when(x -> x).thenReturns().build();
        assertEquals("MathTests.ADDITION", nameOf(test, 0, 0));
    }

    @Test
    void testManyCasesUsesCase() {
        TestDefinition<Integer> test = TestThat.givenEachOf(() -> List.of(1, 2)).when(x -> x).thenReturns().build();
        assertEquals("(2)", nameOf(test, 1, 0));
    }

    @Test
    void testManyAssertionsUsesAssertion() {
        TestDefinition<Integer> test = TestThat.given(() -> 1).when(x -> x)
                .thenReturns()
                .andReturns("is one", value -> assertEquals(1, value))
                .build();
        assertEquals("is one", nameOf(test, 0, 1));
    }

    @Test
    void testManyCasesAndAssertions() {
        TestDefinition<Integer> test = TestThat.givenEachOf(() -> List.of(1, 2)).when(x -> x)
                .thenReturns()
                .andReturns("is positive", value -> assertTrue(value > 0))
                .build();
        assertEquals("is positive for test case (1)", nameOf(test, 0, 1));
    }

}
