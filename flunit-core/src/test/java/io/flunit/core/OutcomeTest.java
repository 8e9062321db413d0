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

import static org.junit.jupiter.api.Assertions.*;

class OutcomeTest {

    @Test
    void testSuccess() {
        Outcome<Integer> outcome = Outcome.success(42);
        assertTrue(outcome.isSuccess());
        assertFalse(outcome.isFailure());
        assertEquals(Outcome.Kind.SUCCESS, outcome.getKind());
        assertEquals(42, outcome.getValue());
        assertThrows(IllegalStateException.class, outcome::getError);
    }

    @Test
    void testSuccessWithNullValue() {
        Outcome<Void> outcome = Outcome.success(null);
        assertTrue(outcome.isSuccess());
        assertNull(outcome.getValue());
    }

    @Test
    void testFailure() {
        RuntimeException error = new RuntimeException("boom");
        Outcome<Integer> outcome = Outcome.failure(error);
        assertTrue(outcome.isFailure());
        assertSame(error, outcome.getError());
        IllegalStateException e = assertThrows(IllegalStateException.class, outcome::getValue);
        assertSame(error, e.getCause());
    }

    @Test
    void testFailureRequiresError() {
        assertThrows(NullPointerException.class, () -> Outcome.failure(null));
    }

}
