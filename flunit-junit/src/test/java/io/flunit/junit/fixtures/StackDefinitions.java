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
package io.flunit.junit.fixtures;

import io.flunit.builder.TestThat;
import io.flunit.core.TestDefinition;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

public class StackDefinitions {

    public static final TestDefinition<Void> PUSH = TestThat
            .givenEachOf(() -> List.of(1, 2, 3))
            .and(() -> new ArrayDeque<Integer>())
            .whenAction((value, stack) -> stack.push(value))
            .thenReturns()
            .andReturns("stack holds the value", given -> {
                Deque<Integer> stack = given.value(1);
                assertEquals(given.<Integer>value(0), stack.peek());
            })
            .build();

    public static final TestDefinition<Integer> POP_EMPTY = TestThat
            .given(() -> new ArrayDeque<Integer>())
            .when(Deque::pop)
            .thenThrows(NoSuchElementException.class)
            .build();

}
