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
package io.flunit.run.fixtures;

import io.flunit.builder.TestThat;
import io.flunit.core.TestDefinition;
import io.flunit.run.Trait;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests used by the run and discovery tests: one passing, one failing, one that cannot
 * be arranged.
 */
@Trait(name = "area", value = "calculator")
public class CalculatorDefinitions {

    public static final TestDefinition<Integer> ADDITION = TestThat
            .givenEachOf(() -> List.of(1, 2))
            .and(() -> 10)
            .when((x, y) -> x + y)
            .thenReturns()
            .andReturns("sum is larger than ten", value -> assertTrue(value > 10))
            .build();

    @Trait(name = "category", value = "broken")
    public static final TestDefinition<Integer> DIVISION = TestThat
            .given(() -> 0)
            .when(x -> 10 / x)
            .thenReturns()
            .build();

    public static final TestDefinition<Integer> UNREACHABLE_DATABASE = TestThat
            .<Integer>given(() -> {
                throw new IllegalStateException("db down");
            })
            .when(x -> x)
            .thenReturns()
            .build();

    public static TestDefinition<String> greeting() {
        return TestThat.given(() -> "world")
                .when(name -> "hello " + name)
                .thenReturns("greets by name", value -> assertEquals("hello world", value))
                .build();
    }

    // not tests: wrong type, not static, needs arguments
    public static final String NAME = "calculator";

    public final TestDefinition<Integer> instanceTest = TestThat.when(() -> 1).thenReturns().build();

    public static TestDefinition<Integer> parameterized(int value) {
        return TestThat.when(() -> value).thenReturns().build();
    }

}
