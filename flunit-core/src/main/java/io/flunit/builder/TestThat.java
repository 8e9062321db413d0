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
package io.flunit.builder;

import io.flunit.config.ConfigOverride;
import io.flunit.core.PrerequisiteSource;
import io.flunit.core.ThrowingRunnable;

import java.util.concurrent.Callable;

/**
 * Entry point of the fluent test builder.
 * <pre>
 * public static final TestDefinition&lt;Integer&gt; ADDITION = TestThat
 *         .givenEachOf(() -&gt; List.of(1, 2, 3))
 *         .and(() -&gt; 10)
 *         .when((x, y) -&gt; x + y)
 *         .thenReturns()
 *         .andReturns("sum is greater than both terms", (given, sum) -&gt; assertTrue(sum &gt; 10))
 *         .build();
 * </pre>
 * Functions are declared with {@code when}, actions (no return value) with
 * {@code whenAction}.
 */
public final class TestThat {

    private TestThat() {
    }

    public static Given0 usingConfiguration(ConfigOverride override) {
        return new Given0(BuilderState.EMPTY.withOverride(override));
    }

    public static <T1> Given1<T1> given(Callable<? extends T1> getter) {
        return new Given0(BuilderState.EMPTY).given(getter);
    }

    public static <T1> Given1<T1> givenEachOf(Callable<? extends Iterable<? extends T1>> getter) {
        return new Given0(BuilderState.EMPTY).givenEachOf(getter);
    }

    public static <T1> Given1<T1> given(PrerequisiteSource<T1> source) {
        return new Given0(BuilderState.EMPTY).given(source);
    }

    public static <R> FunctionTestBuilder<R> when(Callable<? extends R> function) {
        return new Given0(BuilderState.EMPTY).when(function);
    }

    public static ActionTestBuilder whenAction(ThrowingRunnable action) {
        return new Given0(BuilderState.EMPTY).whenAction(action);
    }

}
