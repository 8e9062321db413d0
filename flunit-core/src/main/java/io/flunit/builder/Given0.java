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
import io.flunit.core.Operation;
import io.flunit.core.PrerequisiteSource;
import io.flunit.core.ThrowingRunnable;

import java.util.concurrent.Callable;

/**
 * A test with configuration overrides but no "Given" clause yet.
 */
public class Given0 {

    private final BuilderState state;

    Given0(BuilderState state) {
        this.state = state;
    }

    public Given0 usingConfiguration(ConfigOverride override) {
        return new Given0(state.withOverride(override));
    }

    public <T1> Given1<T1> given(Callable<? extends T1> getter) {
        return given(PrerequisiteSource.<T1>single(getter));
    }

    public <T1> Given1<T1> givenEachOf(Callable<? extends Iterable<? extends T1>> getter) {
        return given(PrerequisiteSource.<T1>eachOf(getter));
    }

    public <T1> Given1<T1> given(PrerequisiteSource<T1> source) {
        return new Given1<>(state.withSource(source));
    }

    public <R> FunctionTestBuilder<R> when(Callable<? extends R> function) {
        return new FunctionTestBuilder<>(state, Operation.<R>function(given -> function.call()));
    }

    public ActionTestBuilder whenAction(ThrowingRunnable action) {
        return new ActionTestBuilder(state, Operation.action(given -> action.run()));
    }

}
