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

import io.flunit.core.Operation;
import io.flunit.core.PrerequisiteSource;
import io.flunit.core.ThrowingBiConsumer;

import java.util.concurrent.Callable;

public class Given2<T1, T2> {

    private final BuilderState state;

    Given2(BuilderState state) {
        this.state = state;
    }

    public <T3> Given3<T1, T2, T3> and(Callable<? extends T3> getter) {
        return and(PrerequisiteSource.<T3>single(getter));
    }

    public <T3> Given3<T1, T2, T3> andEachOf(Callable<? extends Iterable<? extends T3>> getter) {
        return and(PrerequisiteSource.<T3>eachOf(getter));
    }

    public <T3> Given3<T1, T2, T3> and(PrerequisiteSource<T3> source) {
        return new Given3<>(state.withSource(source));
    }

    public <R> FunctionTestBuilder<R> when(ThrowingBiFunction<? super T1, ? super T2, ? extends R> function) {
        return new FunctionTestBuilder<>(state,
                Operation.<R>function(given -> function.apply(given.value(0), given.value(1))));
    }

    public ActionTestBuilder whenAction(ThrowingBiConsumer<? super T1, ? super T2> action) {
        return new ActionTestBuilder(state,
                Operation.action(given -> action.accept(given.value(0), given.value(1))));
    }

}
