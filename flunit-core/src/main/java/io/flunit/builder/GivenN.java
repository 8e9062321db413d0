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
import io.flunit.core.Prerequisites;
import io.flunit.core.ThrowingConsumer;
import io.flunit.core.ThrowingFunction;

import java.util.concurrent.Callable;

/**
 * Any number of "Given" clauses beyond three, with the operation receiving the whole
 * {@link Prerequisites} tuple.
 */
public class GivenN {

    private final BuilderState state;

    GivenN(BuilderState state) {
        this.state = state;
    }

    public GivenN and(Callable<?> getter) {
        return and(PrerequisiteSource.single(getter));
    }

    public GivenN andEachOf(Callable<? extends Iterable<?>> getter) {
        return and(PrerequisiteSource.eachOf(getter));
    }

    public GivenN and(PrerequisiteSource<?> source) {
        return new GivenN(state.withSource(source));
    }

    public <R> FunctionTestBuilder<R> when(ThrowingFunction<Prerequisites, ? extends R> function) {
        return new FunctionTestBuilder<>(state, Operation.<R>function(function));
    }

    public ActionTestBuilder whenAction(ThrowingConsumer<Prerequisites> action) {
        return new ActionTestBuilder(state, Operation.action(action));
    }

}
