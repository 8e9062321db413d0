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

import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * One "Given" clause: lazily produces the ordered prerequisite values for that clause.
 * <p>
 * Evaluated exactly once per arrangement, possibly asynchronously. Each value produced
 * becomes part of (at least) one {@link Case}; a source producing several values
 * multiplies the number of cases.
 *
 * @param <T> the type of the prerequisite values
 */
@FunctionalInterface
public interface PrerequisiteSource<T> {

    CompletionStage<? extends Iterable<? extends T>> evaluate(TestContext context);

    /**
     * A clause with exactly one value, produced by the given getter.
     */
    static <T> PrerequisiteSource<T> single(Callable<? extends T> getter) {
        return context -> {
            try {
                List<T> values = Collections.singletonList(getter.call());
                return CompletableFuture.completedFuture(values);
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }

    /**
     * A clause with one value per element of the iterable produced by the getter.
     */
    static <T> PrerequisiteSource<T> eachOf(Callable<? extends Iterable<? extends T>> getter) {
        return context -> {
            try {
                Iterable<? extends T> values = getter.call();
                return CompletableFuture.completedFuture(values);
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }

    /**
     * Like {@link #eachOf(Callable)}, for getters that want to observe the context (for
     * example its cancellation signal).
     */
    static <T> PrerequisiteSource<T> contextual(ThrowingFunction<TestContext, ? extends Iterable<? extends T>> getter) {
        return context -> {
            try {
                Iterable<? extends T> values = getter.apply(context);
                return CompletableFuture.completedFuture(values);
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }

    static <T> PrerequisiteSource<T> async(Function<TestContext, ? extends CompletionStage<? extends Iterable<? extends T>>> getter) {
        return getter::apply;
    }

}
