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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * The "When" clause of a test, bound to the prerequisites of a case when invoked.
 * <p>
 * Errors thrown by an operation, synchronously or through its stage, are captured into
 * the {@link Outcome} of the case and never propagate out of {@link Case#act()}.
 *
 * @param <R> the return type ({@link Void} for actions)
 */
@FunctionalInterface
public interface Operation<R> {

    CompletionStage<R> invoke(Prerequisites given);

    static <R> Operation<R> function(ThrowingFunction<Prerequisites, ? extends R> function) {
        return given -> {
            try {
                R value = function.apply(given);
                return CompletableFuture.completedFuture(value);
            } catch (Throwable e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }

    static Operation<Void> action(ThrowingConsumer<Prerequisites> action) {
        return given -> {
            try {
                action.accept(given);
                return CompletableFuture.completedFuture(null);
            } catch (Throwable e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }

    static <R> Operation<R> async(Function<Prerequisites, ? extends CompletionStage<R>> function) {
        return function::apply;
    }

}
