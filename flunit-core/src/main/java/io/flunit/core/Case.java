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

import io.flunit.log.LogContext;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * One concrete combination of "Given" values, together with the operation bound to it,
 * its assertions and, once {@link #act()} has run, its {@link Outcome}.
 * <p>
 * Assertions are created (not evaluated) when the case is constructed. The operation is
 * invoked at most once, no matter how many assertions later inspect the outcome.
 *
 * @param <R> the return type of the operation
 */
public class Case<R> {

    public static final String NO_PREREQUISITES = "(no prerequisites)";

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final Prerequisites prerequisites;
    private final Operation<R> operation;
    private final List<Assertion<R>> assertions;
    private final AtomicBoolean acted = new AtomicBoolean();
    private volatile Outcome<R> outcome;

    public Case(Prerequisites prerequisites, Operation<R> operation,
                Function<Case<R>, ? extends List<Assertion<R>>> assertionFactory) {
        this.prerequisites = prerequisites;
        this.operation = operation;
        List<Assertion<R>> made = assertionFactory.apply(this);
        List<Assertion<R>> list = new ArrayList<>(made.size());
        for (Assertion<R> assertion : made) {
            if (assertion.getCase() != this) {
                throw new IllegalArgumentException("assertion '" + assertion.getDescription() + "' is bound to another case");
            }
            list.add(assertion);
        }
        this.assertions = Collections.unmodifiableList(list);
    }

    public Prerequisites getPrerequisites() {
        return prerequisites;
    }

    public List<Assertion<R>> getAssertions() {
        return assertions;
    }

    /**
     * The outcome of the operation, or null if the case has not been acted upon
     * (or the operation is still running).
     */
    public Outcome<R> getOutcome() {
        return outcome;
    }

    public boolean isActed() {
        return outcome != null;
    }

    /**
     * Invokes the operation and captures its outcome.
     *
     * @throws IllegalStateException if the operation has already been invoked for this case
     */
    public void act() {
        Futures.join(actAsync());
    }

    /**
     * Starts the operation. The returned future never fails because of the operation
     * itself, its error is captured as a failed {@link Outcome} instead.
     *
     * @throws IllegalStateException if the operation has already been invoked for this case
     */
    public CompletableFuture<Outcome<R>> actAsync() {
        if (!acted.compareAndSet(false, true)) {
            throw new IllegalStateException("Test action already invoked");
        }
        CompletableFuture<R> invocation;
        try {
            CompletionStage<R> stage = operation.invoke(prerequisites);
            invocation = stage == null
                    ? CompletableFuture.failedFuture(new NullPointerException("operation returned no completion stage"))
                    : Futures.toFuture(stage);
        } catch (Throwable e) {
            invocation = CompletableFuture.failedFuture(e);
        }
        return invocation.handle((value, error) -> {
            Outcome<R> result = error == null ? Outcome.success(value) : Outcome.failure(Futures.unwrap(error));
            outcome = result;
            if (logger.isDebugEnabled()) {
                logger.debug("acted on case {}: {}", describe(), result.getKind());
            }
            return result;
        });
    }

    /**
     * Human readable identifier of the case: its prerequisite tuple.
     */
    public String describe() {
        return prerequisites.isEmpty() ? NO_PREREQUISITES : prerequisites.toString();
    }

    @Override
    public String toString() {
        return describe();
    }

}
