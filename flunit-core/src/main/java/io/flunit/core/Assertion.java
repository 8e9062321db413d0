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

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * A named check of one {@link Case}, evaluated against its prerequisites and outcome.
 * <p>
 * The {@link Expectation} decides what happens before the check runs: a
 * {@link Expectation#MUST_RETURN} assertion fails straight away if the operation threw,
 * a {@link Expectation#MUST_THROW} assertion fails straight away if it returned. In both
 * cases the check itself is not invoked.
 *
 * @param <R> the return type of the operation
 */
public class Assertion<R> {

    public enum Expectation {
        /** No constraint on the outcome, the check inspects it itself. */
        NONE,
        /** The operation must have returned normally. */
        MUST_RETURN,
        /** The operation must have thrown. */
        MUST_THROW
    }

    @FunctionalInterface
    public interface Check<R> {

        void verify(Prerequisites given, Outcome<R> outcome) throws Exception;

    }

    @FunctionalInterface
    public interface AsyncCheck<R> {

        CompletionStage<?> verify(Prerequisites given, Outcome<R> outcome);

    }

    private final Case<R> owner;
    private final String description;
    private final Expectation expectation;
    private final AsyncCheck<R> check;

    /**
     * @param check may be null, in which case only the expectation is verified
     */
    public Assertion(Case<R> owner, String description, Expectation expectation, AsyncCheck<R> check) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.description = Objects.requireNonNull(description, "description");
        this.expectation = Objects.requireNonNull(expectation, "expectation");
        this.check = check;
    }

    public static <R> Assertion<R> of(Case<R> owner, String description, Expectation expectation, Check<R> check) {
        return new Assertion<>(owner, description, expectation, check == null ? null : (given, outcome) -> {
            try {
                check.verify(given, outcome);
                return CompletableFuture.completedFuture(null);
            } catch (Throwable e) {
                return CompletableFuture.failedFuture(e);
            }
        });
    }

    public Case<R> getCase() {
        return owner;
    }

    public String getDescription() {
        return description;
    }

    public Expectation getExpectation() {
        return expectation;
    }

    /**
     * Evaluates the assertion.
     *
     * @throws AssertionFailure            if the check fails or the expectation is not met
     * @throws IllegalStateException if the owning case has not been acted upon yet
     */
    public void evaluate() {
        Futures.join(evaluateAsync());
    }

    /**
     * Asynchronous form of {@link #evaluate()}: the returned future fails with an
     * {@link AssertionFailure} (or an error implementing {@link TestFailureDetails}).
     *
     * @throws IllegalStateException if the owning case has not been acted upon yet
     */
    public CompletableFuture<Void> evaluateAsync() {
        Outcome<R> outcome = owner.getOutcome();
        if (outcome == null) {
            throw new IllegalStateException("Test action has not been invoked for case " + owner.describe());
        }
        if (expectation == Expectation.MUST_RETURN && outcome.isFailure()) {
            return CompletableFuture.failedFuture(AssertionFailure.unexpectedError(outcome.getError()));
        }
        if (expectation == Expectation.MUST_THROW && outcome.isSuccess()) {
            return CompletableFuture.failedFuture(AssertionFailure.missingError());
        }
        if (check == null) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<?> verification;
        try {
            CompletionStage<?> stage = check.verify(owner.getPrerequisites(), outcome);
            verification = stage == null ? CompletableFuture.completedFuture(null) : Futures.toFuture(stage);
        } catch (Throwable e) {
            verification = CompletableFuture.failedFuture(e);
        }
        CompletableFuture<Void> result = new CompletableFuture<>();
        verification.whenComplete((ignored, error) -> {
            if (error == null) {
                result.complete(null);
            } else {
                result.completeExceptionally(normalize(Futures.unwrap(error)));
            }
        });
        return result;
    }

    private static Throwable normalize(Throwable error) {
        if (error instanceof TestFailureDetails) {
            return error;
        }
        return AssertionFailure.wrap(error);
    }

    @Override
    public String toString() {
        return description;
    }

}
