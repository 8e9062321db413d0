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
import io.flunit.core.Prerequisites;
import io.flunit.core.ThrowingConsumer;
import io.flunit.core.ThrowingRunnable;

import java.util.List;

/**
 * Builder for tests of an action (an operation without a return value), once the "When"
 * clause is known.
 */
public class ActionTestBuilder {

    static final String RETURNS_DESCRIPTION = "Action should complete successfully";
    static final String THROWS_DESCRIPTION = "Action should throw an exception";

    private final BuilderState state;
    private final Operation<Void> operation;

    ActionTestBuilder(BuilderState state, Operation<Void> operation) {
        this.state = state;
        this.operation = operation;
    }

    private ActionAssertionsBuilder first(AssertionSpec<Void> spec) {
        return new ActionAssertionsBuilder(state, operation, List.of(spec));
    }

    public ActionAssertionsBuilder then(String description, Checks.OutcomeCheck<Void> check) {
        return first(AssertionSpec.outcome(description, AssertionSpec.ignoringGiven(check)));
    }

    public ActionAssertionsBuilder then(String description, Checks.GivenOutcomeCheck<Void> check) {
        return first(AssertionSpec.outcome(description, check));
    }

    public ActionAssertionsBuilder thenReturns() {
        return first(AssertionSpec.returns(RETURNS_DESCRIPTION));
    }

    /**
     * Asserts that the action completed, then runs the check (typically inspecting the
     * state the action changed).
     */
    public ActionAssertionsBuilder thenReturns(String description, ThrowingRunnable check) {
        return first(AssertionSpec.returns(description, (given, ignored) -> check.run()));
    }

    public ActionAssertionsBuilder thenReturns(String description, ThrowingConsumer<Prerequisites> check) {
        return first(AssertionSpec.returns(description, (given, ignored) -> check.accept(given)));
    }

    public ActionAssertionsBuilder thenThrows() {
        return first(AssertionSpec.throwsError(THROWS_DESCRIPTION));
    }

    public ActionAssertionsBuilder thenThrows(Class<? extends Throwable> type) {
        return first(AssertionSpec.throwsInstanceOf("Action should throw " + type.getSimpleName(), type));
    }

    public ActionAssertionsBuilder thenThrows(String description, Checks.ErrorCheck check) {
        return first(AssertionSpec.throwsError(description, (given, error) -> check.check(error)));
    }

    public ActionAssertionsBuilder thenThrows(String description, Checks.GivenErrorCheck check) {
        return first(AssertionSpec.throwsError(description, check));
    }

}
