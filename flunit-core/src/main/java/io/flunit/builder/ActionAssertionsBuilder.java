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
import io.flunit.core.TestDefinition;
import io.flunit.core.ThrowingConsumer;
import io.flunit.core.ThrowingRunnable;

import java.util.ArrayList;
import java.util.List;

public class ActionAssertionsBuilder {

    private final BuilderState state;
    private final Operation<Void> operation;
    private final List<AssertionSpec<Void>> assertions;

    ActionAssertionsBuilder(BuilderState state, Operation<Void> operation, List<AssertionSpec<Void>> assertions) {
        this.state = state;
        this.operation = operation;
        this.assertions = assertions;
    }

    private ActionAssertionsBuilder with(AssertionSpec<Void> spec) {
        List<AssertionSpec<Void>> list = new ArrayList<>(assertions);
        list.add(spec);
        return new ActionAssertionsBuilder(state, operation, List.copyOf(list));
    }

    public ActionAssertionsBuilder and(String description, Checks.OutcomeCheck<Void> check) {
        return with(AssertionSpec.outcome(description, AssertionSpec.ignoringGiven(check)));
    }

    public ActionAssertionsBuilder and(String description, Checks.GivenOutcomeCheck<Void> check) {
        return with(AssertionSpec.outcome(description, check));
    }

    public ActionAssertionsBuilder andReturns() {
        return with(AssertionSpec.returns(ActionTestBuilder.RETURNS_DESCRIPTION));
    }

    public ActionAssertionsBuilder andReturns(String description, ThrowingRunnable check) {
        return with(AssertionSpec.returns(description, (given, ignored) -> check.run()));
    }

    public ActionAssertionsBuilder andReturns(String description, ThrowingConsumer<Prerequisites> check) {
        return with(AssertionSpec.returns(description, (given, ignored) -> check.accept(given)));
    }

    public ActionAssertionsBuilder andThrows() {
        return with(AssertionSpec.throwsError(ActionTestBuilder.THROWS_DESCRIPTION));
    }

    public ActionAssertionsBuilder andThrows(Class<? extends Throwable> type) {
        return with(AssertionSpec.throwsInstanceOf("Action should throw " + type.getSimpleName(), type));
    }

    public ActionAssertionsBuilder andThrows(String description, Checks.ErrorCheck check) {
        return with(AssertionSpec.throwsError(description, (given, error) -> check.check(error)));
    }

    public ActionAssertionsBuilder andThrows(String description, Checks.GivenErrorCheck check) {
        return with(AssertionSpec.throwsError(description, check));
    }

    public TestDefinition<Void> build() {
        return new TestDefinition<>(state.overrides, state.sources, operation, AssertionSpec.factory(assertions));
    }

}
