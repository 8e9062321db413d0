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
import io.flunit.core.TestDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Adds further assertions to a function test and finally {@link #build() builds} it.
 * Assertions are evaluated in the order they are added.
 *
 * @param <R> the return type of the function
 */
public class FunctionAssertionsBuilder<R> {

    private final BuilderState state;
    private final Operation<R> operation;
    private final List<AssertionSpec<R>> assertions;

    FunctionAssertionsBuilder(BuilderState state, Operation<R> operation, List<AssertionSpec<R>> assertions) {
        this.state = state;
        this.operation = operation;
        this.assertions = assertions;
    }

    private FunctionAssertionsBuilder<R> with(AssertionSpec<R> spec) {
        List<AssertionSpec<R>> list = new ArrayList<>(assertions);
        list.add(spec);
        return new FunctionAssertionsBuilder<>(state, operation, List.copyOf(list));
    }

    public FunctionAssertionsBuilder<R> and(String description, Checks.OutcomeCheck<R> check) {
        return with(AssertionSpec.outcome(description, AssertionSpec.ignoringGiven(check)));
    }

    public FunctionAssertionsBuilder<R> and(String description, Checks.GivenOutcomeCheck<R> check) {
        return with(AssertionSpec.outcome(description, check));
    }

    public FunctionAssertionsBuilder<R> andReturns() {
        return with(AssertionSpec.returns(FunctionTestBuilder.RETURNS_DESCRIPTION));
    }

    public FunctionAssertionsBuilder<R> andReturns(String description, Checks.ValueCheck<R> check) {
        return with(AssertionSpec.returns(description, (given, value) -> check.check(value)));
    }

    public FunctionAssertionsBuilder<R> andReturns(String description, Checks.GivenValueCheck<R> check) {
        return with(AssertionSpec.returns(description, check));
    }

    public FunctionAssertionsBuilder<R> andReturnsMatching(String description, Predicate<? super R> predicate) {
        return with(AssertionSpec.returnsMatching(description, predicate));
    }

    public FunctionAssertionsBuilder<R> andThrows() {
        return with(AssertionSpec.throwsError(FunctionTestBuilder.THROWS_DESCRIPTION));
    }

    public FunctionAssertionsBuilder<R> andThrows(Class<? extends Throwable> type) {
        return with(AssertionSpec.throwsInstanceOf("Function should throw " + type.getSimpleName(), type));
    }

    public FunctionAssertionsBuilder<R> andThrows(String description, Checks.ErrorCheck check) {
        return with(AssertionSpec.throwsError(description, (given, error) -> check.check(error)));
    }

    public FunctionAssertionsBuilder<R> andThrows(String description, Checks.GivenErrorCheck check) {
        return with(AssertionSpec.throwsError(description, check));
    }

    public TestDefinition<R> build() {
        return new TestDefinition<>(state.overrides, state.sources, operation, AssertionSpec.factory(assertions));
    }

}
