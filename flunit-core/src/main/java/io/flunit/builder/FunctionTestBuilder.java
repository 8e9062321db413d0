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

import java.util.List;
import java.util.function.Predicate;

/**
 * Builder for tests of a function, once the "When" clause is known. Each "then" method
 * adds the first assertion; further assertions are added with the "and" methods of the
 * returned {@link FunctionAssertionsBuilder}.
 *
 * @param <R> the return type of the function
 */
public class FunctionTestBuilder<R> {

    static final String RETURNS_DESCRIPTION = "Function should return successfully";
    static final String THROWS_DESCRIPTION = "Function should throw an exception";

    private final BuilderState state;
    private final Operation<R> operation;

    FunctionTestBuilder(BuilderState state, Operation<R> operation) {
        this.state = state;
        this.operation = operation;
    }

    private FunctionAssertionsBuilder<R> first(AssertionSpec<R> spec) {
        return new FunctionAssertionsBuilder<>(state, operation, List.of(spec));
    }

    /**
     * Asserts on the raw outcome, whether the function returned or threw.
     */
    public FunctionAssertionsBuilder<R> then(String description, Checks.OutcomeCheck<R> check) {
        return first(AssertionSpec.outcome(description, AssertionSpec.ignoringGiven(check)));
    }

    public FunctionAssertionsBuilder<R> then(String description, Checks.GivenOutcomeCheck<R> check) {
        return first(AssertionSpec.outcome(description, check));
    }

    public FunctionAssertionsBuilder<R> thenReturns() {
        return first(AssertionSpec.returns(RETURNS_DESCRIPTION));
    }

    public FunctionAssertionsBuilder<R> thenReturns(String description, Checks.ValueCheck<R> check) {
        return first(AssertionSpec.returns(description, (given, value) -> check.check(value)));
    }

    public FunctionAssertionsBuilder<R> thenReturns(String description, Checks.GivenValueCheck<R> check) {
        return first(AssertionSpec.returns(description, check));
    }

    public FunctionAssertionsBuilder<R> thenReturnsMatching(String description, Predicate<? super R> predicate) {
        return first(AssertionSpec.returnsMatching(description, predicate));
    }

    public FunctionAssertionsBuilder<R> thenThrows() {
        return first(AssertionSpec.throwsError(THROWS_DESCRIPTION));
    }

    public FunctionAssertionsBuilder<R> thenThrows(Class<? extends Throwable> type) {
        return first(AssertionSpec.throwsInstanceOf("Function should throw " + type.getSimpleName(), type));
    }

    public FunctionAssertionsBuilder<R> thenThrows(String description, Checks.ErrorCheck check) {
        return first(AssertionSpec.throwsError(description, (given, error) -> check.check(error)));
    }

    public FunctionAssertionsBuilder<R> thenThrows(String description, Checks.GivenErrorCheck check) {
        return first(AssertionSpec.throwsError(description, check));
    }

}
