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

import io.flunit.core.Assertion;
import io.flunit.core.AssertionFailure;
import io.flunit.core.Case;
import io.flunit.core.Outcome;
import io.flunit.core.Prerequisites;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * An assertion as declared in the builder, before it is bound to a case.
 */
final class AssertionSpec<R> {

    static final String PREDICATE_NOT_SATISFIED = "Predicate not satisfied: ";

    final String description;
    final Assertion.Expectation expectation;
    final Assertion.Check<R> check;

    AssertionSpec(String description, Assertion.Expectation expectation, Assertion.Check<R> check) {
        if (description == null || description.isEmpty()) {
            throw new IllegalArgumentException("assertion description must not be empty");
        }
        this.description = description;
        this.expectation = expectation;
        this.check = check;
    }

    static <R> AssertionSpec<R> outcome(String description, Checks.GivenOutcomeCheck<R> check) {
        return new AssertionSpec<>(description, Assertion.Expectation.NONE, check::check);
    }

    static <R> AssertionSpec<R> returns(String description) {
        return new AssertionSpec<>(description, Assertion.Expectation.MUST_RETURN, null);
    }

    static <R> AssertionSpec<R> returns(String description, Checks.GivenValueCheck<R> check) {
        return new AssertionSpec<>(description, Assertion.Expectation.MUST_RETURN,
                (given, outcome) -> check.check(given, outcome.getValue()));
    }

    static <R> AssertionSpec<R> returnsMatching(String description, Predicate<? super R> predicate) {
        return new AssertionSpec<>(description, Assertion.Expectation.MUST_RETURN, (given, outcome) -> {
            if (!predicate.test(outcome.getValue())) {
                throw new AssertionFailure(PREDICATE_NOT_SATISFIED + description);
            }
        });
    }

    static <R> AssertionSpec<R> throwsError(String description) {
        return new AssertionSpec<>(description, Assertion.Expectation.MUST_THROW, null);
    }

    static <R> AssertionSpec<R> throwsError(String description, Checks.GivenErrorCheck check) {
        return new AssertionSpec<>(description, Assertion.Expectation.MUST_THROW,
                (given, outcome) -> check.check(given, outcome.getError()));
    }

    static <R> AssertionSpec<R> throwsInstanceOf(String description, Class<? extends Throwable> type) {
        return new AssertionSpec<>(description, Assertion.Expectation.MUST_THROW, (given, outcome) -> {
            Throwable error = outcome.getError();
            if (!type.isInstance(error)) {
                throw new AssertionFailure("Expected the operation to throw " + type.getName()
                        + ", but it threw " + error.getClass().getName() + ": " + error.getMessage(), error);
            }
        });
    }

    static <R> Function<Case<R>, List<Assertion<R>>> factory(List<AssertionSpec<R>> specs) {
        List<AssertionSpec<R>> copy = List.copyOf(specs);
        return testCase -> {
            List<Assertion<R>> assertions = new ArrayList<>(copy.size());
            for (AssertionSpec<R> spec : copy) {
                assertions.add(Assertion.of(testCase, spec.description, spec.expectation, spec.check));
            }
            return Collections.unmodifiableList(assertions);
        };
    }

    static <R> Checks.GivenOutcomeCheck<R> ignoringGiven(Checks.OutcomeCheck<R> check) {
        return (Prerequisites given, Outcome<R> outcome) -> check.check(outcome);
    }

}
