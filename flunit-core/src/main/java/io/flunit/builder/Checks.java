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

import io.flunit.core.Outcome;
import io.flunit.core.Prerequisites;

/**
 * Shapes of the checks accepted by the "Then" clauses. The two-argument forms also
 * receive the prerequisites of the case being checked.
 */
public final class Checks {

    private Checks() {
    }

    @FunctionalInterface
    public interface OutcomeCheck<R> {
        void check(Outcome<R> outcome) throws Exception;
    }

    @FunctionalInterface
    public interface GivenOutcomeCheck<R> {
        void check(Prerequisites given, Outcome<R> outcome) throws Exception;
    }

    @FunctionalInterface
    public interface ValueCheck<R> {
        void check(R value) throws Exception;
    }

    @FunctionalInterface
    public interface GivenValueCheck<R> {
        void check(Prerequisites given, R value) throws Exception;
    }

    @FunctionalInterface
    public interface ErrorCheck {
        void check(Throwable error) throws Exception;
    }

    @FunctionalInterface
    public interface GivenErrorCheck {
        void check(Prerequisites given, Throwable error) throws Exception;
    }

}
