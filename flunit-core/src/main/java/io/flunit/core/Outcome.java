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

/**
 * The captured result of invoking the "When" operation of a single {@link Case}.
 * <p>
 * Exactly one branch is populated: a success carries the returned value (which is
 * {@code null} for actions), a failure carries the thrown error. Instances are immutable.
 *
 * @param <R> the return type of the operation ({@link Void} for actions)
 */
public final class Outcome<R> {

    public enum Kind {
        SUCCESS, FAILURE
    }

    private final Kind kind;
    private final R value;
    private final Throwable error;

    private Outcome(Kind kind, R value, Throwable error) {
        this.kind = kind;
        this.value = value;
        this.error = error;
    }

    public static <R> Outcome<R> success(R value) {
        return new Outcome<>(Kind.SUCCESS, value, null);
    }

    public static <R> Outcome<R> failure(Throwable error) {
        return new Outcome<>(Kind.FAILURE, null, Objects.requireNonNull(error, "error"));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public boolean isFailure() {
        return kind == Kind.FAILURE;
    }

    /**
     * Returns the value returned by the operation.
     *
     * @throws IllegalStateException if the operation threw, with the thrown error as cause
     */
    public R getValue() {
        if (kind == Kind.FAILURE) {
            throw new IllegalStateException("Operation threw " + error.getClass().getName()
                    + ", no return value is available: " + error.getMessage(), error);
        }
        return value;
    }

    /**
     * Returns the error thrown by the operation.
     *
     * @throws IllegalStateException if the operation returned normally
     */
    public Throwable getError() {
        if (kind == Kind.SUCCESS) {
            throw new IllegalStateException("Operation returned normally, no error is available");
        }
        return error;
    }

    @Override
    public String toString() {
        return kind == Kind.SUCCESS
                ? "Success(" + value + ")"
                : "Failure(" + error + ")";
    }

}
