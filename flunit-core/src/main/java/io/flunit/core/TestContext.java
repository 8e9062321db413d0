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

import io.flunit.config.TestConfiguration;

import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Context handed to the "Given" clauses of a test while it is being arranged.
 * <p>
 * Carries the effective {@link TestConfiguration} and a cancellation signal. Only
 * prerequisite sources see the context; honouring the signal is up to them, the core
 * does not check it when acting or evaluating assertions.
 */
public class TestContext {

    private static final BooleanSupplier NEVER_CANCELLED = () -> false;

    private final TestConfiguration configuration;
    private final BooleanSupplier cancellationSignal;

    public TestContext(TestConfiguration configuration, BooleanSupplier cancellationSignal) {
        this.configuration = configuration;
        this.cancellationSignal = cancellationSignal == null ? NEVER_CANCELLED : cancellationSignal;
    }

    public static TestContext of(TestConfiguration configuration) {
        return new TestContext(configuration, NEVER_CANCELLED);
    }

    public static TestContext defaults() {
        return of(new TestConfiguration());
    }

    public TestConfiguration getConfiguration() {
        return configuration;
    }

    public boolean isCancellationRequested() {
        return cancellationSignal.getAsBoolean();
    }

    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("Test run cancelled");
        }
    }

}
