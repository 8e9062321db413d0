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

import io.flunit.config.ConfigOverride;
import io.flunit.config.TestConfiguration;
import io.flunit.log.LogContext;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * A runnable test: configuration overrides, "Given" clauses, the "When" operation and
 * the factory for the assertions of each case. Immutable once built.
 * <p>
 * Lifecycle: {@link #arrange(TestContext)} evaluates the clauses and publishes the
 * cases; the caller then acts on each case and evaluates its assertions in order.
 * <pre>
 * TestDefinition&lt;?&gt; test = TestThat.given(() -&gt; 1).when(x -&gt; x + 1).thenReturns().build();
 * test.arrange(TestContext.defaults());
 * for (Case&lt;?&gt; c : test.getCases()) {
 *     c.act();
 *     c.getAssertions().forEach(Assertion::evaluate);
 * }
 * </pre>
 *
 * @param <R> the return type of the operation ({@link Void} for actions)
 */
public class TestDefinition<R> {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final List<ConfigOverride> configurationOverrides;
    private final List<PrerequisiteSource<?>> prerequisiteSources;
    private final Operation<R> operation;
    private final Function<Case<R>, ? extends List<Assertion<R>>> assertionFactory;

    private final Object publishLock = new Object();
    private long generation;
    private volatile List<Case<R>> cases;

    public TestDefinition(List<? extends ConfigOverride> configurationOverrides,
                          List<? extends PrerequisiteSource<?>> prerequisiteSources,
                          Operation<R> operation,
                          Function<Case<R>, ? extends List<Assertion<R>>> assertionFactory) {
        this.configurationOverrides = Collections.unmodifiableList(new ArrayList<>(configurationOverrides));
        this.prerequisiteSources = Collections.unmodifiableList(new ArrayList<>(prerequisiteSources));
        this.operation = operation;
        this.assertionFactory = assertionFactory;
    }

    /**
     * The cases of the most recent successful arrangement, in nested-loop order of the
     * "Given" clauses.
     *
     * @throws IllegalStateException if the test has not been (successfully) arranged
     */
    public List<Case<R>> getCases() {
        List<Case<R>> current = cases;
        if (current == null) {
            throw new IllegalStateException("Test not yet arranged");
        }
        return current;
    }

    public boolean isArranged() {
        return cases != null;
    }

    public List<PrerequisiteSource<?>> getPrerequisiteSources() {
        return prerequisiteSources;
    }

    public boolean hasConfigurationOverrides() {
        return !configurationOverrides.isEmpty();
    }

    /**
     * Folds the overrides, in declaration order, over the given configuration.
     */
    public void applyConfigurationOverrides(TestConfiguration configuration) {
        for (ConfigOverride override : configurationOverrides) {
            override.apply(configuration);
        }
    }

    /**
     * Evaluates the "Given" clauses and publishes the resulting cases.
     *
     * @throws ArrangementFailure if a clause, or the construction of a case, fails
     */
    public void arrange(TestContext context) {
        Futures.join(arrangeAsync(context));
    }

    /**
     * Asynchronous form of {@link #arrange(TestContext)}. Any previously published case
     * list is withdrawn when the call starts (lists already handed out are left as they
     * are) and replaced only if the arrangement succeeds. When calls overlap, only the
     * most recently started one may publish its cases.
     */
    public CompletableFuture<List<Case<R>>> arrangeAsync(TestContext context) {
        long stamp;
        synchronized (publishLock) {
            stamp = ++generation;
            cases = null;
        }
        CompletableFuture<List<Prerequisites>> tuples;
        try {
            tuples = CaseGenerator.generate(prerequisiteSources, context);
        } catch (RuntimeException e) {
            tuples = CompletableFuture.failedFuture(e);
        }
        CompletableFuture<List<Case<R>>> result = new CompletableFuture<>();
        tuples.whenComplete((list, error) -> {
            if (error != null) {
                result.completeExceptionally(new ArrangementFailure(Futures.unwrap(error)));
                return;
            }
            try {
                List<Case<R>> made = new ArrayList<>(list.size());
                for (Prerequisites prerequisites : list) {
                    made.add(new Case<>(prerequisites, operation, assertionFactory));
                }
                List<Case<R>> published = Collections.unmodifiableList(made);
                synchronized (publishLock) {
                    if (generation == stamp) {
                        cases = published;
                    } else {
                        logger.debug("discarding superseded arrangement of {} case(s)", published.size());
                    }
                }
                logger.debug("arranged {} case(s) from {} given clause(s)", published.size(), prerequisiteSources.size());
                result.complete(published);
            } catch (Throwable e) {
                result.completeExceptionally(new ArrangementFailure(e));
            }
        });
        return result;
    }

}
