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

import io.flunit.log.LogContext;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Combines the values of N independent "Given" clauses into the Cartesian product of
 * their sequences, one {@link Prerequisites} tuple per case.
 * <p>
 * Ordering follows nested loops in declaration order: the first clause is the outermost
 * loop and varies slowest, the last clause varies fastest. With no clauses at all the
 * product is a single empty tuple. A clause producing no values empties the product,
 * which is not an error.
 */
public final class CaseGenerator {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private CaseGenerator() {
    }

    /**
     * Evaluates every source exactly once, in declaration order, each one awaited before
     * the next is started, then combines the materialized values.
     * <p>
     * The returned future fails with the original error if any source fails; no partial
     * result is ever produced.
     */
    public static CompletableFuture<List<Prerequisites>> generate(List<? extends PrerequisiteSource<?>> sources,
                                                                  TestContext context) {
        CompletableFuture<List<List<Object>>> materialized = CompletableFuture.completedFuture(new ArrayList<>());
        for (int i = 0; i < sources.size(); i++) {
            final int index = i;
            final PrerequisiteSource<?> source = sources.get(i);
            materialized = materialized.thenCompose(lists -> materialize(source, index, context)
                    .thenApply(values -> {
                        lists.add(values);
                        return lists;
                    }));
        }
        return materialized.thenApply(CaseGenerator::product);
    }

    static List<Prerequisites> product(List<List<Object>> clauses) {
        List<List<Object>> combinations = new ArrayList<>();
        combinations.add(new ArrayList<>());
        for (List<Object> values : clauses) {
            List<List<Object>> next = new ArrayList<>(combinations.size() * values.size());
            for (List<Object> prefix : combinations) {
                for (Object value : values) {
                    List<Object> combination = new ArrayList<>(prefix.size() + 1);
                    combination.addAll(prefix);
                    combination.add(value);
                    next.add(combination);
                }
            }
            combinations = next;
        }
        List<Prerequisites> result = new ArrayList<>(combinations.size());
        for (List<Object> combination : combinations) {
            result.add(Prerequisites.of(combination));
        }
        return result;
    }

    private static CompletableFuture<List<Object>> materialize(PrerequisiteSource<?> source, int index,
                                                               TestContext context) {
        CompletionStage<? extends Iterable<?>> stage;
        try {
            stage = source.evaluate(context);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
        if (stage == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Given clause " + (index + 1) + " returned no completion stage"));
        }
        return Futures.toFuture(stage).thenApply(values -> {
            if (values == null) {
                throw new IllegalStateException("Given clause " + (index + 1) + " produced null instead of a sequence");
            }
            List<Object> list = new ArrayList<>();
            for (Object value : values) {
                list.add(value);
            }
            logger.debug("given clause {} produced {} value(s)", index + 1, list.size());
            return list;
        });
    }

}
