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
package io.flunit.junit;

import io.flunit.config.RunSettings;
import io.flunit.core.Futures;
import io.flunit.run.TestDiscovery;
import io.flunit.run.TestRun;
import org.junit.jupiter.api.DynamicNode;
import org.junit.jupiter.api.TestFactory;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.stream.Stream;

/**
 * Runs FlUnit tests with JUnit Jupiter.
 * <p>
 * Tests appear in the JUnit tree as they complete:
 * <pre>
 * class MathTests {
 *     &#64;TestFactory
 *     Stream&lt;DynamicNode&gt; flunit() {
 *         return FlUnit.tests(MathTestDefinitions.class).stream();
 *     }
 * }
 * </pre>
 * Or using the convenience annotation:
 * <pre>
 * class MathTests {
 *     &#64;FlUnit.Test
 *     Iterable&lt;DynamicNode&gt; flunit() {
 *         return FlUnit.tests(MathTestDefinitions.class);
 *     }
 * }
 * </pre>
 * Unless {@link #settings(RunSettings)} is called, run settings are read from
 * {@code flunit.json} in the working directory when it exists.
 */
public class FlUnit implements Iterable<DynamicNode> {

    /**
     * Marks a method returning a {@link FlUnit} instance as a JUnit test factory.
     */
    @Target(ElementType.METHOD)
    @Retention(RetentionPolicy.RUNTIME)
    @TestFactory
    public @interface Test {
    }

    private final List<Class<?>> classes;
    private RunSettings settings;
    private boolean hierarchical = true;
    private long timeoutMinutes = 30;

    private FlUnit(List<Class<?>> classes) {
        this.classes = classes;
    }

    /**
     * Runs the tests declared (as public static fields or methods) in the given classes.
     */
    public static FlUnit tests(Class<?>... classes) {
        return new FlUnit(List.of(classes));
    }

    public FlUnit settings(RunSettings settings) {
        this.settings = settings;
        return this;
    }

    /**
     * When enabled (default), each test is a container of its results. When disabled,
     * all results appear at the root level.
     */
    public FlUnit hierarchical(boolean enabled) {
        this.hierarchical = enabled;
        return this;
    }

    /**
     * Maximum time to wait for the next test to complete.
     */
    public FlUnit timeoutMinutes(long minutes) {
        this.timeoutMinutes = minutes;
        return this;
    }

    public Stream<DynamicNode> stream() {
        RunSettings resolved = settings != null ? settings : RunSettings.loadOrDefaults(Path.of(""));
        LinkedBlockingQueue<TestEvent> queue = new LinkedBlockingQueue<>();
        JUnitBridgeListener bridge = new JUnitBridgeListener(queue);
        TestRun run = new TestRun(TestDiscovery.findTests(classes), resolved).resultListener(bridge);
        CompletableFuture.supplyAsync(run::execute).whenComplete((result, error) -> {
            if (error != null) {
                bridge.putEvent(new TestEvent.RunError(Futures.unwrap(error)));
            } else {
                bridge.putEvent(new TestEvent.RunEnd(result));
            }
        });
        return new StreamingTestIterator(queue, hierarchical, timeoutMinutes).stream();
    }

    @Override
    public Iterator<DynamicNode> iterator() {
        return stream().iterator();
    }

    @Override
    public String toString() {
        return "FlUnit{classes=" + classes + ", hierarchical=" + hierarchical + "}";
    }

}
