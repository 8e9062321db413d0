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
package io.flunit.run;

import io.flunit.core.TestDefinition;
import io.flunit.log.LogContext;
import org.slf4j.Logger;

import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Finds tests declared as public static fields, or public static no-argument methods,
 * of type {@link TestDefinition}.
 * <p>
 * Traits are collected from the package, then the class, then the member.
 */
public final class TestDiscovery {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private TestDiscovery() {
    }

    public static List<TestMetadata> findTests(Class<?>... classes) {
        return findTests(Arrays.asList(classes));
    }

    public static List<TestMetadata> findTests(List<Class<?>> classes) {
        List<TestMetadata> tests = new ArrayList<>();
        for (Class<?> type : classes) {
            List<TestTrait> classTraits = new ArrayList<>();
            if (type.getPackage() != null) {
                classTraits.addAll(traitsOf(type.getPackage()));
            }
            classTraits.addAll(traitsOf(type));
            // declaration order is not guaranteed by reflection
            Field[] fields = type.getFields();
            Arrays.sort(fields, Comparator.comparing(Field::getName));
            for (Field field : fields) {
                if (isTestField(field)) {
                    tests.add(new TestMetadata(type, field.getName(), () -> readField(field), concat(classTraits, traitsOf(field))));
                }
            }
            Method[] methods = type.getMethods();
            Arrays.sort(methods, Comparator.comparing(Method::getName));
            for (Method method : methods) {
                if (isTestMethod(method)) {
                    tests.add(new TestMetadata(type, method.getName(), () -> invokeMethod(method), concat(classTraits, traitsOf(method))));
                }
            }
        }
        logger.debug("discovered {} test(s) in {} class(es)", tests.size(), classes.size());
        return tests;
    }

    static boolean isTestField(Field field) {
        return Modifier.isStatic(field.getModifiers())
                && Modifier.isPublic(field.getModifiers())
                && TestDefinition.class.isAssignableFrom(field.getType());
    }

    static boolean isTestMethod(Method method) {
        return Modifier.isStatic(method.getModifiers())
                && Modifier.isPublic(method.getModifiers())
                && method.getParameterCount() == 0
                && TestDefinition.class.isAssignableFrom(method.getReturnType());
    }

    private static List<TestTrait> traitsOf(AnnotatedElement element) {
        List<TestTrait> traits = new ArrayList<>();
        for (Trait trait : element.getAnnotationsByType(Trait.class)) {
            traits.add(TestTrait.of(trait));
        }
        return traits;
    }

    private static List<TestTrait> concat(List<TestTrait> first, List<TestTrait> second) {
        List<TestTrait> list = new ArrayList<>(first);
        list.addAll(second);
        return list;
    }

    private static TestDefinition<?> readField(Field field) {
        try {
            return requireTest((TestDefinition<?>) field.get(null), field.getName());
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("cannot read test field: " + field, e);
        }
    }

    private static TestDefinition<?> invokeMethod(Method method) {
        try {
            return requireTest((TestDefinition<?>) method.invoke(null), method.getName());
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("cannot call test method: " + method, e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("test method failed: " + method, cause);
        }
    }

    private static TestDefinition<?> requireTest(TestDefinition<?> test, String name) {
        if (test == null) {
            throw new IllegalStateException("test member returned null: " + name);
        }
        return test;
    }

}
