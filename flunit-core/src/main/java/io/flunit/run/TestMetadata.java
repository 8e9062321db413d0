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

import java.util.List;
import java.util.function.Supplier;

/**
 * A discovered test: where it is declared, how to obtain its definition and which traits
 * apply to it.
 */
public class TestMetadata {

    private final Class<?> declaringClass;
    private final String memberName;
    private final Supplier<TestDefinition<?>> supplier;
    private final List<TestTrait> traits;

    public TestMetadata(Class<?> declaringClass, String memberName, Supplier<TestDefinition<?>> supplier, List<TestTrait> traits) {
        this.declaringClass = declaringClass;
        this.memberName = memberName;
        this.supplier = supplier;
        this.traits = List.copyOf(traits);
    }

    /**
     * Fully qualified name: {@code com.example.MyTests.ADDITION}.
     */
    public String getName() {
        return declaringClass.getName() + "." + memberName;
    }

    /**
     * Short name: {@code MyTests.ADDITION}.
     */
    public String getDisplayName() {
        return declaringClass.getSimpleName() + "." + memberName;
    }

    public Class<?> getDeclaringClass() {
        return declaringClass;
    }

    public String getMemberName() {
        return memberName;
    }

    public List<TestTrait> getTraits() {
        return traits;
    }

    /**
     * Reads the field or calls the method that declares the test.
     */
    public TestDefinition<?> getTest() {
        return supplier.get();
    }

    @Override
    public String toString() {
        return getName();
    }

}
