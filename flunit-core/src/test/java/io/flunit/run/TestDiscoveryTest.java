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

import io.flunit.run.fixtures.CalculatorDefinitions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TestDiscoveryTest {

    @Test
    void testFindsStaticFieldsAndMethods() {
        List<TestMetadata> tests = TestDiscovery.findTests(CalculatorDefinitions.class);
        List<String> names = new ArrayList<>();
        tests.forEach(t -> names.add(t.getMemberName()));
        assertEquals(List.of("ADDITION", "DIVISION", "UNREACHABLE_DATABASE", "greeting"), names);
    }

    @Test
    void testNames() {
        TestMetadata test = TestDiscovery.findTests(CalculatorDefinitions.class).get(0);
        assertEquals("io.flunit.run.fixtures.CalculatorDefinitions.ADDITION", test.getName());
        assertEquals("CalculatorDefinitions.ADDITION", test.getDisplayName());
        assertSame(CalculatorDefinitions.class, test.getDeclaringClass());
    }

    @Test
    void testTraitsConcatenatePackageClassAndMember() {
        List<TestMetadata> tests = TestDiscovery.findTests(CalculatorDefinitions.class);
        assertEquals(List.of(new TestTrait("suite", "fixtures"), new TestTrait("area", "calculator")),
                tests.get(0).getTraits());
        assertEquals(List.of(new TestTrait("suite", "fixtures"), new TestTrait("area", "calculator"),
                new TestTrait("category", "broken")), tests.get(1).getTraits());
    }

    @Test
    void testSupplierResolvesDefinition() {
        List<TestMetadata> tests = TestDiscovery.findTests(CalculatorDefinitions.class);
        assertSame(CalculatorDefinitions.ADDITION, tests.get(0).getTest());
        assertNotNull(tests.get(3).getTest());
    }

    @Test
    void testClassWithoutTests() {
        assertTrue(TestDiscovery.findTests(String.class).isEmpty());
    }

}
