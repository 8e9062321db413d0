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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.StringJoiner;

/**
 * Ordered, immutable tuple of the prerequisite values selected for one {@link Case},
 * one value per "Given" clause in declaration order. Values may be {@code null}.
 */
public final class Prerequisites implements Iterable<Object> {

    private static final Prerequisites EMPTY = new Prerequisites(Collections.emptyList());

    private final List<Object> values;

    private Prerequisites(List<Object> values) {
        this.values = values;
    }

    public static Prerequisites empty() {
        return EMPTY;
    }

    public static Prerequisites of(Object... values) {
        return of(Arrays.asList(values));
    }

    public static Prerequisites of(List<?> values) {
        if (values.isEmpty()) {
            return EMPTY;
        }
        return new Prerequisites(Collections.unmodifiableList(new ArrayList<>(values)));
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Object get(int index) {
        return values.get(index);
    }

    public <T> T get(int index, Class<T> type) {
        return type.cast(values.get(index));
    }

    /**
     * Unchecked access used by the typed builder wrappers, which know the type of each clause.
     */
    @SuppressWarnings("unchecked")
    public <T> T value(int index) {
        return (T) values.get(index);
    }

    public List<Object> asList() {
        return values;
    }

    @Override
    public Iterator<Object> iterator() {
        return values.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Prerequisites)) {
            return false;
        }
        return values.equals(((Prerequisites) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "(", ")");
        for (Object value : values) {
            joiner.add(String.valueOf(value));
        }
        return joiner.toString();
    }

}
