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

import io.flunit.config.ConfigOverride;
import io.flunit.core.PrerequisiteSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Configuration overrides and "Given" clauses collected so far. Every step of the
 * builder chain gets a new instance, so a partially built chain can be shared.
 */
final class BuilderState {

    static final BuilderState EMPTY = new BuilderState(Collections.emptyList(), Collections.emptyList());

    final List<ConfigOverride> overrides;
    final List<PrerequisiteSource<?>> sources;

    private BuilderState(List<ConfigOverride> overrides, List<PrerequisiteSource<?>> sources) {
        this.overrides = overrides;
        this.sources = sources;
    }

    BuilderState withOverride(ConfigOverride override) {
        List<ConfigOverride> list = new ArrayList<>(overrides);
        list.add(Objects.requireNonNull(override, "override"));
        return new BuilderState(Collections.unmodifiableList(list), sources);
    }

    BuilderState withSource(PrerequisiteSource<?> source) {
        List<PrerequisiteSource<?>> list = new ArrayList<>(sources);
        list.add(Objects.requireNonNull(source, "source"));
        return new BuilderState(overrides, Collections.unmodifiableList(list));
    }

}
