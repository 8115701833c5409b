/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.rbjs.rbCompiler.compiler.context;

import org.rbjs.rbCompiler.compiler.CompilerOptions;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides which method names stages may rewrite.  There are two modes:
 * with an include-only list every method outside that list is left alone;
 * otherwise every method in the excluded list is left alone.
 * Stages may add names that they never rewrite with {@link #alwaysExclude}.
 */
public class MethodFilter {
    /** Methods excluded unless explicitly included. */
    public static final List<String> DEFAULT_EXCLUDED = List.of("call");

    @Nullable
    private Set<String> included;
    private final Set<String> excluded;
    private final Set<String> alwaysExcluded;

    public MethodFilter() {
        this.included = null;
        this.excluded = new HashSet<>(DEFAULT_EXCLUDED);
        this.alwaysExcluded = new HashSet<>();
    }

    /** The filter described by the compilation options. */
    public static MethodFilter create(CompilerOptions.Language options) {
        MethodFilter result = new MethodFilter();
        if (options.includeAll)
            result.includeAll();
        if (options.includeOnly != null)
            result.includeOnly(options.includeOnly);
        result.include(options.include);
        result.exclude(options.exclude);
        return result;
    }

    public void includeAll() {
        this.included = null;
        this.excluded.clear();
    }

    public void includeOnly(Collection<String> methods) {
        this.included = new HashSet<>(methods);
    }

    public void include(Collection<String> methods) {
        if (this.included != null)
            this.included.addAll(methods);
        else
            this.excluded.removeAll(methods);
    }

    public void exclude(Collection<String> methods) {
        if (this.included != null)
            this.included.removeAll(methods);
        else
            this.excluded.addAll(methods);
    }

    /** Names that a stage does not rewrite unless an include-only list names them. */
    public void alwaysExclude(String... methods) {
        this.alwaysExcluded.addAll(List.of(methods));
    }

    public boolean isExcluded(String method) {
        if (this.included != null)
            return !this.included.contains(method);
        if (this.alwaysExcluded.contains(method))
            return true;
        return this.excluded.contains(method);
    }

    public boolean isIncluded(String method) {
        return !this.isExcluded(method);
    }

    @Override
    public String toString() {
        List<String> sorted;
        if (this.included != null) {
            sorted = new ArrayList<>(this.included);
            sorted.sort(String::compareTo);
            return "MethodFilter{includeOnly=" + sorted + "}";
        }
        sorted = new ArrayList<>(this.excluded);
        sorted.addAll(this.alwaysExcluded);
        sorted.sort(String::compareTo);
        return "MethodFilter{excluded=" + sorted + "}";
    }
}
