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

package org.rbjs.rbCompiler.compiler.visitors.stages;

import org.rbjs.rbCompiler.compiler.errors.CompilationError;
import org.rbjs.rbCompiler.compiler.visitors.Stage;
import org.rbjs.util.Utilities;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Creates the stages named on the command line.  Every call creates fresh
 * stage instances, so stages are never shared between compilations.
 */
public class StageFactory {
    final Map<String, Supplier<Stage>> constructors;

    public StageFactory() {
        this.constructors = new LinkedHashMap<>();
        this.add(FunctionsStage.NAME, FunctionsStage::new);
        this.add(NodeStage.NAME, NodeStage::new);
        this.add(CamelCaseStage.NAME, CamelCaseStage::new);
        this.add(ErbStage.NAME, ErbStage::new);
        this.add(CoalesceStage.NAME, CoalesceStage::new);
        this.add(ReturnStage.NAME, ReturnStage::new);
    }

    void add(String name, Supplier<Stage> constructor) {
        Utilities.putNew(this.constructors, name, constructor);
    }

    /** Names of all known stages. */
    public static List<String> names() {
        return new ArrayList<>(new StageFactory().constructors.keySet());
    }

    public static boolean isKnown(String name) {
        return new StageFactory().constructors.containsKey(name);
    }

    public Stage create(String name) {
        Supplier<Stage> constructor = this.constructors.get(name);
        if (constructor == null)
            throw new CompilationError("Unknown filter " + Utilities.singleQuote(name) +
                    "; known filters are " + this.constructors.keySet());
        return constructor.get();
    }

    /** Create the stages with the specified names, in order. */
    public List<Stage> create(List<String> names) {
        List<Stage> result = new ArrayList<>();
        for (String name: names)
            result.add(this.create(name));
        return result;
    }
}
