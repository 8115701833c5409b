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
import org.rbjs.rbCompiler.compiler.EsLevel;

/**
 * State shared by all stages of one compilation.
 * A context must not be reused for a different program.
 */
public class CompileContext {
    public final CompilerOptions options;
    public final HoistedDeclarations hoisted;
    public final CommentTable comments;
    public final MethodFilter methods;

    public CompileContext(CompilerOptions options, CommentTable comments) {
        this.options = options;
        this.hoisted = new HoistedDeclarations();
        this.comments = comments;
        this.methods = MethodFilter.create(options.languageOptions);
    }

    public CompileContext(CompilerOptions options) {
        this(options, new CommentTable());
    }

    public EsLevel esLevel() {
        return this.options.languageOptions.esLevel;
    }

    public boolean esAtLeast(EsLevel level) {
        return this.esLevel().atLeast(level);
    }
}
