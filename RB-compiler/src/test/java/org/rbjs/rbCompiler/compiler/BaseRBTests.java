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

package org.rbjs.rbCompiler.compiler;

import org.junit.Assert;
import org.rbjs.rbCompiler.compiler.context.CommentTable;
import org.rbjs.rbCompiler.compiler.errors.CompilerMessages;
import org.rbjs.rbCompiler.compiler.errors.SourcePositionRange;
import org.rbjs.rbCompiler.ir.Node;
import org.rbjs.rbCompiler.ir.Nodes;
import org.rbjs.rbCompiler.ir.Tag;

import java.util.Arrays;

/** Base class for tests that run stages on small trees. */
public class BaseRBTests {
    /** Options that apply the specified stages, in order. */
    public static CompilerOptions testOptions(String... filters) {
        CompilerOptions options = new CompilerOptions();
        options.languageOptions.filters.addAll(Arrays.asList(filters));
        return options;
    }

    public static SourcePositionRange position(int line, int column, int endColumn) {
        return new SourcePositionRange(line, column, line, endColumn);
    }

    /** Compile and expect success. */
    public static CompileResult compile(CompilerOptions options, Node program, CommentTable comments) {
        RBCompiler compiler = new RBCompiler(options);
        CompileResult result = compiler.compile(program, comments);
        if (compiler.hasErrors())
            Assert.fail("Unexpected errors: " + compiler.messages);
        Assert.assertNotNull(result);
        return result;
    }

    public static CompileResult compile(CompilerOptions options, Node program) {
        return compile(options, program, new CommentTable());
    }

    /** Compile and expect a single error. */
    public static CompilerMessages.Message compileWithError(CompilerOptions options, Node program) {
        RBCompiler compiler = new RBCompiler(options);
        CompileResult result = compiler.compile(program);
        Assert.assertNull(result);
        Assert.assertTrue(compiler.hasErrors());
        Assert.assertEquals(1, compiler.messages.errorCount());
        return compiler.messages.getError(0);
    }

    /** {@code receiver.method} with no arguments; receiver may be null. */
    public static Node call(Node receiver, String method) {
        return Nodes.send(receiver, method);
    }

    /** A read of a local variable or a call without receiver, as the parser produces it. */
    public static Node bareword(String name) {
        return Nodes.send(null, name);
    }

    public static Node args(String... names) {
        Node[] args = new Node[names.length];
        for (int i = 0; i < names.length; i++)
            args[i] = Nodes.s(Tag.ARG, names[i]);
        return Nodes.s(Tag.ARGS, (Object[]) args);
    }
}
