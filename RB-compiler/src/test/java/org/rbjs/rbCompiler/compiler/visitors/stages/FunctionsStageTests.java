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

import org.junit.Assert;
import org.junit.Test;
import org.rbjs.rbCompiler.compiler.BaseRBTests;
import org.rbjs.rbCompiler.compiler.CompilerOptions;
import org.rbjs.rbCompiler.compiler.CompileResult;
import org.rbjs.rbCompiler.compiler.EsLevel;
import org.rbjs.rbCompiler.compiler.context.CommentTable;
import org.rbjs.rbCompiler.compiler.errors.CompilerMessages;
import org.rbjs.rbCompiler.compiler.errors.UnsupportedFeatureException;
import org.rbjs.rbCompiler.ir.Node;
import org.rbjs.rbCompiler.ir.Nodes;
import org.rbjs.rbCompiler.ir.Tag;

import java.util.List;

public class FunctionsStageTests extends BaseRBTests {
    static Node functions(CompilerOptions options, Node program) {
        return compile(options, program).program();
    }

    static Node functions(Node program) {
        return functions(testOptions("functions"), program);
    }

    static final Node A = Nodes.lvar("a");

    @Test
    public void puts() {
        Node result = functions(Nodes.send(null, "puts", Nodes.str("hi")));
        Assert.assertEquals(Nodes.send(Nodes.attr("console"), "log", Nodes.str("hi")), result);
    }

    @Test
    public void predicates() {
        Assert.assertEquals(Nodes.send(Nodes.s(Tag.ATTR, A, "length"), "==", Nodes.integer(0)),
                functions(call(A, "empty?")));
        Assert.assertEquals(Nodes.send(A, "==", Nodes.nil()), functions(call(A, "nil?")));
        Assert.assertEquals(Nodes.send(A, "includes", Nodes.lvar("b")),
                functions(Nodes.send(A, "include?", Nodes.lvar("b"))));
        Assert.assertEquals(Nodes.send(A, "startsWith", Nodes.str("x")),
                functions(Nodes.send(A, "start_with?", Nodes.str("x"))));
        Assert.assertEquals(Nodes.send(A, "some", Nodes.constant("Boolean")), functions(call(A, "any?")));
    }

    @Test
    public void conversions() {
        Assert.assertEquals(Nodes.s(Tag.CALL, A, "toString"), functions(call(A, "to_s")));
        Assert.assertEquals(Nodes.send(null, "parseInt", A), functions(call(A, "to_i")));
        Assert.assertEquals(Nodes.send(null, "parseFloat", A), functions(call(A, "to_f")));
        Assert.assertEquals(Nodes.send(Nodes.constant("JSON"), "stringify", A), functions(call(A, "to_json")));
        Assert.assertEquals(Nodes.s(Tag.SEND_BANG, A, "toUpperCase"), functions(call(A, "upcase")));
        Assert.assertEquals(Nodes.s(Tag.SEND_BANG, A, "trim"), functions(call(A, "strip")));
    }

    @Test
    public void nested() {
        // each and join apply to the receiver after it has been rewritten
        Node program = call(Nodes.send(Nodes.lvar("xs"), "each"), "join");
        Assert.assertEquals(Nodes.send(Nodes.send(Nodes.lvar("xs"), "forEach"), "join", Nodes.str("")),
                functions(program));
        Assert.assertEquals(A, functions(call(A, "freeze")));
        Assert.assertEquals(Nodes.send(null, "parseInt", Nodes.s(Tag.CALL, A, "toString")),
                functions(call(call(A, "to_s"), "to_i")));
    }

    @Test
    public void excludedMethods() {
        CompilerOptions options = testOptions("functions");
        options.languageOptions.exclude.add("puts");
        Node program = Nodes.send(null, "puts", call(A, "upcase"));
        Assert.assertEquals(Nodes.send(null, "puts", Nodes.s(Tag.SEND_BANG, A, "toUpperCase")),
                functions(options, program));

        options = testOptions("functions");
        options.languageOptions.includeOnly = List.of("puts");
        Assert.assertEquals(Nodes.send(Nodes.attr("console"), "log", call(A, "upcase")),
                functions(options, program));
    }

    @Test
    public void unknownMethodsAreUnchanged() {
        Node program = Nodes.begin(Nodes.send(A, "frobnicate", Nodes.integer(1)), call(A, "size"));
        Assert.assertSame(program, functions(program));
    }

    @Test
    public void safeNavigation() {
        Node csend = Nodes.s(Tag.CSEND, A, "empty?");
        Assert.assertEquals(Nodes.send(Nodes.s(Tag.CSEND, A, "length"), "==", Nodes.integer(0)),
                functions(csend));
        Node include = Nodes.s(Tag.CSEND, A, "include?", Nodes.lvar("b"));
        Assert.assertEquals(Nodes.s(Tag.CSEND, A, "includes", Nodes.lvar("b")), functions(include));
        Node unknown = Nodes.s(Tag.CSEND, A, "frobnicate");
        Assert.assertSame(unknown, functions(unknown));
    }

    @Test
    public void safeNavigationKeepsCallSyntax() {
        Node toString = Nodes.s(Tag.CSEND, A, "to_s");
        Node result = functions(toString);
        Assert.assertEquals(Tag.CCALL, result.kind);
        Assert.assertEquals(Nodes.s(Tag.CCALL, A, "toString"), result);
    }

    @Test
    public void safeNavigationKeepsComments() {
        Node x = Nodes.lvar("x").withPosition(position(1, 1, 2));
        Node frozen = Nodes.s(Tag.CSEND, x, "freeze").withPosition(position(1, 1, 10));
        CommentTable comments = new CommentTable();
        comments.add(frozen, "# note");
        CompileResult result = compile(testOptions("functions"), frozen, comments);
        Assert.assertEquals(x, result.program());
        Assert.assertEquals(List.of("# note"), comments.get(result.program()));
        Assert.assertEquals(1, comments.size());

        Node toString = Nodes.s(Tag.CSEND, x, "to_s").withPosition(position(2, 1, 8));
        comments = new CommentTable();
        comments.add(toString, "# text");
        result = compile(testOptions("functions"), toString, comments);
        Assert.assertEquals(Tag.CCALL, result.program().kind);
        Assert.assertEquals(List.of("# text"), comments.get(result.program()));
        Assert.assertEquals(1, comments.size());

        Node unknown = Nodes.s(Tag.CSEND, x, "frobnicate").withPosition(position(3, 1, 14));
        comments = new CommentTable();
        comments.add(unknown, "# kept");
        result = compile(testOptions("functions"), unknown, comments);
        Assert.assertEquals(List.of("# kept"), comments.get(result.program()));
    }

    @Test
    public void safeNavigationNeedsES2020() {
        CompilerOptions options = testOptions("functions");
        options.languageOptions.esLevel = EsLevel.ES2015;
        Node csend = Nodes.s(Tag.CSEND, A, "empty?").withPosition(position(4, 1, 9));
        CompilerMessages.Message error = compileWithError(options, csend);
        Assert.assertEquals(UnsupportedFeatureException.KIND, error.errorType);
        Assert.assertTrue(error.message, error.message.contains("ES2020"));
        Assert.assertEquals(position(4, 1, 9), error.range);
    }

    @Test
    public void reservedProperties() {
        Node assignment = Nodes.send(Nodes.lvar("obj"), "[]=", Nodes.str("__proto__"), Nodes.integer(1))
                .withPosition(position(3, 5, 20));
        Node program = Nodes.begin(Nodes.send(null, "puts", Nodes.str("x")), assignment);
        CompilerMessages.Message error = compileWithError(testOptions("functions"), program);
        Assert.assertEquals("Compilation error", error.errorType);
        Assert.assertTrue(error.message, error.message.contains("__proto__"));
        Assert.assertEquals(position(3, 5, 20), error.range);

        // Excluding the method does not disable the check
        CompilerOptions options = testOptions("functions");
        options.languageOptions.exclude.add("[]=");
        Node symbol = Nodes.send(Nodes.lvar("obj"), "[]=", Nodes.sym("constructor"), Nodes.nil());
        compileWithError(options, symbol);

        Node allowed = Nodes.send(Nodes.lvar("obj"), "[]=", Nodes.str("name"), Nodes.nil());
        Assert.assertSame(allowed, functions(allowed));
    }
}
