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
import org.junit.Test;
import org.rbjs.rbCompiler.compiler.errors.CompilationError;
import org.rbjs.rbCompiler.compiler.errors.CompilerMessages;
import org.rbjs.rbCompiler.compiler.visitors.stages.NodeStage;
import org.rbjs.rbCompiler.ir.Node;
import org.rbjs.rbCompiler.ir.Nodes;

import java.util.List;

public class RBCompilerTests extends BaseRBTests {
    static final String PROGRAM = """
            {"ast": {"type": "send", "children": [
                {"type": "const", "children": [null, "File"]}, "read",
                {"type": "str", "children": ["in.txt"],
                 "loc": {"start_line": 1, "start_column": 11, "end_line": 1, "end_column": 19}}],
              "loc": {"start_line": 1, "start_column": 1, "end_line": 1, "end_column": 20}},
             "comments": [{"loc": {"start_line": 1, "start_column": 1, "end_line": 1, "end_column": 20},
                           "type": "send", "text": "# read input"}]}""";

    @Test
    public void compileJson() {
        RBCompiler compiler = new RBCompiler(testOptions("functions", "node"));
        CompileResult result = compiler.compileJson(PROGRAM);
        Assert.assertFalse(compiler.hasErrors());
        Assert.assertNotNull(result);
        Node read = result.program().nonNull(1);
        Assert.assertEquals("readFileSync", Nodes.method(read));
        Assert.assertEquals(position(1, 1, 20), read.getPositionRange());
        Assert.assertEquals(List.of("# read input"), result.comments().get(read));
        Assert.assertEquals(List.of(NodeStage.IMPORT_FS), result.hoisted());
    }

    @Test
    public void compilationsAreIndependent() {
        RBCompiler compiler = new RBCompiler(testOptions("node"));
        CompileResult first = compiler.compileJson(PROGRAM);
        CompileResult second = compiler.compileJson(PROGRAM);
        Assert.assertNotNull(first);
        Assert.assertNotNull(second);
        Assert.assertEquals(first.program(), second.program());
        Assert.assertEquals(1, second.hoisted().size());

        Node plain = Nodes.send(null, "puts", Nodes.str("x"));
        CompileResult third = compiler.compile(plain);
        Assert.assertNotNull(third);
        Assert.assertSame(plain, third.program());
        Assert.assertTrue(third.hoisted().isEmpty());
    }

    @Test
    public void malformedInput() {
        RBCompiler compiler = new RBCompiler(testOptions());
        Assert.assertNull(compiler.compileJson("{\"ast\": [1, 2"));
        Assert.assertTrue(compiler.hasErrors());
        Assert.assertEquals("Malformed input", compiler.messages.getError(0).errorType);

        compiler = new RBCompiler(testOptions());
        Assert.assertNull(compiler.compileJson("{\"ast\": {}}"));
        Assert.assertEquals("Compilation error", compiler.messages.getError(0).errorType);
    }

    @Test
    public void unknownFilter() {
        CompilerMessages.Message error = compileWithError(testOptions("react"), Nodes.nil());
        Assert.assertTrue(error.message, error.message.contains("Unknown filter 'react'"));
    }

    @Test
    public void throwOnError() {
        CompilerOptions options = testOptions("functions");
        options.languageOptions.throwOnError = true;
        RBCompiler compiler = new RBCompiler(options);
        Node assignment = Nodes.send(Nodes.lvar("o"), "[]=", Nodes.str("prototype"), Nodes.nil());
        Assert.assertThrows(CompilationError.class, () -> compiler.compile(assignment));
        Assert.assertTrue(compiler.hasErrors());
        Assert.assertThrows(CompilationError.class, compiler::throwIfErrorsOccurred);
    }

    @Test
    public void warnings() {
        RBCompiler compiler = new RBCompiler(testOptions());
        compiler.reportWarning(position(1, 1, 2), "Deprecated", "Something old");
        Assert.assertFalse(compiler.hasErrors());
        Assert.assertEquals(1, compiler.messages.warningCount());
        String text = compiler.messages.toString();
        Assert.assertTrue(text, text.contains("(stdin):1:1: warning: Deprecated: Something old"));
    }

    @Test
    public void jsonErrors() {
        CompilerOptions options = testOptions();
        options.ioOptions.emitJsonErrors = true;
        RBCompiler compiler = new RBCompiler(options);
        compiler.reportError(position(2, 3, 4), "Some error", "Details");
        String text = compiler.messages.toString();
        Assert.assertTrue(text, text.contains("\"error_type\" : \"Some error\""));
        Assert.assertTrue(text, text.contains("\"start_line\" : 2"));
    }
}
