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

package org.rbjs.rbCompiler.compiler.visitors;

import org.junit.Assert;
import org.junit.Test;
import org.rbjs.rbCompiler.compiler.CompilerOptions;
import org.rbjs.rbCompiler.compiler.context.CommentTable;
import org.rbjs.rbCompiler.compiler.context.CompileContext;
import org.rbjs.rbCompiler.compiler.errors.InternalCompilerError;
import org.rbjs.rbCompiler.compiler.errors.SourcePositionRange;
import org.rbjs.rbCompiler.ir.Node;
import org.rbjs.rbCompiler.ir.Nodes;

import java.util.List;

public class PipelineTests {
    @Test
    public void hooksRunOnce() {
        StageFixtures.Hooks hooks = new StageFixtures.Hooks();
        Pipeline pipeline = new Pipeline(new CompileContext(CompilerOptions.getDefault()), hooks);
        Node program = Nodes.begin(Nodes.lvar("a"), Nodes.lvar("b"));
        Node result = pipeline.apply(program);
        Assert.assertEquals(1, hooks.initialized);
        Assert.assertEquals(1, hooks.finished);
        Assert.assertEquals(2, hooks.processed);
        Assert.assertEquals(Nodes.begin(program, Nodes.nil()), result);
    }

    @Test
    public void appliedOnlyOnce() {
        Pipeline pipeline = new Pipeline(new CompileContext(CompilerOptions.getDefault()));
        pipeline.apply(Nodes.nil());
        Assert.assertThrows(InternalCompilerError.class, () -> pipeline.apply(Nodes.nil()));
    }

    @Test
    public void stagesBelongToOnePipeline() {
        StageFixtures.StrToSym stage = new StageFixtures.StrToSym();
        new Pipeline(new CompileContext(CompilerOptions.getDefault()), stage);
        Assert.assertThrows(InternalCompilerError.class,
                () -> new Pipeline(new CompileContext(CompilerOptions.getDefault()), stage));
    }

    @Test
    public void hoistedDeclarationsArePrependedOnce() {
        CompileContext context = new CompileContext(CompilerOptions.getDefault());
        Pipeline pipeline = new Pipeline(context, new StageFixtures.Hoister());
        Node program = Nodes.begin(Nodes.str("a"), Nodes.str("b"));
        Node result = pipeline.apply(program);
        // Imports come first, even though the setup was hoisted first
        Assert.assertEquals(Nodes.begin(
                StageFixtures.Hoister.IMPORT, StageFixtures.Hoister.SETUP,
                Nodes.str("a"), Nodes.str("b")), result);
        Assert.assertEquals(2, context.hoisted.size());
        Assert.assertEquals(List.of(StageFixtures.Hoister.IMPORT, StageFixtures.Hoister.SETUP),
                pipeline.prelude());
    }

    @Test
    public void singleStatementIsWrapped() {
        SourcePositionRange position = new SourcePositionRange(1, 1, 1, 4);
        Pipeline pipeline = new Pipeline(new CompileContext(CompilerOptions.getDefault()),
                new StageFixtures.Hoister());
        Node result = pipeline.apply(Nodes.str("a").withPosition(position));
        Assert.assertEquals(Nodes.begin(
                StageFixtures.Hoister.IMPORT, StageFixtures.Hoister.SETUP, Nodes.str("a")), result);
        Assert.assertEquals(position, result.getPositionRange());
    }

    @Test
    public void disabledAutoimports() {
        CompilerOptions options = new CompilerOptions();
        options.languageOptions.disableAutoimports = true;
        Pipeline pipeline = new Pipeline(new CompileContext(options), new StageFixtures.Hoister());
        Node result = pipeline.apply(Nodes.begin(Nodes.str("a")));
        Assert.assertEquals(Nodes.begin(StageFixtures.Hoister.SETUP, Nodes.str("a")), result);
    }

    @Test
    public void rewriteMovesCommentsAndPosition() {
        SourcePositionRange position = new SourcePositionRange(3, 5, 3, 8);
        CommentTable comments = new CommentTable();
        Node str = Nodes.str("a").withPosition(position);
        comments.add(str, "# greeting");
        Pipeline pipeline = new Pipeline(new CompileContext(CompilerOptions.getDefault(), comments),
                new StageFixtures.StrToSym());
        Node result = pipeline.apply(Nodes.begin(str));
        Node sym = result.nonNull(0);
        Assert.assertEquals(Nodes.sym("a"), sym);
        Assert.assertEquals(position, sym.getPositionRange());
        Assert.assertEquals(List.of("# greeting"), comments.get(sym));
        Assert.assertFalse(comments.hasComments(str));
        Assert.assertEquals(1, comments.size());
    }
}
