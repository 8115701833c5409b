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

import org.rbjs.rbCompiler.compiler.context.CompileContext;
import org.rbjs.rbCompiler.compiler.errors.InternalCompilerError;
import org.rbjs.rbCompiler.ir.Node;
import org.rbjs.rbCompiler.ir.Tag;
import org.rbjs.rbCompiler.compiler.visitors.Next;
import org.rbjs.rbCompiler.compiler.visitors.Stage;

import javax.annotation.Nullable;

/** Applies the {@link BufferCoalescer} to every statement sequence,
 * after the rest of the pipeline has processed the sequence. */
public class CoalesceStage extends Stage {
    public static final String NAME = "coalesce";

    @Nullable
    BufferCoalescer coalescer;

    public CoalesceStage() {
        super(NAME);
        this.coalescer = null;
        this.register(Tag.BEGIN, this::onBegin);
    }

    @Override
    public void initialize(CompileContext context) {
        this.coalescer = new BufferCoalescer(
                BufferCoalescer.bufferNames(context.options), context.esLevel(), context.comments);
    }

    Node onBegin(Node node, Next next) {
        if (this.coalescer == null)
            throw new InternalCompilerError("Stage " + this + " used before initialization", node);
        Node result = next.apply(node);
        if (!result.kind.isA(Tag.BEGIN))
            return result;
        return this.rewrite(result, this.coalescer.coalesce(result));
    }
}
