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

import org.rbjs.rbCompiler.ir.Node;
import org.rbjs.util.IWritesLogs;
import org.rbjs.util.Logger;

import javax.annotation.Nullable;

/** Depth-first traversal of a tree that does not change it. */
public abstract class NodeVisitor implements IWritesLogs {
    /** Invoked before the children; returning STOP skips them. */
    public VisitDecision preorder(Node node) {
        return VisitDecision.CONTINUE;
    }

    /** Invoked after the children, unless preorder returned STOP. */
    public void postorder(Node node) {}

    public void traverse(@Nullable Object tree) {
        if (!(tree instanceof Node node))
            return;
        if (this.preorder(node).stop())
            return;
        for (Object child: node.children())
            this.traverse(child);
        this.postorder(node);
    }

    public void apply(Node tree) {
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Starting ")
                .appendSupplier(this::toString)
                .append(" at ")
                .append(tree)
                .newline();
        this.traverse(tree);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName();
    }
}
