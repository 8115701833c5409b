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
import org.rbjs.rbCompiler.ir.Tag;
import org.rbjs.util.IWritesLogs;
import org.rbjs.util.Logger;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks a tree and lets the stages intercept every node kind.
 * For each kind the handlers of the stages are chained in stage order;
 * the last link of every chain is the generic recursion, which processes
 * the children and rebuilds the node only if some child changed.
 * Chains are built the first time a kind is encountered and cached.
 */
public class Dispatcher implements IWritesLogs {
    private final List<Stage> stages;
    private final Map<Tag, Next> chains;
    private final Next recurse;
    /** Current nesting depth of {@link #process}. */
    private int depth;

    public Dispatcher(List<Stage> stages) {
        this.stages = stages;
        this.chains = new HashMap<>();
        this.recurse = this::processChildren;
        this.depth = 0;
    }

    /** Process a child of a node.  Literals and null are returned unchanged. */
    @Nullable
    public Object process(@Nullable Object child) {
        if (child instanceof Node node)
            return this.process(node);
        return child;
    }

    public Node process(Node node) {
        Next chain = this.chainFor(node.kind);
        this.depth++;
        try {
            return chain.apply(node);
        } finally {
            this.depth--;
        }
    }

    /** Depth of the current recursion; 0 when not processing. */
    public int getDepth() {
        return this.depth;
    }

    Next chainFor(Tag kind) {
        Next result = this.chains.get(kind);
        if (result == null) {
            result = this.buildChain(kind);
            this.chains.put(kind, result);
        }
        return result;
    }

    Next buildChain(Tag kind) {
        Next next = this.recurse;
        for (int i = this.stages.size() - 1; i >= 0; i--) {
            Stage stage = this.stages.get(i);
            Handler handler = stage.handlerFor(kind);
            if (handler == null)
                continue;
            final Next rest = next;
            next = node -> {
                Logger.INSTANCE.belowLevel(this, 4)
                        .appendSupplier(stage::toString)
                        .append(" handles ")
                        .append(node.kind.name)
                        .newline();
                return handler.handle(node, rest);
            };
        }
        return next;
    }

    /** The generic recursion: process every child, and rebuild the node
     * only if at least one child changed. */
    public Node processChildren(Node node) {
        List<Object> children = null;
        for (int i = 0; i < node.size(); i++) {
            Object child = node.child(i);
            Object result = this.process(child);
            if (result != child) {
                if (children == null)
                    children = new ArrayList<>(node.children());
                children.set(i, result);
            }
        }
        if (children == null)
            return node;
        return node.withChildren(children);
    }
}
