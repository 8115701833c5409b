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

import org.rbjs.rbCompiler.compiler.context.CompileContext;
import org.rbjs.rbCompiler.compiler.errors.InternalCompilerError;
import org.rbjs.rbCompiler.ir.Node;
import org.rbjs.rbCompiler.ir.Tag;
import org.rbjs.util.IWritesLogs;
import org.rbjs.util.Logger;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A unit of rewriting contributing handlers for some node kinds.
 * Handlers are registered in the constructor with {@link #register}.
 * A stage instance belongs to a single {@link Pipeline}, and hence to a
 * single compilation.
 */
public abstract class Stage implements IWritesLogs {
    public final String name;
    private final Map<Tag, Handler> handlers;
    @Nullable
    private Dispatcher dispatcher;
    @Nullable
    private CompileContext context;

    protected Stage(String name) {
        this.name = name;
        this.handlers = new LinkedHashMap<>();
        this.dispatcher = null;
        this.context = null;
    }

    protected void register(Tag tag, Handler handler) {
        if (this.handlers.containsKey(tag))
            throw new InternalCompilerError("Stage " + this + " registers two handlers for " + tag);
        this.handlers.put(tag, handler);
    }

    /** The handler for nodes of this kind: the one registered for the kind
     * itself, or else for its closest ancestor. */
    @Nullable
    public Handler handlerFor(Tag tag) {
        for (Tag t = tag; t != null; t = t.parent) {
            Handler handler = this.handlers.get(t);
            if (handler != null)
                return handler;
        }
        return null;
    }

    void attach(Dispatcher dispatcher, CompileContext context) {
        if (this.dispatcher != null)
            throw new InternalCompilerError("Stage " + this + " already belongs to a pipeline");
        this.dispatcher = dispatcher;
        this.context = context;
    }

    /** Invoked once per compilation, before any node is processed. */
    public void initialize(CompileContext context) {}

    /** Invoked once per compilation, after the whole tree has been processed. */
    public Node finish(Node program) {
        return program;
    }

    protected CompileContext context() {
        if (this.context == null)
            throw new InternalCompilerError("Stage " + this + " is not part of a pipeline");
        return this.context;
    }

    /** Run the whole pipeline on a node. */
    protected Node process(Node node) {
        if (this.dispatcher == null)
            throw new InternalCompilerError("Stage " + this + " is not part of a pipeline");
        return this.dispatcher.process(node);
    }

    /** Run the whole pipeline on a child: literals and null are returned unchanged. */
    @Nullable
    protected Object processChild(@Nullable Object child) {
        if (child instanceof Node node)
            return this.process(node);
        return child;
    }

    /** Record that {@code old} is replaced by {@code replacement}: the comments
     * of the old node move to the replacement, which inherits the source
     * position of the old node if it has none. */
    protected Node rewrite(Node old, Node replacement) {
        if (old == replacement)
            return old;
        if (!replacement.getPositionRange().isValid())
            replacement = replacement.withPosition(old.getPositionRange());
        this.context().comments.move(old, replacement);
        Node result = replacement;
        Logger.INSTANCE.belowLevel(this, 1)
                .appendSupplier(this::toString)
                .append(":")
                .appendSupplier(old::toString)
                .append(" -> ")
                .appendSupplier(result::toString)
                .newline();
        return result;
    }

    /** True if rewrites of this method name are disabled. */
    protected boolean excluded(String method) {
        return this.context().methods.isExcluded(method);
    }

    /** Register a declaration to emit before the program. */
    protected void hoist(Node declaration) {
        this.context().hoisted.add(declaration);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + "(" + this.name + ")";
    }
}
