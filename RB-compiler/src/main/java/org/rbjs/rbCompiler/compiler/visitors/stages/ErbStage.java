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
import org.rbjs.rbCompiler.compiler.visitors.Next;
import org.rbjs.rbCompiler.compiler.visitors.ScopedState;
import org.rbjs.rbCompiler.compiler.visitors.Stage;
import org.rbjs.rbCompiler.ir.Node;
import org.rbjs.rbCompiler.ir.Nodes;
import org.rbjs.rbCompiler.ir.Tag;
import org.rbjs.util.Linq;
import org.rbjs.util.Logger;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts a compiled template into a render function.
 *
 * <p>A template is a statement sequence whose first statement initializes an
 * output buffer.  Inside a template buffer appends ({@code buf << x},
 * {@code buf.append= x}) become {@code buf += x}, instance variables become
 * locals, and {@code html_safe}, {@code raw} and {@code freeze} disappear.
 * The result is {@code def render({a, b, ...}) body}, where the parameters
 * are the instance variables and the free variables of the body.
 */
public class ErbStage extends Stage {
    public static final String NAME = "erb";

    /** The buffer of the template being converted; null outside templates. */
    final ScopedState<String> buffer;
    Set<String> buffers;

    public ErbStage() {
        super(NAME);
        this.buffer = new ScopedState<>("buffer", null);
        this.buffers = new LinkedHashSet<>(BufferCoalescer.DEFAULT_BUFFERS);
        this.register(Tag.BEGIN, this::onBegin);
        this.register(Tag.IVAR, this::onIvar);
        this.register(Tag.LVASGN, this::onLvasgn);
        this.register(Tag.SEND, this::onSend);
    }

    @Override
    public void initialize(CompileContext context) {
        this.buffers = BufferCoalescer.bufferNames(context.options);
    }

    boolean inTemplate() {
        return this.buffer.get() != null;
    }

    /** The buffer initialized by the first statement of a template, or null. */
    @Nullable
    String templateBuffer(Node node) {
        if (!node.is(Tag.BEGIN) || node.size() < 2 || !node.childIs(0, Tag.LVASGN))
            return null;
        String name = node.nonNull(0).string(0);
        if (name != null && this.buffers.contains(name))
            return name;
        return null;
    }

    Node onBegin(Node node, Next next) {
        String bufferName = this.templateBuffer(node);
        if (bufferName == null || this.inTemplate())
            return next.apply(node);

        List<String> ivars = ScopeInference.instanceVariables(node);
        Node body;
        try (var ignored = this.buffer.enter(bufferName)) {
            // Process the whole sequence again, so the sequence handlers
            // of the other stages see the rewritten appends.
            body = this.process(node);
        }

        List<String> excluded = new ArrayList<>(this.buffers);
        for (Node declaration: this.context().hoisted.imports())
            excluded.addAll(ScopeInference.importedNames(declaration));
        Set<String> parameters = new LinkedHashSet<>(ivars);
        parameters.addAll(ScopeInference.freeVariables(body, excluded));
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Template parameters ")
                .join(", ", parameters)
                .newline();

        Node args;
        if (parameters.isEmpty()) {
            args = Nodes.s(Tag.ARGS);
        } else {
            List<Node> kwargs = Linq.map(new ArrayList<>(parameters), p -> Nodes.s(Tag.KWARG, p));
            args = Nodes.s(Tag.ARGS, Nodes.s(Tag.DESTRUCTURE, kwargs));
        }
        Node render = Nodes.s(Tag.DEF, "render", args,
                Nodes.s(Tag.AUTORETURN, Nodes.statements(body)));
        return this.rewrite(node, render);
    }

    Node onIvar(Node node, Next next) {
        if (!this.inTemplate())
            return next.apply(node);
        return this.rewrite(node, Nodes.lvar(ScopeInference.stripSigil(node.nonNullString(0))));
    }

    Node onLvasgn(Node node, Next next) {
        if (!this.inTemplate() || node.size() != 2 || !this.buffers.contains(node.nonNullString(0)))
            return next.apply(node);
        return this.rewrite(node, Nodes.lvasgn(node.nonNullString(0), Nodes.str("")));
    }

    boolean isBuffer(@Nullable Node node) {
        return node != null && node.is(Tag.LVAR) && node.nonNullString(0).equals(this.buffer.get());
    }

    static boolean isCallOf(@Nullable Node node, String method) {
        return node != null && node.is(Tag.SEND) && node.size() == 2 &&
                node.node(0) != null && method.equals(node.child(1));
    }

    /** The value appended by {@code buffer << value}. */
    Node appendedValue(Node value) {
        if (isCallOf(value, "freeze"))
            value = value.nonNull(0);
        if (isCallOf(value, "to_s")) {
            Node inner = Nodes.unwrap(value.nonNull(0));
            Node processed = this.process(inner);
            if (processed.is(Tag.STR))
                return processed;
            return Nodes.send(null, "String", processed);
        }
        return this.process(value);
    }

    Node onSend(Node node, Next next) {
        if (!this.inTemplate() || !node.is(Tag.SEND))
            return next.apply(node);
        Node target = Nodes.receiver(node);
        String method = Nodes.method(node);
        List<Object> args = Nodes.arguments(node);

        if (this.isBuffer(target) && (method.equals("<<") || method.equals("append=")) &&
                args.size() == 1 && args.get(0) instanceof Node value) {
            Node append = Nodes.append(this.buffer.get(), this.appendedValue(value));
            return this.rewrite(node, append);
        }
        if (target != null && args.isEmpty()) {
            if (method.equals("freeze") || method.equals("html_safe") ||
                    (method.equals("to_s") && this.isBuffer(target)))
                return this.rewrite(node, this.process(target));
        }
        if (target == null && method.equals("raw") && args.size() == 1 && args.get(0) instanceof Node value)
            return this.rewrite(node, this.process(value));
        return next.apply(node);
    }
}
