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

import org.rbjs.rbCompiler.compiler.CompilerOptions;
import org.rbjs.rbCompiler.compiler.EsLevel;
import org.rbjs.rbCompiler.compiler.context.CommentTable;
import org.rbjs.rbCompiler.ir.Node;
import org.rbjs.rbCompiler.ir.Nodes;
import org.rbjs.rbCompiler.ir.Tag;
import org.rbjs.util.IWritesLogs;
import org.rbjs.util.Linq;
import org.rbjs.util.Logger;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges runs of statements that only append to an output buffer into a
 * single append of an interpolated string.
 *
 * <p>A statement is a <em>producer</em> for buffer {@code b} when it is
 * <ul>
 *     <li>an append {@code b += value},</li>
 *     <li>a non-empty sequence of producers for {@code b},</li>
 *     <li>a conditional whose present branches are producers for {@code b};
 *     an absent branch produces the empty string,</li>
 *     <li>a for-each loop ({@code each}/{@code forEach} block or {@code for})
 *     whose body is a producer for {@code b}.</li>
 * </ul>
 * Maximal runs of two or more consecutive producers for the same buffer
 * are replaced by one append.  A conditional becomes a ternary expression and
 * a loop becomes {@code collection.map(...).join("")}.  Runs that contain
 * only literal text become a plain string literal.
 */
public class BufferCoalescer implements IWritesLogs {
    /** Names of the output buffers of compiled templates. */
    public static final List<String> DEFAULT_BUFFERS = List.of("_erbout", "_buf");

    final Set<String> buffers;
    final EsLevel level;
    @Nullable
    final CommentTable comments;

    public BufferCoalescer(Set<String> buffers, EsLevel level, @Nullable CommentTable comments) {
        this.buffers = buffers;
        this.level = level;
        this.comments = comments;
    }

    /** The default buffer names together with the ones named in the options. */
    public static Set<String> bufferNames(CompilerOptions options) {
        Set<String> result = new LinkedHashSet<>(DEFAULT_BUFFERS);
        result.addAll(options.languageOptions.buffers);
        return result;
    }

    /** Text of a run under construction: a String is literal text, a Node is an expression. */
    static final class Parts {
        final List<Object> parts = new ArrayList<>();

        void text(String text) {
            if (text.isEmpty())
                return;
            int last = this.parts.size() - 1;
            if (last >= 0 && this.parts.get(last) instanceof String previous)
                this.parts.set(last, previous + text);
            else
                this.parts.add(text);
        }

        void expression(Node expression) {
            this.parts.add(expression);
        }

        boolean allLiteral() {
            return Linq.all(this.parts, p -> p instanceof String);
        }

        String literal() {
            return String.join("", Linq.map(this.parts, p -> (String) p));
        }

        /** The parts as children of an interpolated string. */
        List<Node> interpolation() {
            return Linq.map(this.parts, p -> p instanceof String text ?
                    Nodes.str(text) : Nodes.begin((Node) p));
        }
    }

    /** The buffer appended to by a statement of the form {@code buffer += value}, or null. */
    @Nullable
    public String appendTarget(Node statement) {
        if (!statement.is(Tag.OP_ASGN) || statement.size() != 3)
            return null;
        if (!statement.childIs(0, Tag.LVASGN) || !"+".equals(statement.child(1)))
            return null;
        Node target = statement.nonNull(0);
        if (target.size() != 1)
            return null;
        String name = target.string(0);
        if (name == null || !this.buffers.contains(name))
            return null;
        return name;
    }

    /** The collection iterated by a for-each loop, or null if the node is not one. */
    @Nullable
    static Node loopCollection(Node node) {
        if (node.is(Tag.BLOCK) && node.size() == 3 && node.node(0) != null) {
            Node call = node.nonNull(0);
            if (!call.kind.isA(Tag.SEND) || call.size() != 2)
                return null;
            String method = call.string(1);
            if (!"each".equals(method) && !"forEach".equals(method))
                return null;
            return Nodes.receiver(call);
        }
        if (node.kind.isA(Tag.FOR) && node.size() == 3 && node.childIs(0, Tag.LVASGN))
            return node.node(1);
        return null;
    }

    @Nullable
    static Node loopBody(Node loop) {
        return loop.node(2);
    }

    /** The buffer for which this statement is a producer, or null if it is not a producer. */
    @Nullable
    public String producerBuffer(@Nullable Node statement) {
        if (statement == null)
            return null;
        String append = this.appendTarget(statement);
        if (append != null)
            return append;
        if (statement.is(Tag.BEGIN)) {
            if (statement.size() == 0)
                return null;
            String result = null;
            for (Object child: statement.children()) {
                if (!(child instanceof Node node))
                    return null;
                String buffer = this.producerBuffer(node);
                if (buffer == null || (result != null && !result.equals(buffer)))
                    return null;
                result = buffer;
            }
            return result;
        }
        if (statement.is(Tag.IF) && statement.size() == 3) {
            Node then = statement.node(1);
            Node otherwise = statement.node(2);
            if (then == null && otherwise == null)
                return null;
            String thenBuffer = then == null ? null : this.producerBuffer(then);
            String elseBuffer = otherwise == null ? null : this.producerBuffer(otherwise);
            if (then != null && thenBuffer == null)
                return null;
            if (otherwise != null && elseBuffer == null)
                return null;
            if (thenBuffer != null && elseBuffer != null && !thenBuffer.equals(elseBuffer))
                return null;
            return thenBuffer != null ? thenBuffer : elseBuffer;
        }
        Node collection = loopCollection(statement);
        if (collection != null)
            return this.producerBuffer(loopBody(statement));
        return null;
    }

    public boolean isPureProducer(@Nullable Node statement) {
        return this.producerBuffer(statement) != null;
    }

    /** Strip a conversion to string: {@code String(x)} or {@code x.to_s}. */
    static Node stripStringify(Node value) {
        if (Nodes.isCall(value, "String", 1) && value.node(2) != null)
            return value.nonNull(2);
        if (value.kind.isA(Tag.SEND) && value.size() == 2 && value.node(0) != null) {
            String method = value.string(1);
            if ("to_s".equals(method) || "toString".equals(method))
                return value.nonNull(0);
        }
        return value;
    }

    void appendValue(Node value, Parts parts) {
        if (value.is(Tag.STR)) {
            parts.text(value.nonNullString(0));
        } else if (value.is(Tag.DSTR)) {
            for (Object child: value.children()) {
                if (!(child instanceof Node part))
                    continue;
                if (part.is(Tag.STR)) {
                    parts.text(part.nonNullString(0));
                } else if (part.is(Tag.BEGIN)) {
                    if (part.size() == 0)
                        continue;
                    if (part.size() == 1)
                        parts.expression(stripStringify(part.nonNull(0)));
                    else
                        parts.expression(part);
                } else {
                    parts.expression(stripStringify(part));
                }
            }
        } else {
            parts.expression(stripStringify(value));
        }
    }

    /** Add the contribution of a producer statement to the parts. */
    void contribute(Node statement, Parts parts) {
        if (this.appendTarget(statement) != null) {
            this.appendValue(statement.nonNull(2), parts);
        } else if (statement.is(Tag.BEGIN)) {
            for (Object child: statement.children())
                this.contribute((Node) child, parts);
        } else if (statement.is(Tag.IF)) {
            Node ternary = statement.withChildren(Linq.list(
                    statement.child(0),
                    this.innerValue(statement.node(1)),
                    this.innerValue(statement.node(2))));
            parts.expression(ternary);
        } else {
            Node collection = loopCollection(statement);
            if (collection == null)
                throw new IllegalArgumentException("Not a producer: " + statement);
            Node args;
            if (statement.is(Tag.BLOCK)) {
                args = statement.nonNull(1);
            } else {
                Node variable = statement.nonNull(0);
                args = Nodes.s(Tag.ARGS, Nodes.s(Tag.ARG, variable.nonNullString(0)));
            }
            Node map = Nodes.s(Tag.BLOCK, Nodes.send(collection, "map"), args,
                    this.innerValue(loopBody(statement)));
            parts.expression(Nodes.send(map, "join", Nodes.str("")));
        }
    }

    /** Reduce the statements of a branch or loop body to a single value. */
    Node innerValue(@Nullable Node body) {
        Parts parts = new Parts();
        if (body != null)
            this.contribute(body, parts);
        if (parts.parts.isEmpty())
            return Nodes.str("");
        if (parts.allLiteral())
            return Nodes.str(parts.literal());
        if (parts.parts.size() == 1)
            return (Node) parts.parts.get(0);
        return Nodes.s(Tag.DSTR, parts.interpolation());
    }

    /** Merge a run of producers into a single append, or return null if the run cannot be merged. */
    @Nullable
    Node merge(String buffer, List<Node> run) {
        Parts parts = new Parts();
        for (Node statement: run)
            this.contribute(statement, parts);
        Node value;
        if (parts.allLiteral()) {
            value = Nodes.str(parts.literal());
        } else if (!this.level.atLeast(EsLevel.ES2015)) {
            return null;
        } else {
            value = Nodes.s(Tag.DSTR, parts.interpolation());
        }
        Node result = Nodes.append(buffer, value).withPosition(run.get(0).getPositionRange());
        if (this.comments != null) {
            for (Node statement: run)
                this.comments.move(statement, result);
        }
        return result;
    }

    /** Coalesce the runs in a statement sequence.  Returns the same node if nothing changed. */
    public Node coalesce(Node sequence) {
        List<Object> result = new ArrayList<>();
        boolean changed = false;
        int i = 0;
        int size = sequence.size();
        while (i < size) {
            Object child = sequence.child(i);
            String buffer = child instanceof Node node ? this.producerBuffer(node) : null;
            if (buffer == null) {
                result.add(child);
                i++;
                continue;
            }
            int end = i + 1;
            while (end < size && sequence.child(end) instanceof Node next &&
                    buffer.equals(this.producerBuffer(next)))
                end++;
            List<Node> run = new ArrayList<>();
            for (int j = i; j < end; j++)
                run.add(sequence.nonNull(j));
            Node merged = run.size() > 1 ? this.merge(buffer, run) : null;
            if (merged == null) {
                result.addAll(run);
            } else {
                Logger.INSTANCE.belowLevel(this, 2)
                        .append("Merged ")
                        .append(run.size())
                        .append(" appends to ")
                        .append(buffer)
                        .newline();
                result.add(merged);
                changed = true;
            }
            i = end;
        }
        if (!changed)
            return sequence;
        return sequence.withChildren(result);
    }
}
