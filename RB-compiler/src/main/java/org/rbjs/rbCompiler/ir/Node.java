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

package org.rbjs.rbCompiler.ir;

import org.rbjs.rbCompiler.compiler.IHasSourcePositionRange;
import org.rbjs.rbCompiler.compiler.errors.InternalCompilerError;
import org.rbjs.rbCompiler.compiler.errors.SourcePositionRange;
import org.rbjs.util.ICastable;
import org.rbjs.util.IIndentStream;
import org.rbjs.util.IndentStream;
import org.rbjs.util.ToIndentableString;
import org.rbjs.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An immutable syntax tree node: a {@link Tag} and an ordered list of children.
 * A child is another node, a primitive literal ({@link String}, {@link Long},
 * {@link Double}, {@link Boolean}) or null.
 *
 * <p>Equality and hashing are structural over the kind and the children.
 * The source position is carried along for error messages and comments,
 * but it does not take part in equality.  Nodes have no parent pointers;
 * a rewrite produces a new subtree and the ancestors are rebuilt by the caller.
 */
public final class Node implements ICastable, IHasSourcePositionRange, ToIndentableString {
    public final Tag kind;
    private final List<Object> children;
    private final SourcePositionRange position;
    /** Cached hash code; 0 if not yet computed. */
    private int hash;

    public Node(Tag kind, List<?> children, SourcePositionRange position) {
        this.kind = kind;
        List<Object> copy = new ArrayList<>(children.size());
        for (Object child: children)
            copy.add(normalize(child));
        this.children = Collections.unmodifiableList(copy);
        this.position = position;
    }

    public Node(Tag kind, List<?> children) {
        this(kind, children, SourcePositionRange.INVALID);
    }

    @Nullable
    static Object normalize(@Nullable Object child) {
        if (child == null || child instanceof Node || child instanceof String ||
                child instanceof Long || child instanceof Double || child instanceof Boolean)
            return child;
        if (child instanceof Integer || child instanceof Short || child instanceof Byte)
            return ((Number) child).longValue();
        if (child instanceof Float)
            return ((Float) child).doubleValue();
        throw new InternalCompilerError("Illegal node child " + child + " of type " + child.getClass());
    }

    /** True if the object is a tree node, as opposed to a literal or null. */
    public static boolean isNode(@Nullable Object object) {
        return object instanceof Node;
    }

    public List<Object> children() {
        return this.children;
    }

    public int size() {
        return this.children.size();
    }

    @Nullable
    public Object child(int index) {
        return this.children.get(index);
    }

    /** The child at the specified index, which must be a node or null. */
    @Nullable
    public Node node(int index) {
        Object child = this.children.get(index);
        if (child == null)
            return null;
        if (!(child instanceof Node))
            throw new InternalCompilerError("Child " + index + " of " + this + " is not a node", this);
        return (Node) child;
    }

    /** The child at the specified index, which must be a non-null node. */
    public Node nonNull(int index) {
        Node result = this.node(index);
        if (result == null)
            throw new InternalCompilerError("Child " + index + " of " + this + " is null", this);
        return result;
    }

    /** The child at the specified index, which must be a string or null. */
    @Nullable
    public String string(int index) {
        Object child = this.children.get(index);
        if (child == null)
            return null;
        if (!(child instanceof String))
            throw new InternalCompilerError("Child " + index + " of " + this + " is not a string", this);
        return (String) child;
    }

    public String nonNullString(int index) {
        String result = this.string(index);
        if (result == null)
            throw new InternalCompilerError("Child " + index + " of " + this + " is null", this);
        return result;
    }

    public boolean is(Tag tag) {
        return this.kind == tag;
    }

    /** True if the child at the specified index is a node with the specified kind. */
    public boolean childIs(int index, Tag tag) {
        if (index >= this.children.size())
            return false;
        Object child = this.children.get(index);
        return child instanceof Node && ((Node) child).kind == tag;
    }

    @Override
    public SourcePositionRange getPositionRange() {
        return this.position;
    }

    /** A node with the same kind and position and the specified children.
     * If every child is the same object (or an equal literal) as the
     * current child this node is returned. */
    public Node withChildren(List<?> newChildren) {
        if (this.sameChildren(newChildren))
            return this;
        return new Node(this.kind, newChildren, this.position);
    }

    /** A node with a different kind and children, but the same position. */
    public Node updated(Tag kind, List<?> newChildren) {
        if (kind == this.kind)
            return this.withChildren(newChildren);
        return new Node(kind, newChildren, this.position);
    }

    /** The same node carrying a different source position. */
    public Node withPosition(SourcePositionRange position) {
        if (this.position.equals(position))
            return this;
        return new Node(this.kind, this.children, position);
    }

    boolean sameChildren(List<?> newChildren) {
        if (newChildren.size() != this.children.size())
            return false;
        for (int i = 0; i < newChildren.size(); i++) {
            Object current = this.children.get(i);
            Object replacement = newChildren.get(i);
            if (current == replacement)
                continue;
            if (current instanceof Node || replacement instanceof Node)
                return false;
            if (!Objects.equals(current, normalize(replacement)))
                return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node other = (Node) o;
        if (this.kind != other.kind)
            return false;
        if (this.hash != 0 && other.hash != 0 && this.hash != other.hash)
            return false;
        return this.children.equals(other.children);
    }

    @Override
    public int hashCode() {
        int result = this.hash;
        if (result == 0) {
            result = 31 * this.kind.hashCode() + this.children.hashCode();
            if (result == 0)
                result = 1;
            this.hash = result;
        }
        return result;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("(").append(this.kind.name);
        boolean nested = false;
        for (Object child: this.children) {
            if (child instanceof Node) {
                if (!nested) {
                    builder.increase();
                    nested = true;
                } else {
                    builder.newline();
                }
                builder.append((Node) child);
            } else {
                if (nested)
                    builder.newline();
                else
                    builder.append(" ");
                if (child instanceof String)
                    builder.append(Utilities.doubleQuote((String) child));
                else
                    builder.append(String.valueOf(child));
            }
        }
        if (nested)
            builder.decrease();
        return builder.append(")");
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        IndentStream stream = new IndentStream(builder);
        stream.setIndentAmount(2);
        this.toString(stream);
        return builder.toString();
    }
}
