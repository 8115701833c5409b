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

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Static helpers to build and inspect trees. */
public class Nodes {
    private Nodes() {}

    /** Build a node from a kind and a list of children. */
    public static Node s(Tag kind, @Nullable Object... children) {
        return new Node(kind, Arrays.asList(children));
    }

    public static Node s(Tag kind, List<?> children) {
        return new Node(kind, children);
    }

    public static Node str(String value) {
        return s(Tag.STR, value);
    }

    public static Node sym(String value) {
        return s(Tag.SYM, value);
    }

    public static Node integer(long value) {
        return s(Tag.INT, value);
    }

    public static Node nil() {
        return s(Tag.NIL);
    }

    public static Node lvar(String name) {
        return s(Tag.LVAR, name);
    }

    public static Node ivar(String name) {
        return s(Tag.IVAR, name);
    }

    public static Node lvasgn(String name, @Nullable Node value) {
        if (value == null)
            return s(Tag.LVASGN, name);
        return s(Tag.LVASGN, name, value);
    }

    public static Node constant(String name) {
        return s(Tag.CONST, null, name);
    }

    /** A global name of the output language, such as {@code console}. */
    public static Node attr(String name) {
        return s(Tag.ATTR, null, name);
    }

    public static Node send(@Nullable Node receiver, String method, Node... arguments) {
        List<Object> children = new ArrayList<>();
        children.add(receiver);
        children.add(method);
        children.addAll(Arrays.asList(arguments));
        return new Node(Tag.SEND, children);
    }

    public static Node begin(List<?> statements) {
        return new Node(Tag.BEGIN, statements);
    }

    public static Node begin(Node... statements) {
        return begin(Arrays.asList(statements));
    }

    /** {@code buffer += value} */
    public static Node append(String buffer, Node value) {
        return s(Tag.OP_ASGN, s(Tag.LVASGN, buffer), "+", value);
    }

    /** An import of a module bound to a single name. */
    public static Node importDefault(String module, String name) {
        return s(Tag.IMPORT, module, attr(name));
    }

    /** The receiver of a send-like node; null for function calls. */
    @Nullable
    public static Node receiver(Node send) {
        return send.node(0);
    }

    /** The method name of a send-like node. */
    public static String method(Node send) {
        return send.nonNullString(1);
    }

    /** The arguments of a send-like node. */
    public static List<Object> arguments(Node send) {
        return send.children().subList(2, send.size());
    }

    /** True for a send-like node with no receiver, the specified name and argument count. */
    public static boolean isCall(@Nullable Object node, String method, int argumentCount) {
        if (!(node instanceof Node))
            return false;
        Node n = (Node) node;
        return n.kind.isA(Tag.SEND) && n.size() == 2 + argumentCount &&
                n.child(0) == null && method.equals(n.child(1));
    }

    /** Remove redundant parentheses: a begin with a single statement. */
    @Nullable
    public static Node unwrap(@Nullable Node node) {
        while (node != null && node.is(Tag.BEGIN) && node.size() == 1)
            node = node.node(0);
        return node;
    }

    /** The statements of a node in statement position: the children of a
     * begin, nothing for null, and the node itself otherwise. */
    public static List<Node> statements(@Nullable Node node) {
        List<Node> result = new ArrayList<>();
        if (node == null)
            return result;
        if (node.is(Tag.BEGIN)) {
            for (int i = 0; i < node.size(); i++)
                result.add(node.nonNull(i));
        } else {
            result.add(node);
        }
        return result;
    }
}
