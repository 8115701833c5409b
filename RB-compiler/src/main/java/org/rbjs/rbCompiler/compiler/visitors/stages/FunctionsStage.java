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

import org.rbjs.rbCompiler.compiler.EsLevel;
import org.rbjs.rbCompiler.compiler.errors.CompilationError;
import org.rbjs.rbCompiler.compiler.errors.UnsupportedFeatureException;
import org.rbjs.rbCompiler.compiler.visitors.Next;
import org.rbjs.rbCompiler.compiler.visitors.Stage;
import org.rbjs.rbCompiler.ir.Node;
import org.rbjs.rbCompiler.ir.Nodes;
import org.rbjs.rbCompiler.ir.Tag;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Maps methods of the standard library to their equivalents in the output language. */
public class FunctionsStage extends Stage {
    public static final String NAME = "functions";

    /** Properties that indexed assignment must not write. */
    public static final Set<String> RESERVED_PROPERTIES = Set.of("__proto__", "constructor", "prototype");

    /** Methods without arguments that are renamed and invoked with parentheses. */
    static final Map<String, String> RENAMED_CALLS = Map.of(
            "upcase", "toUpperCase",
            "downcase", "toLowerCase",
            "strip", "trim");

    public FunctionsStage() {
        super(NAME);
        this.register(Tag.SEND, this::onSend);
        this.register(Tag.CSEND, this::onCsend);
    }

    static Node send(@Nullable Node target, String method, List<Object> args) {
        List<Object> children = new ArrayList<>();
        children.add(target);
        children.add(method);
        children.addAll(args);
        return Nodes.s(Tag.SEND, children);
    }

    /** Rewrite and process the result again. */
    Node replace(Node node, Node replacement) {
        return this.process(this.rewrite(node, replacement));
    }

    Node onCsend(Node node, Next next) {
        if (!this.context().esAtLeast(EsLevel.ES2020))
            throw new UnsupportedFeatureException("Safe navigation operator",
                    EsLevel.ES2020, this.context().esLevel(), node);
        String method = Nodes.method(node);
        if (method.equals("empty?") && node.size() == 2 && !this.excluded(method)) {
            Node length = Nodes.s(Tag.CSEND, Nodes.receiver(node), "length");
            return this.replace(node, Nodes.send(length, "==", Nodes.integer(0)));
        }
        // Rewrite as a send, then restore the safe navigation.
        Node asSend = node.updated(Tag.SEND, node.children());
        this.context().comments.move(node, asSend);
        Node result = this.rewriteCall(asSend);
        if (result == null) {
            this.context().comments.move(asSend, node);
            return next.apply(node);
        }
        if (result.is(Tag.SEND))
            return this.restoreKind(result, Tag.CSEND);
        if (result.is(Tag.CALL))
            return this.restoreKind(result, Tag.CCALL);
        return result;
    }

    Node restoreKind(Node node, Tag kind) {
        Node result = node.updated(kind, node.children());
        this.context().comments.move(node, result);
        return result;
    }

    Node onSend(Node node, Next next) {
        Node result = this.rewriteCall(node);
        if (result == null)
            return next.apply(node);
        return result;
    }

    /** Check indexed assignments: {@code target[name] = value}. */
    static void checkIndexedAssignment(Node node, List<Object> args) {
        if (args.size() != 2 || !(args.get(0) instanceof Node index))
            return;
        if (!index.is(Tag.STR) && !index.is(Tag.SYM))
            return;
        String property = index.nonNullString(0);
        if (RESERVED_PROPERTIES.contains(property))
            throw new CompilationError("Assignment to reserved property " + property, node);
    }

    /** The rewritten call, already processed, or null if no rule applies. */
    @Nullable
    Node rewriteCall(Node node) {
        Node target = Nodes.receiver(node);
        String method = Nodes.method(node);
        List<Object> args = Nodes.arguments(node);
        if (method.equals("[]="))
            checkIndexedAssignment(node, args);
        if (this.excluded(method))
            return null;

        if (target == null) {
            if (method.equals("puts"))
                return this.replace(node, send(Nodes.attr("console"), "log", args));
            return null;
        }

        int argCount = args.size();
        switch (method) {
            case "each":
                return this.replace(node, send(target, "forEach", args));
            case "to_s":
                if (argCount <= 1)
                    return this.replace(node, Nodes.s(Tag.CALL, prepend(target, "toString", args)));
                break;
            case "to_i":
                return this.replace(node, send(null, "parseInt", prepend(target, args)));
            case "to_f":
                return this.replace(node, send(null, "parseFloat", prepend(target, args)));
            case "to_json":
                return this.replace(node, send(Nodes.constant("JSON"), "stringify", prepend(target, args)));
            case "include?":
                if (argCount == 1)
                    return this.replace(node, send(Nodes.unwrap(target), "includes", args));
                break;
            case "start_with?":
                if (argCount == 1)
                    return this.replace(node, send(target, "startsWith", args));
                break;
            case "end_with?":
                if (argCount == 1)
                    return this.replace(node, send(target, "endsWith", args));
                break;
            case "empty?":
                if (argCount == 0)
                    return this.replace(node, Nodes.send(
                            Nodes.s(Tag.ATTR, target, "length"), "==", Nodes.integer(0)));
                break;
            case "nil?":
                if (argCount == 0)
                    return this.replace(node, Nodes.send(target, "==", Nodes.nil()));
                break;
            case "any?":
                if (argCount == 0)
                    return this.replace(node, Nodes.send(target, "some", Nodes.constant("Boolean")));
                break;
            case "join":
                if (argCount == 0)
                    return this.replace(node, Nodes.send(target, "join", Nodes.str("")));
                break;
            case "freeze":
                if (argCount == 0)
                    return this.rewrite(node, this.process(target));
                break;
            default: {
                String renamed = RENAMED_CALLS.get(method);
                if (renamed != null && argCount == 0)
                    return this.replace(node, Nodes.s(Tag.SEND_BANG, target, renamed));
                break;
            }
        }
        return null;
    }

    static List<Object> prepend(Node target, String method, List<Object> args) {
        List<Object> result = new ArrayList<>();
        result.add(target);
        result.add(method);
        result.addAll(args);
        return result;
    }

    static List<Object> prepend(Node first, List<Object> rest) {
        List<Object> result = new ArrayList<>();
        result.add(first);
        result.addAll(rest);
        return result;
    }
}
