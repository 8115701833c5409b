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

import org.rbjs.rbCompiler.compiler.errors.InternalCompilerError;
import org.rbjs.rbCompiler.compiler.visitors.NodeVisitor;
import org.rbjs.rbCompiler.compiler.visitors.VisitDecision;
import org.rbjs.rbCompiler.ir.Node;
import org.rbjs.rbCompiler.ir.Tag;
import org.rbjs.util.Logger;
import org.rbjs.util.Utilities;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Computes the free variables of a template body: the names that are read
 * but not bound inside the body.
 *
 * <p>A name is bound for the whole body when it is assigned anywhere in the
 * body, when it names a method defined in the body, or when it is imported.
 * Parameters of blocks and nested methods are bound only inside them.
 * Calls without receiver and arguments whose name looks like a local
 * variable are reads, except for well-known view helpers.
 */
public class ScopeInference extends NodeVisitor {
    static final Pattern LOCAL_NAME = Pattern.compile("[a-z_][a-z0-9_]*");
    /** Helpers that are never template parameters. */
    public static final Set<String> HELPERS = Set.of(
            "render", "link_to", "form_with", "form_for", "form_tag",
            "pluralize", "truncate", "content_for", "notice", "raw",
            "String", "Array", "Hash", "Integer", "Float");

    /** Names that are not free: buffers and imported names. */
    final Set<String> excluded;
    /** Names bound for the whole body. */
    final Set<String> bound;
    /** Names bound by the enclosing blocks. */
    final List<Set<String>> scopes;
    final Set<String> free;

    public ScopeInference(Collection<String> excluded) {
        this.excluded = new HashSet<>(excluded);
        this.bound = new HashSet<>();
        this.scopes = new ArrayList<>();
        this.free = new TreeSet<>();
    }

    /** The free variables of a body, sorted by name. */
    public static List<String> freeVariables(Node body, Collection<String> excluded) {
        ScopeInference inference = new ScopeInference(excluded);
        inference.apply(body);
        return inference.getFree();
    }

    /** Names of the instance variables used in a tree, without the leading @, sorted. */
    public static List<String> instanceVariables(Node tree) {
        Set<String> result = new TreeSet<>();
        NodeVisitor collector = new NodeVisitor() {
            @Override
            public void postorder(Node node) {
                if (node.is(Tag.IVAR))
                    result.add(stripSigil(node.nonNullString(0)));
            }
        };
        collector.apply(tree);
        return new ArrayList<>(result);
    }

    public static String stripSigil(String name) {
        return name.startsWith("@") ? name.substring(1) : name;
    }

    /** Names bound by an import declaration. */
    public static List<String> importedNames(Node declaration) {
        List<String> result = new ArrayList<>();
        for (Object child: declaration.children())
            collectImported(child, result);
        return result;
    }

    static void collectImported(Object child, List<String> result) {
        if (!(child instanceof Node node))
            return;
        if (node.is(Tag.ATTR) || node.is(Tag.CONST)) {
            String name = node.string(1);
            if (name != null)
                result.add(name);
        } else {
            for (Object c: node.children())
                collectImported(c, result);
        }
    }

    /** Names of the parameters in an argument list. */
    static List<String> parameterNames(Object args) {
        List<String> result = new ArrayList<>();
        if (!(args instanceof Node node))
            return result;
        for (Object child: node.children()) {
            if (child instanceof String name)
                result.add(name);
            else if (child instanceof Node n)
                result.addAll(parameterNames(n));
        }
        return result;
    }

    public List<String> getFree() {
        return new ArrayList<>(this.free);
    }

    @Override
    public void apply(Node tree) {
        this.collectBindings(tree);
        super.apply(tree);
        if (!this.scopes.isEmpty())
            throw new InternalCompilerError("Corrupted scope stack after inference", tree);
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Free variables ")
                .join(", ", this.free)
                .newline();
    }

    /** Collect the names bound for the whole body. */
    void collectBindings(Node tree) {
        NodeVisitor collector = new NodeVisitor() {
            @Override
            public void postorder(Node node) {
                if (node.is(Tag.LVASGN)) {
                    ScopeInference.this.bound.add(node.nonNullString(0));
                } else if (node.kind.isA(Tag.DEF)) {
                    String name = node.string(0);
                    if (name != null)
                        ScopeInference.this.bound.add(name);
                } else if (node.kind.isA(Tag.IMPORT)) {
                    ScopeInference.this.bound.addAll(importedNames(node));
                }
            }
        };
        collector.apply(tree);
    }

    void push(Set<String> scope) {
        this.scopes.add(scope);
    }

    void pop(Set<String> scope) {
        Set<String> last = Utilities.removeLast(this.scopes);
        if (last != scope)
            throw new InternalCompilerError("Corrupted scope stack: popping " + scope + " instead of " + last);
    }

    boolean isBound(String name) {
        if (this.excluded.contains(name) || this.bound.contains(name))
            return true;
        for (Set<String> scope: this.scopes)
            if (scope.contains(name))
                return true;
        return false;
    }

    static boolean looksLikeLocal(Node send) {
        if (!send.is(Tag.SEND) || send.size() != 2 || send.child(0) != null)
            return false;
        String name = send.string(1);
        if (name == null)
            return false;
        return LOCAL_NAME.matcher(name).matches() &&
                !HELPERS.contains(name) &&
                !name.endsWith("_path");
    }

    void read(String name) {
        if (!this.isBound(name))
            this.free.add(name);
    }

    /** Visit the parameters and the body of a block or nested method in a new scope. */
    void visitScope(Object args, List<Object> body) {
        Set<String> scope = new HashSet<>(parameterNames(args));
        this.push(scope);
        try {
            for (Object child: body)
                this.traverse(child);
        } finally {
            this.pop(scope);
        }
    }

    @Override
    public VisitDecision preorder(Node node) {
        if (node.is(Tag.LVAR)) {
            this.read(node.nonNullString(0));
            return VisitDecision.STOP;
        }
        if (looksLikeLocal(node)) {
            this.read(node.nonNullString(1));
            return VisitDecision.STOP;
        }
        if (node.is(Tag.BLOCK) && node.size() == 3) {
            this.traverse(node.child(0));
            this.visitScope(node.child(1), node.children().subList(2, 3));
            return VisitDecision.STOP;
        }
        if (node.kind.isA(Tag.DEF) && node.size() >= 2) {
            this.visitScope(node.child(1), node.children().subList(2, node.size()));
            return VisitDecision.STOP;
        }
        if (node.kind.isA(Tag.DEFS) && node.size() >= 3) {
            this.traverse(node.child(0));
            this.visitScope(node.child(2), node.children().subList(3, node.size()));
            return VisitDecision.STOP;
        }
        if (node.kind.isA(Tag.IMPORT))
            return VisitDecision.STOP;
        return VisitDecision.CONTINUE;
    }
}
