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

import org.rbjs.rbCompiler.compiler.visitors.Next;
import org.rbjs.rbCompiler.compiler.visitors.Stage;
import org.rbjs.rbCompiler.ir.Node;
import org.rbjs.rbCompiler.ir.Tag;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Renames snake_case identifiers to camelCase.  Every node is renamed after
 * the rest of the pipeline has processed it, so library methods such as
 * {@code each_pair} are mapped by other stages first.
 */
public class CamelCaseStage extends Stage {
    public static final String NAME = "camelCase";

    static final Set<String> ALLOWLIST = Set.of(
            "attr_accessor", "attr_reader", "attr_writer", "method_missing",
            "is_a?", "kind_of?", "instance_of?");

    static final Map<String, String> CAPS_EXCEPTIONS = Map.of(
            "innerHtml", "innerHTML",
            "innerHtml=", "innerHTML=",
            "outerHtml", "outerHTML",
            "outerHtml=", "outerHTML=",
            "encodeUri", "encodeURI",
            "encodeUriComponent", "encodeURIComponent",
            "decodeUri", "decodeURI",
            "decodeUriComponent", "decodeURIComponent");

    static final Pattern UNDERSCORE = Pattern.compile("(?!^)_([a-z0-9])");
    static final Pattern SEND_CANDIDATE = Pattern.compile("_.*\\w[=!?]?$");
    static final Pattern NAME_CANDIDATE = Pattern.compile("_.*[?!\\w]$");

    /** Kinds whose first child is a name. */
    static final List<Tag> NAMED = List.of(
            Tag.DEF, Tag.OPTARG, Tag.KWOPTARG, Tag.LVAR, Tag.IVAR, Tag.CVAR,
            Tag.ARG, Tag.KWARG, Tag.LVASGN, Tag.IVASGN, Tag.CVASGN, Tag.SYM);

    public CamelCaseStage() {
        super(NAME);
        this.register(Tag.SEND, this::onSend);
        this.register(Tag.DEFS, this::onDefs);
        for (Tag tag: NAMED)
            this.register(tag, this::onNamed);
    }

    public static String camelCase(String name) {
        if (ALLOWLIST.contains(name))
            return name;
        String result = UNDERSCORE.matcher(name).replaceAll(m -> m.group(1).toUpperCase());
        return CAPS_EXCEPTIONS.getOrDefault(result, result);
    }

    static Node renameChild(Node node, int index) {
        List<Object> children = new ArrayList<>(node.children());
        children.set(index, camelCase(node.nonNullString(index)));
        return node.withChildren(children);
    }

    Node onSend(Node node, Next next) {
        Node result = next.apply(node);
        if (!result.is(Tag.SEND) && !result.is(Tag.CSEND) && !result.is(Tag.ATTR))
            return result;
        if (result.size() < 2 || !(result.child(1) instanceof String method))
            return result;
        Node target = result.node(0);
        if (target == null && ALLOWLIST.contains(method))
            return result;
        if (target != null && (target.is(Tag.IVAR) || target.is(Tag.CVAR)) &&
                target.child(0) instanceof String variable) {
            List<Object> children = new ArrayList<>(result.children());
            children.set(0, target.withChildren(List.of(camelCase(variable))));
            children.set(1, camelCase(method));
            return this.rewrite(result, result.withChildren(children));
        }
        if (SEND_CANDIDATE.matcher(method).find())
            return this.rewrite(result, renameChild(result, 1));
        return result;
    }

    Node onNamed(Node node, Next next) {
        Node result = next.apply(node);
        if (!NAMED.contains(result.kind) || result.size() == 0 || !(result.child(0) instanceof String name))
            return result;
        if (NAME_CANDIDATE.matcher(name).find() && !ALLOWLIST.contains(name))
            return this.rewrite(result, renameChild(result, 0));
        return result;
    }

    Node onDefs(Node node, Next next) {
        Node result = next.apply(node);
        if (!result.is(Tag.DEFS) || result.size() < 2 || !(result.child(1) instanceof String name))
            return result;
        if (NAME_CANDIDATE.matcher(name).find())
            return this.rewrite(result, renameChild(result, 1));
        return result;
    }
}
