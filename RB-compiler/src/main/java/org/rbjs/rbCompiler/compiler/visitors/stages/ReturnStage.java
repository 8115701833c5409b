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
import org.rbjs.rbCompiler.ir.Nodes;
import org.rbjs.rbCompiler.ir.Tag;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Makes the last expression of every method body its return value. */
public class ReturnStage extends Stage {
    public static final String NAME = "return";

    /** Methods that never return a value. */
    static final Set<String> CONSTRUCTORS = Set.of("constructor", "initialize");

    public ReturnStage() {
        super(NAME);
        this.register(Tag.DEF, this::onDef);
        this.register(Tag.DEFS, this::onDefs);
    }

    /** Wrap the children starting at {@code bodyIndex} into an autoreturn. */
    Node wrapBody(Node def, int bodyIndex) {
        if (def.size() <= bodyIndex)
            return def;
        List<Object> body = new ArrayList<>(def.children().subList(bodyIndex, def.size()));
        if (body.size() == 1 && body.get(0) instanceof Node only && only.kind.isA(Tag.RETURN))
            return def;
        if (body.get(body.size() - 1) == null)
            body.set(body.size() - 1, Nodes.nil());
        List<Object> children = new ArrayList<>(def.children().subList(0, bodyIndex));
        children.add(Nodes.s(Tag.AUTORETURN, body));
        return this.rewrite(def, def.withChildren(children));
    }

    Node onDef(Node node, Next next) {
        Node result = next.apply(node);
        if (!result.kind.isA(Tag.DEF))
            return result;
        if (result.child(0) instanceof String name && CONSTRUCTORS.contains(name))
            return result;
        return this.wrapBody(result, 2);
    }

    Node onDefs(Node node, Next next) {
        Node result = next.apply(node);
        if (!result.is(Tag.DEFS))
            return result;
        return this.wrapBody(result, 3);
    }
}
