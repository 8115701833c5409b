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

package org.rbjs.rbCompiler.compiler.context;

import org.rbjs.rbCompiler.ir.Node;
import org.rbjs.rbCompiler.ir.Tag;
import org.rbjs.util.IWritesLogs;
import org.rbjs.util.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Statements that must be emitted before the rewritten program, such as
 * imports of runtime modules.  Registration is idempotent under structural
 * equality: two call sites requiring the same import produce a single entry.
 */
public class HoistedDeclarations implements IWritesLogs {
    private final Set<Node> declarations = new LinkedHashSet<>();

    /** Register a declaration.
     * @return true if the declaration was not already present. */
    public boolean add(Node declaration) {
        boolean added = this.declarations.add(declaration);
        Logger.INSTANCE.belowLevel(this, 2)
                .append(added ? "Hoisted " : "Already hoisted ")
                .appendSupplier(declaration::toString)
                .newline();
        return added;
    }

    public boolean contains(Node declaration) {
        return this.declarations.contains(declaration);
    }

    public int size() {
        return this.declarations.size();
    }

    public boolean isEmpty() {
        return this.declarations.isEmpty();
    }

    static boolean isImport(Node node) {
        return node.kind.isA(Tag.IMPORT);
    }

    /** Import declarations, in registration order. */
    public List<Node> imports() {
        List<Node> result = new ArrayList<>();
        for (Node node: this.declarations)
            if (isImport(node))
                result.add(node);
        return result;
    }

    /** Declarations that are not imports, in registration order. */
    public List<Node> setup() {
        List<Node> result = new ArrayList<>();
        for (Node node: this.declarations)
            if (!isImport(node))
                result.add(node);
        return result;
    }

    /** All declarations in emission order: imports first, then setup statements. */
    public List<Node> all() {
        List<Node> result = this.imports();
        result.addAll(this.setup());
        return result;
    }

    @Override
    public String toString() {
        return "HoistedDeclarations" + this.all();
    }
}
