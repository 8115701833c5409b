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

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/** Lowers file system, process and command-line access to the Node.js runtime. */
public class NodeStage extends Stage {
    public static final String NAME = "node";

    public static final Node IMPORT_FS = Nodes.importDefault("fs", "fs");
    public static final Node IMPORT_CHILD_PROCESS = Nodes.importDefault("child_process", "child_process");
    /** {@code ARGV = process.argv.slice(2)} */
    public static final Node SETUP_ARGV = Nodes.lvasgn("ARGV",
            Nodes.send(Nodes.s(Tag.ATTR, Nodes.attr("process"), "argv"), "slice", Nodes.integer(2)));

    public NodeStage() {
        super(NAME);
        this.register(Tag.SEND, this::onSend);
        this.register(Tag.CONST, this::onConst);
    }

    List<Object> processAll(List<Object> nodes) {
        List<Object> result = new ArrayList<>(nodes.size());
        for (Object node: nodes)
            result.add(this.processChild(node));
        return result;
    }

    static Node call(Node target, String method, List<Object> args) {
        List<Object> children = new ArrayList<>();
        children.add(target);
        children.add(method);
        children.addAll(args);
        return Nodes.s(Tag.SEND, children);
    }

    static Node stdioInherit() {
        return Nodes.s(Tag.HASH, Nodes.s(Tag.PAIR, Nodes.sym("stdio"), Nodes.str("inherit")));
    }

    /** True for a reference to a top-level constant with the specified name. */
    static boolean isConstant(@Nullable Node node, String name) {
        return node != null && node.is(Tag.CONST) && node.size() == 2 &&
                node.child(0) == null && name.equals(node.child(1));
    }

    Node onConst(Node node, Next next) {
        if (isConstant(node, "ARGV"))
            this.hoist(SETUP_ARGV);
        return next.apply(node);
    }

    Node onSend(Node node, Next next) {
        if (!node.is(Tag.SEND))
            return next.apply(node);
        Node target = Nodes.receiver(node);
        String method = Nodes.method(node);
        List<Object> args = Nodes.arguments(node);
        Node result = null;

        if (target == null) {
            if (method.equals("__dir__") && args.isEmpty()) {
                result = Nodes.attr("__dirname");
            } else if (method.equals("exit") && args.size() <= 1) {
                result = call(Nodes.attr("process"), "exit", this.processAll(args));
            } else if (method.equals("system") && !args.isEmpty()) {
                this.hoist(IMPORT_CHILD_PROCESS);
                List<Object> processed = this.processAll(args);
                List<Object> callArgs = new ArrayList<>();
                callArgs.add(processed.get(0));
                if (args.size() == 1) {
                    callArgs.add(stdioInherit());
                    result = call(Nodes.attr("child_process"), "execSync", callArgs);
                } else {
                    callArgs.add(Nodes.s(Tag.ARRAY, processed.subList(1, processed.size())));
                    callArgs.add(stdioInherit());
                    result = call(Nodes.attr("child_process"), "execFileSync", callArgs);
                }
            }
        } else if (isConstant(target, "File")) {
            if (method.equals("read") && args.size() == 1) {
                this.hoist(IMPORT_FS);
                List<Object> callArgs = this.processAll(args);
                callArgs.add(Nodes.str("utf8"));
                result = call(Nodes.attr("fs"), "readFileSync", callArgs);
            } else if (method.equals("write") && args.size() == 2) {
                this.hoist(IMPORT_FS);
                result = call(Nodes.attr("fs"), "writeFileSync", this.processAll(args));
            } else if ((method.equals("exist?") || method.equals("exists?")) && args.size() == 1) {
                this.hoist(IMPORT_FS);
                result = call(Nodes.attr("fs"), "existsSync", this.processAll(args));
            }
        } else if (isConstant(target, "Dir")) {
            if (method.equals("pwd") && args.isEmpty())
                result = Nodes.send(Nodes.attr("process"), "cwd");
        }

        if (result == null)
            return next.apply(node);
        return this.rewrite(node, result);
    }
}
