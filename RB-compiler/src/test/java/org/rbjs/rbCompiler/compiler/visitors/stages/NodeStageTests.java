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

import org.junit.Assert;
import org.junit.Test;
import org.rbjs.rbCompiler.compiler.BaseRBTests;
import org.rbjs.rbCompiler.compiler.CompileResult;
import org.rbjs.rbCompiler.compiler.CompilerOptions;
import org.rbjs.rbCompiler.ir.Node;
import org.rbjs.rbCompiler.ir.Nodes;
import org.rbjs.rbCompiler.ir.Tag;

import java.util.List;

public class NodeStageTests extends BaseRBTests {
    static final Node FILE = Nodes.constant("File");

    static Node readFileSync(String name) {
        return Nodes.send(Nodes.attr("fs"), "readFileSync", Nodes.str(name), Nodes.str("utf8"));
    }

    @Test
    public void fileRead() {
        CompileResult result = compile(testOptions("node"),
                Nodes.send(FILE, "read", Nodes.str("a.txt")));
        Assert.assertEquals(Nodes.begin(NodeStage.IMPORT_FS, readFileSync("a.txt")), result.program());
        Assert.assertEquals(List.of(NodeStage.IMPORT_FS), result.hoisted());
    }

    @Test
    public void importsAreHoistedOnce() {
        Node program = Nodes.begin(
                Nodes.send(FILE, "read", Nodes.str("a.txt")),
                Nodes.send(FILE, "exist?", Nodes.str("b.txt")),
                Nodes.send(FILE, "write", Nodes.str("c.txt"), Nodes.lvar("data")));
        CompileResult result = compile(testOptions("node"), program);
        Node expected = Nodes.begin(
                NodeStage.IMPORT_FS,
                readFileSync("a.txt"),
                Nodes.send(Nodes.attr("fs"), "existsSync", Nodes.str("b.txt")),
                Nodes.send(Nodes.attr("fs"), "writeFileSync", Nodes.str("c.txt"), Nodes.lvar("data")));
        Assert.assertEquals(expected, result.program());
        Assert.assertEquals(1, result.hoisted().size());
    }

    @Test
    public void argv() {
        Node program = Nodes.begin(Nodes.send(Nodes.constant("ARGV"), "first"),
                Nodes.send(Nodes.constant("ARGV"), "last"));
        CompileResult result = compile(testOptions("node"), program);
        Assert.assertEquals(Nodes.begin(NodeStage.SETUP_ARGV,
                Nodes.send(Nodes.constant("ARGV"), "first"),
                Nodes.send(Nodes.constant("ARGV"), "last")), result.program());
    }

    @Test
    public void disabledAutoimportsKeepSetup() {
        CompilerOptions options = testOptions("node");
        options.languageOptions.disableAutoimports = true;
        Node program = Nodes.begin(Nodes.send(FILE, "read", Nodes.constant("ARGV")));
        CompileResult result = compile(options, program);
        Assert.assertEquals(Nodes.begin(NodeStage.SETUP_ARGV,
                Nodes.send(Nodes.attr("fs"), "readFileSync", Nodes.constant("ARGV"), Nodes.str("utf8"))),
                result.program());
        Assert.assertEquals(List.of(NodeStage.SETUP_ARGV), result.hoisted());
    }

    @Test
    public void processAndSystem() {
        Node stdio = Nodes.s(Tag.HASH, Nodes.s(Tag.PAIR, Nodes.sym("stdio"), Nodes.str("inherit")));
        Node program = Nodes.begin(
                Nodes.send(null, "system", Nodes.str("ls -l")),
                Nodes.send(null, "system", Nodes.str("ls"), Nodes.str("-l")),
                Nodes.send(null, "exit", Nodes.integer(1)),
                Nodes.send(null, "__dir__"),
                Nodes.send(Nodes.constant("Dir"), "pwd"));
        CompileResult result = compile(testOptions("node"), program);
        Node childProcess = Nodes.attr("child_process");
        Node expected = Nodes.begin(
                NodeStage.IMPORT_CHILD_PROCESS,
                Nodes.send(childProcess, "execSync", Nodes.str("ls -l"), stdio),
                Nodes.send(childProcess, "execFileSync", Nodes.str("ls"),
                        Nodes.s(Tag.ARRAY, Nodes.str("-l")), stdio),
                Nodes.send(Nodes.attr("process"), "exit", Nodes.integer(1)),
                Nodes.attr("__dirname"),
                Nodes.send(Nodes.attr("process"), "cwd"));
        Assert.assertEquals(expected, result.program());
    }

    @Test
    public void withFunctions() {
        // Stages see each other's rewrites
        Node program = Nodes.send(null, "puts", Nodes.send(FILE, "read", Nodes.str("a.txt")));
        CompileResult result = compile(testOptions("functions", "node"), program);
        Assert.assertEquals(Nodes.begin(NodeStage.IMPORT_FS,
                Nodes.send(Nodes.attr("console"), "log", readFileSync("a.txt"))), result.program());
    }
}
