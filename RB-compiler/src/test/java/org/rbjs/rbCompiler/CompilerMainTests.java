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

package org.rbjs.rbCompiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Assert;
import org.junit.Test;
import org.rbjs.rbCompiler.compiler.errors.CompilerMessages;
import org.rbjs.util.Utilities;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

public class CompilerMainTests {
    static final String TEMPLATE = """
            {"ast": {"type": "begin", "children": [
              {"type": "lvasgn", "children": ["_erbout", {"type": "str", "children": [""]}]},
              {"type": "send", "children": [{"type": "lvar", "children": ["_erbout"]}, "<<",
                {"type": "send", "children": [{"type": "str", "children": ["Hello "]}, "freeze"]}]},
              {"type": "send", "children": [{"type": "lvar", "children": ["_erbout"]}, "<<",
                {"type": "send", "children": [
                  {"type": "begin", "children": [{"type": "ivar", "children": ["@user_name"]}]}, "to_s"]}]},
              {"type": "lvar", "children": ["_erbout"]}]},
             "comments": []}""";

    static Path writeInput(String contents) throws IOException {
        File file = File.createTempFile("input", ".json", new File("."));
        file.deleteOnExit();
        Utilities.writeFile(file.toPath(), contents);
        return file.toPath();
    }

    static Path outputFile() throws IOException {
        File file = File.createTempFile("output", ".json", new File("."));
        file.deleteOnExit();
        return file.toPath();
    }

    @Test
    public void endToEnd() throws IOException {
        Path input = writeInput(TEMPLATE);
        Path output = outputFile();
        CompilerMessages messages = CompilerMain.execute(
                "-f", "erb,coalesce", "-o", output.toString(), input.toString());
        Assert.assertEquals(messages.toString(), 0, messages.exitCode);

        JsonNode json = new ObjectMapper().readTree(Utilities.readFile(output));
        JsonNode render = json.get("ast");
        Assert.assertEquals("def", render.get("type").asText());
        Assert.assertEquals("render", render.get("children").get(0).asText());
        JsonNode parameter = render.get("children").get(1)
                .get("children").get(0)
                .get("children").get(0);
        Assert.assertEquals("kwarg", parameter.get("type").asText());
        Assert.assertEquals("user_name", parameter.get("children").get(0).asText());
        Assert.assertEquals(0, json.get("hoisted").size());
    }

    @Test
    public void unknownFilter() throws IOException {
        Path input = writeInput(TEMPLATE);
        CompilerMessages messages = CompilerMain.execute("-f", "jquery", input.toString());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals("Invalid options", messages.getError(0).errorType);
    }

    @Test
    public void missingInput() {
        CompilerMessages messages = CompilerMain.execute("does-not-exist.json");
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals("Error reading file", messages.getError(0).errorType);
    }

    @Test
    public void malformedInput() throws IOException {
        Path input = writeInput("{\"ast\": ");
        CompilerMessages messages = CompilerMain.execute(input.toString());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals("Malformed input", messages.getError(0).errorType);
    }

    @Test
    public void badOptions() {
        Assert.assertEquals(1, CompilerMain.execute("--no-such-option").exitCode);
        Assert.assertEquals(1, CompilerMain.execute("-TDispatcher=high").exitCode);
        Assert.assertEquals(1, CompilerMain.execute("-TNoSuchClass=1").exitCode);
        Assert.assertEquals(1, CompilerMain.execute("--es", "2001").exitCode);
    }
}
