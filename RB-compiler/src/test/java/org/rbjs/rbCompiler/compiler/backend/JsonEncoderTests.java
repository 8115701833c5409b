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

package org.rbjs.rbCompiler.compiler.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.Assert;
import org.junit.Test;
import org.rbjs.rbCompiler.compiler.CompileResult;
import org.rbjs.rbCompiler.compiler.context.CommentTable;
import org.rbjs.rbCompiler.compiler.errors.SourcePositionRange;
import org.rbjs.rbCompiler.ir.Node;
import org.rbjs.rbCompiler.ir.Nodes;
import org.rbjs.rbCompiler.ir.Tag;

import java.util.List;

public class JsonEncoderTests {
    @Test
    public void encode() {
        SourcePositionRange position = new SourcePositionRange(2, 1, 2, 15);
        Node fs = Nodes.importDefault("fs", "fs");
        Node call = Nodes.send(Nodes.attr("fs"), "existsSync", Nodes.str("a"), Nodes.integer(3),
                Nodes.s(Tag.FLOAT, 0.5), Nodes.s(Tag.of("flag"), false)).withPosition(position);
        CommentTable comments = new CommentTable();
        comments.add(call, "# check");
        CompileResult result = new CompileResult(Nodes.begin(fs, call), comments, List.of(fs));

        JsonNode json = new JsonEncoder().encode(result);
        JsonNode ast = json.get("ast");
        Assert.assertEquals("begin", ast.get("type").asText());
        Assert.assertFalse(ast.has("loc"));
        JsonNode encodedCall = ast.get("children").get(1);
        Assert.assertEquals(2, encodedCall.get("loc").get("start_line").asInt());
        JsonNode children = encodedCall.get("children");
        Assert.assertTrue(children.get(0).isObject());
        Assert.assertEquals("existsSync", children.get(1).asText());
        Assert.assertEquals(3, children.get(3).get("children").get(0).asLong());
        Assert.assertEquals(0.5, children.get(4).get("children").get(0).asDouble(), 0);
        Assert.assertTrue(children.get(5).get("children").get(0).isBoolean());
        Assert.assertTrue(fsChildren(json).get(1).get("children").get(0).isNull());

        JsonNode comment = json.get("comments").get(0);
        Assert.assertEquals("send", comment.get("type").asText());
        Assert.assertEquals("# check", comment.get("text").asText());
        Assert.assertEquals(1, json.get("hoisted").size());
        Assert.assertEquals("import", json.get("hoisted").get(0).get("type").asText());
    }

    static JsonNode fsChildren(JsonNode json) {
        return json.get("hoisted").get(0).get("children");
    }

    @Test
    public void decodesItsOutput() throws JsonProcessingException {
        Node program = Nodes.begin(Nodes.lvasgn("x", Nodes.integer(1)),
                Nodes.send(null, "puts", Nodes.lvar("x")).withPosition(new SourcePositionRange(3, 1, 3, 7)));
        CommentTable comments = new CommentTable();
        comments.add(program.nonNull(1), "# print");
        String text = new JsonEncoder().toJsonString(new CompileResult(program, comments, List.of()));
        JsonDecoder.Input input = new JsonDecoder().decode(text);
        Assert.assertEquals(program, input.ast());
        Assert.assertEquals(List.of("# print"), input.comments().get(input.ast().nonNull(1)));
    }
}
