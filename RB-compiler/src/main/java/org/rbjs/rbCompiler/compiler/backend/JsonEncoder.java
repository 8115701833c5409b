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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.rbjs.rbCompiler.compiler.CompileResult;
import org.rbjs.rbCompiler.compiler.context.CommentTable;
import org.rbjs.rbCompiler.compiler.errors.InternalCompilerError;
import org.rbjs.rbCompiler.ir.Node;
import org.rbjs.util.Utilities;

import java.util.List;
import java.util.Map;

/** Writes a compiled tree in the format read by {@link JsonDecoder},
 * with an additional "hoisted" array listing the hoisted declarations. */
public class JsonEncoder {
    final ObjectMapper mapper;

    public JsonEncoder() {
        this.mapper = Utilities.deterministicObjectMapper();
    }

    public ObjectNode encode(CompileResult result) {
        ObjectNode root = this.mapper.createObjectNode();
        root.set("ast", this.encodeNode(result.program()));
        root.set("comments", this.encodeComments(result.comments()));
        ArrayNode hoisted = root.putArray("hoisted");
        for (Node node: result.hoisted())
            hoisted.add(this.encodeNode(node));
        return root;
    }

    public String toJsonString(CompileResult result) {
        return this.encode(result).toPrettyString();
    }

    public ObjectNode encodeNode(Node node) {
        ObjectNode result = this.mapper.createObjectNode();
        result.put("type", node.kind.name);
        ArrayNode children = result.putArray("children");
        for (Object child: node.children())
            this.encodeChild(child, children);
        if (node.getPositionRange().isValid())
            node.getPositionRange().appendAsJson(result.putObject("loc"));
        return result;
    }

    void encodeChild(Object child, ArrayNode array) {
        if (child == null) {
            array.addNull();
        } else if (child instanceof Node node) {
            array.add(this.encodeNode(node));
        } else if (child instanceof String string) {
            array.add(string);
        } else if (child instanceof Long value) {
            array.add(value);
        } else if (child instanceof Double value) {
            array.add(value);
        } else if (child instanceof Boolean value) {
            array.add(value);
        } else {
            throw new InternalCompilerError("Unexpected child " + child + " of type " + child.getClass());
        }
    }

    public ArrayNode encodeComments(CommentTable comments) {
        ArrayNode result = this.mapper.createArrayNode();
        for (Map.Entry<CommentTable.Key, List<String>> entry: comments.entries()) {
            CommentTable.Key key = entry.getKey();
            for (String text: entry.getValue()) {
                ObjectNode comment = result.addObject();
                key.range().appendAsJson(comment.putObject("loc"));
                comment.put("type", key.kind().name);
                comment.put("text", text);
            }
        }
        return result;
    }

    public JsonNode encodeProgram(Node program) {
        return this.encodeNode(program);
    }
}
