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
import com.fasterxml.jackson.databind.ObjectMapper;
import org.rbjs.rbCompiler.compiler.context.CommentTable;
import org.rbjs.rbCompiler.compiler.errors.CompilationError;
import org.rbjs.rbCompiler.compiler.errors.SourcePositionRange;
import org.rbjs.rbCompiler.ir.Node;
import org.rbjs.rbCompiler.ir.Tag;
import org.rbjs.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a tree produced by the parser.  The input has the form
 * <pre>
 * {"ast": NODE, "comments": [{"loc": LOC, "type": TAG, "text": STRING}, ...]}
 * NODE = {"type": TAG, "children": [NODE | STRING | NUMBER | BOOLEAN | null, ...], "loc": LOC}
 * LOC  = {"start_line": N, "start_column": N, "end_line": N, "end_column": N}
 * </pre>
 * "loc" is optional for nodes.  A comment belongs to the node with the same
 * location and type.
 */
public class JsonDecoder {
    public record Input(Node ast, CommentTable comments) {}

    final ObjectMapper mapper;

    public JsonDecoder() {
        this.mapper = Utilities.deterministicObjectMapper();
    }

    static JsonNode required(JsonNode node, String property) {
        JsonNode result = node.get(property);
        if (result == null || result.isNull())
            throw new CompilationError("Malformed tree: missing property " +
                    Utilities.singleQuote(property) + " in " + Utilities.toDepth(node, 1));
        return result;
    }

    public Input decode(String json) throws JsonProcessingException {
        JsonNode root = this.mapper.readTree(json);
        if (root == null || !root.isObject())
            throw new CompilationError("Malformed tree: expected an object");
        Node ast = this.decodeNode(required(root, "ast"));
        CommentTable comments = new CommentTable();
        JsonNode list = root.get("comments");
        if (list != null && !list.isNull()) {
            if (!list.isArray())
                throw new CompilationError("Malformed tree: 'comments' is not an array");
            for (JsonNode comment: list) {
                SourcePositionRange range = this.decodePosition(required(comment, "loc"));
                Tag kind = Tag.of(required(comment, "type").asText());
                comments.add(new CommentTable.Key(range, kind), required(comment, "text").asText());
            }
        }
        return new Input(ast, comments);
    }

    SourcePositionRange decodePosition(JsonNode loc) {
        for (String field: List.of("start_line", "start_column", "end_line", "end_column")) {
            if (!required(loc, field).isInt())
                throw new CompilationError("Malformed tree: " + field + " is not an integer");
        }
        return SourcePositionRange.fromJson(loc);
    }

    public Node decodeNode(JsonNode node) {
        if (!node.isObject())
            throw new CompilationError("Malformed tree: expected a node, got " + Utilities.toDepth(node, 1));
        Tag kind = Tag.of(required(node, "type").asText());
        JsonNode children = node.get("children");
        List<Object> decoded = new ArrayList<>();
        if (children != null && !children.isNull()) {
            if (!children.isArray())
                throw new CompilationError("Malformed tree: children of " + kind + " is not an array");
            for (JsonNode child: children)
                decoded.add(this.decodeChild(child));
        }
        JsonNode loc = node.get("loc");
        SourcePositionRange range = loc == null || loc.isNull() ?
                SourcePositionRange.INVALID : this.decodePosition(loc);
        return new Node(kind, decoded, range);
    }

    @Nullable
    Object decodeChild(JsonNode child) {
        if (child.isNull())
            return null;
        if (child.isObject())
            return this.decodeNode(child);
        if (child.isTextual())
            return child.asText();
        if (child.isBoolean())
            return child.asBoolean();
        if (child.isIntegralNumber()) {
            if (!child.canConvertToLong())
                throw new CompilationError("Malformed tree: integer out of range " + child.asText());
            return child.asLong();
        }
        if (child.isNumber())
            return child.asDouble();
        throw new CompilationError("Malformed tree: unexpected child " + Utilities.toDepth(child, 1));
    }
}
