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

package org.rbjs.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.rbjs.rbCompiler.compiler.errors.InternalCompilerError;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public class Utilities {
    private Utilities() {}

    public static String getCurrentStackTrace() {
        StackTraceElement[] stackTrace = Thread.currentThread().getStackTrace();
        StringBuilder stackTraceBuilder = new StringBuilder();
        for (int i = 3; i < stackTrace.length; i++) {
            stackTraceBuilder.append(stackTrace[i].toString()).append("\n");
        }
        return stackTraceBuilder.toString();
    }

    /** A custom version of assert.  We would like to use assert,
     * but it is compiled out in release.
     * @param expression  When this expression is false, this function throws. */
    public static void enforce(boolean expression) {
        if (!expression) {
            throw new InternalCompilerError(
                    "Assertion failed" + System.lineSeparator() + getCurrentStackTrace());
        }
    }

    /** A custom version of assert.  We would like to use assert,
     * but it is compiled out in release.
     * @param expression  When this expression is false, this function throws.
     * @param message     Message for exception when expression is false */
    public static void enforce(boolean expression, String message) {
        if (!expression)
            throw new InternalCompilerError(message + System.lineSeparator() + getCurrentStackTrace());
    }

    /** Escape special characters in a string. */
    public static String escape(String value) {
        StringBuilder builder = new StringBuilder();
        final int length = value.length();
        for (int offset = 0; offset < length; ) {
            final int c = value.codePointAt(offset);
            if (c == '\\')
                builder.append("\\\\");
            else if (c == '\"' )
                builder.append("\\\"");
            else if (c == '\r' )
                builder.append("\\r");
            else if (c == '\n' )
                builder.append("\\n");
            else if (c == '\t' )
                builder.append("\\t");
            else if (c < 32) {
                builder.append("\\u");
                builder.append(String.format("%04x", c));
            } else
                builder.appendCodePoint(c);
            offset += Character.charCount(c);
        }
        return builder.toString();
    }

    public static ObjectMapper deterministicObjectMapper() {
        return JsonMapper
                .builder()
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY, true)
                .build();
    }

    /** Add double quotes around string and escape symbols that need it. */
    public static String doubleQuote(String value) {
        return "\"" + escape(value) + "\"";
    }

    /** Just adds single quotes around a string.  No escaping is performed. */
    public static String singleQuote(@Nullable String other) {
        return "'" + other + "'";
    }

    /**
     * put something in a hashmap that is supposed to be new.
     * @param map    Map to insert in.
     * @param key    Key to insert in map.
     * @param value  Value to insert in map.
     * @return       The inserted value.
     */
    @SuppressWarnings("UnusedReturnValue")
    public static <K, V, VE extends V> VE putNew(Map<K, V> map, K key, VE value) {
        V previous = map.put(key, value);
        enforce(previous == null, "Key " + key + " already mapped to " + previous + " when adding " + value);
        return value;
    }

    public static String readFile(Path filename) throws IOException {
        return Files.readString(filename, StandardCharsets.UTF_8);
    }

    public static void writeFile(Path filename, String contents) throws IOException {
        Files.writeString(filename, contents, StandardCharsets.UTF_8);
    }

    public static <T> T removeLast(List<T> data) {
        enforce(!data.isEmpty(), "Removing from empty list");
        return data.remove(data.size() - 1);
    }

    public static <T> T last(List<T> data) {
        enforce(!data.isEmpty(), "Extracting last element from empty list");
        return data.get(data.size() - 1);
    }

    public static JsonNode getProperty(JsonNode node, String property) {
        JsonNode prop = node.get(property);
        if (prop == null)
            throw new InternalCompilerError("Node does not have property " + Utilities.singleQuote(property) +
                    " " + Utilities.toDepth(node, 1));
        return prop;
    }

    public static int getIntProperty(JsonNode node, String property) {
        return Utilities.getProperty(node, property).asInt();
    }

    /** Render a JSON node as a string, replacing everything nested deeper
     * than the specified depth with an ellipsis; used in error messages. */
    public static String toDepth(JsonNode node, int depth) {
        if (depth <= 0)
            return "...";
        if (node.isObject()) {
            StringBuilder builder = new StringBuilder("{");
            boolean first = true;
            for (var it = node.fields(); it.hasNext(); ) {
                var field = it.next();
                if (!first)
                    builder.append(", ");
                first = false;
                builder.append(field.getKey())
                        .append(": ")
                        .append(toDepth(field.getValue(), depth - 1));
            }
            return builder.append("}").toString();
        } else if (node.isArray()) {
            return "[" + (node.isEmpty() ? "" : "...") + "]";
        }
        return node.toString();
    }
}
