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

import org.rbjs.rbCompiler.compiler.errors.SourcePositionRange;
import org.rbjs.rbCompiler.ir.Node;
import org.rbjs.rbCompiler.ir.Tag;
import org.rbjs.util.IWritesLogs;
import org.rbjs.util.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Comments attached to nodes, keyed by the source position and kind of the
 * node that owns them rather than by node identity, since rewrites replace
 * nodes.  A rewrite that replaces a commented node must call {@link #move}.
 */
public class CommentTable implements IWritesLogs {
    /** Identifies the owner of a comment. */
    public record Key(SourcePositionRange range, Tag kind) implements Comparable<Key> {
        public static Key of(Node node) {
            return new Key(node.getPositionRange(), node.kind);
        }

        @Override
        public int compareTo(Key other) {
            int compare = this.range.compareTo(other.range);
            if (compare != 0)
                return compare;
            return this.kind.name.compareTo(other.kind.name);
        }

        @Override
        public String toString() {
            return this.kind + "@" + this.range;
        }
    }

    private final Map<Key, List<String>> comments = new LinkedHashMap<>();

    public void add(Key key, String text) {
        this.comments.computeIfAbsent(key, k -> new ArrayList<>()).add(text);
    }

    public void add(Node node, String text) {
        this.add(Key.of(node), text);
    }

    /** Comments attached to this node; empty if none. */
    public List<String> get(Node node) {
        List<String> result = this.comments.get(Key.of(node));
        if (result == null)
            return Collections.emptyList();
        return Collections.unmodifiableList(result);
    }

    public boolean hasComments(Node node) {
        return this.comments.containsKey(Key.of(node));
    }

    /** Remove the comments attached to this node and return them. */
    public List<String> remove(Node node) {
        List<String> result = this.comments.remove(Key.of(node));
        if (result == null)
            return Collections.emptyList();
        return result;
    }

    /** Re-key the comments of {@code from} to {@code to}.
     * After this call {@code from} has no comments. */
    public void move(Node from, Node to) {
        Key source = Key.of(from);
        Key destination = Key.of(to);
        if (source.equals(destination))
            return;
        List<String> moved = this.comments.remove(source);
        if (moved == null)
            return;
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Moving comments from ")
                .append(source.toString())
                .append(" to ")
                .append(destination.toString())
                .newline();
        this.comments.computeIfAbsent(destination, k -> new ArrayList<>()).addAll(moved);
    }

    /** Number of nodes that have comments. */
    public int size() {
        return this.comments.size();
    }

    public boolean isEmpty() {
        return this.comments.isEmpty();
    }

    /** All entries, sorted by position. */
    public List<Map.Entry<Key, List<String>>> entries() {
        List<Map.Entry<Key, List<String>>> result = new ArrayList<>(this.comments.entrySet());
        result.sort(Map.Entry.comparingByKey());
        return result;
    }
}
