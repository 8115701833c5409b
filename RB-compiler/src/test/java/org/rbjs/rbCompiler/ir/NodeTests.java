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

package org.rbjs.rbCompiler.ir;

import org.junit.Assert;
import org.junit.Test;
import org.rbjs.rbCompiler.compiler.errors.InternalCompilerError;
import org.rbjs.rbCompiler.compiler.errors.SourcePositionRange;

import java.util.ArrayList;
import java.util.List;

public class NodeTests {
    static final SourcePositionRange POSITION = new SourcePositionRange(2, 3, 2, 9);

    @Test
    public void equalityIgnoresPosition() {
        Node positioned = new Node(Tag.STR, List.of("a"), POSITION);
        Node plain = Nodes.str("a");
        Assert.assertEquals(plain, positioned);
        Assert.assertEquals(plain.hashCode(), positioned.hashCode());
        Assert.assertNotEquals(Nodes.sym("a"), plain);
        Assert.assertNotEquals(Nodes.str("b"), plain);
    }

    @Test
    public void integersAreNormalized() {
        Node node = Nodes.s(Tag.INT, 42);
        Assert.assertEquals(42L, node.child(0));
        Assert.assertEquals(Nodes.integer(42), node);
        Assert.assertSame(node, node.withChildren(List.of(42)));
    }

    @Test
    public void illegalChild() {
        Assert.assertThrows(InternalCompilerError.class,
                () -> new Node(Tag.STR, List.of(new Object())));
    }

    @Test
    public void childrenAreImmutable() {
        Node node = Nodes.begin(Nodes.str("a"));
        Assert.assertThrows(UnsupportedOperationException.class,
                () -> node.children().add(Nodes.str("b")));
    }

    @Test
    public void withChildrenPreservesIdentity() {
        Node a = Nodes.str("a");
        Node node = Nodes.begin(a, Nodes.nil()).withPosition(POSITION);
        Assert.assertSame(node, node.withChildren(node.children()));
        Assert.assertSame(node, node.withChildren(new ArrayList<>(node.children())));

        // An equal but distinct child is a change
        List<Object> children = new ArrayList<>(node.children());
        children.set(0, Nodes.str("a"));
        Node changed = node.withChildren(children);
        Assert.assertNotSame(node, changed);
        Assert.assertEquals(node, changed);
        Assert.assertEquals(POSITION, changed.getPositionRange());
    }

    @Test
    public void updatedKeepsPosition() {
        Node send = Nodes.send(Nodes.lvar("a"), "b").withPosition(POSITION);
        Node csend = send.updated(Tag.CSEND, send.children());
        Assert.assertSame(Tag.CSEND, csend.kind);
        Assert.assertEquals(POSITION, csend.getPositionRange());
        Assert.assertSame(send, send.updated(Tag.SEND, send.children()));
    }

    @Test
    public void accessors() {
        Node send = Nodes.send(null, "puts", Nodes.str("hi"));
        Assert.assertNull(Nodes.receiver(send));
        Assert.assertEquals("puts", Nodes.method(send));
        Assert.assertEquals(List.of(Nodes.str("hi")), Nodes.arguments(send));
        Assert.assertTrue(Nodes.isCall(send, "puts", 1));
        Assert.assertFalse(Nodes.isCall(send, "puts", 0));
        Assert.assertTrue(send.childIs(2, Tag.STR));
        Assert.assertThrows(InternalCompilerError.class, () -> send.node(1));
        Assert.assertThrows(InternalCompilerError.class, () -> send.nonNull(0));
        Assert.assertThrows(InternalCompilerError.class, () -> send.string(2));
    }

    @Test
    public void unwrapAndStatements() {
        Node x = Nodes.lvar("x");
        Assert.assertSame(x, Nodes.unwrap(Nodes.begin(Nodes.begin(x))));
        Assert.assertEquals(List.of(x, x), Nodes.statements(Nodes.begin(x, x)));
        Assert.assertEquals(List.of(x), Nodes.statements(x));
        Assert.assertTrue(Nodes.statements(null).isEmpty());
    }

    @Test
    public void printing() {
        String text = Nodes.send(null, "puts", Nodes.str("hi")).toString();
        Assert.assertTrue(text, text.startsWith("(send null \"puts\""));
        Assert.assertTrue(text, text.contains("(str \"hi\")"));
    }

    @Test
    public void tags() {
        Assert.assertSame(Tag.CSEND, Tag.of("csend"));
        Assert.assertTrue(Tag.CSEND.isA(Tag.SEND));
        Assert.assertTrue(Tag.AUTORETURN.isA(Tag.RETURN));
        Assert.assertFalse(Tag.SEND.isA(Tag.CSEND));
        Tag parsed = Tag.of("some_new_kind");
        Assert.assertSame(parsed, Tag.of("some_new_kind"));
        Assert.assertNull(parsed.parent);
        Assert.assertFalse(parsed.synthetic);
        Assert.assertSame(Tag.CSEND, Tag.synthetic("csend", Tag.SEND));
        Assert.assertThrows(IllegalArgumentException.class, () -> Tag.synthetic("csend", Tag.BEGIN));
    }
}
