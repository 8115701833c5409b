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

package org.rbjs.rbCompiler.compiler.visitors;

import org.junit.Assert;
import org.junit.Test;
import org.rbjs.rbCompiler.compiler.errors.InternalCompilerError;

public class ScopedStateTests {
    @Test
    public void restoresOnClose() {
        ScopedState<String> state = new ScopedState<>("buffer", null);
        try (var outer = state.enter("a")) {
            Assert.assertEquals("a", state.get());
            try (var inner = state.enter("b")) {
                Assert.assertEquals("b", state.get());
                Assert.assertEquals(2, state.depth());
            }
            Assert.assertEquals("a", state.get());
        }
        Assert.assertNull(state.get());
        Assert.assertEquals(0, state.depth());
    }

    @Test
    public void restoresOnException() {
        ScopedState<Integer> state = new ScopedState<>("depth", 0);
        try (var ignored = state.enter(1)) {
            throw new IllegalStateException("boom");
        } catch (IllegalStateException ex) {
            Assert.assertEquals("boom", ex.getMessage());
        }
        Assert.assertEquals(Integer.valueOf(0), state.get());
        Assert.assertEquals(0, state.depth());
    }

    @Test
    public void outOfOrderClose() {
        ScopedState<String> state = new ScopedState<>("buffer", "x");
        ScopedState<String>.Scope first = state.enter("a");
        ScopedState<String>.Scope second = state.enter("b");
        Assert.assertThrows(InternalCompilerError.class, first::close);
        second.close();
        first.close();
        Assert.assertEquals("x", state.get());
        Assert.assertThrows(InternalCompilerError.class, first::close);
    }
}
