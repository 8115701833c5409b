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

import org.rbjs.rbCompiler.compiler.errors.InternalCompilerError;
import org.rbjs.util.Utilities;

import java.util.ArrayList;
import java.util.List;

/**
 * A value that is changed for the duration of a recursive call and restored
 * afterwards, also when the call throws.  Use with try-with-resources:
 * <pre>
 * try (var ignored = this.inTemplate.enter(true)) {
 *     result = this.process(body);
 * }
 * </pre>
 * Scopes must be closed in the reverse order of entering them.
 */
public final class ScopedState<T> {
    private final String name;
    private T value;
    private final List<Scope> scopes;

    public ScopedState(String name, T initial) {
        this.name = name;
        this.value = initial;
        this.scopes = new ArrayList<>();
    }

    public T get() {
        return this.value;
    }

    /** Number of scopes that have been entered and not yet closed. */
    public int depth() {
        return this.scopes.size();
    }

    public Scope enter(T newValue) {
        Scope scope = new Scope(this.value);
        this.scopes.add(scope);
        this.value = newValue;
        return scope;
    }

    public final class Scope implements AutoCloseable {
        private final T saved;
        private boolean closed;

        Scope(T saved) {
            this.saved = saved;
            this.closed = false;
        }

        @Override
        public void close() {
            ScopedState<T> state = ScopedState.this;
            if (this.closed)
                throw new InternalCompilerError("Scope of " + state.name + " closed twice");
            if (state.scopes.isEmpty() || Utilities.last(state.scopes) != this)
                throw new InternalCompilerError("Corrupted scoped state " + state.name +
                        ": closing a scope that is not the innermost one");
            Utilities.removeLast(state.scopes);
            state.value = this.saved;
            this.closed = true;
        }
    }

    @Override
    public String toString() {
        return this.name + "=" + this.value + "(depth " + this.depth() + ")";
    }
}
