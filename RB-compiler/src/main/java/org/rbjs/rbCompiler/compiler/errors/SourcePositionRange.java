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

package org.rbjs.rbCompiler.compiler.errors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.rbjs.rbCompiler.compiler.IHasSourcePositionRange;
import org.rbjs.util.Utilities;

public class SourcePositionRange implements IHasSourcePositionRange, Comparable<SourcePositionRange> {
    public final SourcePosition start;
    public final SourcePosition end;

    public static final SourcePositionRange INVALID =
            new SourcePositionRange(SourcePosition.INVALID, SourcePosition.INVALID);

    public SourcePositionRange(SourcePosition start, SourcePosition end) {
        this.start = start;
        this.end = end;
    }

    public SourcePositionRange(int startLine, int startColumn, int endLine, int endColumn) {
        this(new SourcePosition(startLine, startColumn), new SourcePosition(endLine, endColumn));
    }

    public boolean isValid() {
        return this.start.isValid() && this.end.isValid();
    }

    @Override
    public String toString() {
        return this.start + "--" + this.end;
    }

    @Override
    public SourcePositionRange getPositionRange() {
        return this;
    }

    /** Append the position information to a JSON node */
    public void appendAsJson(ObjectNode parent) {
        parent.put("start_line", this.start.line);
        parent.put("start_column", this.start.column);
        parent.put("end_line", this.end.line);
        parent.put("end_column", this.end.column);
    }

    /** Inverse of {@link #appendAsJson}. */
    public static SourcePositionRange fromJson(JsonNode node) {
        return new SourcePositionRange(
                Utilities.getIntProperty(node, "start_line"),
                Utilities.getIntProperty(node, "start_column"),
                Utilities.getIntProperty(node, "end_line"),
                Utilities.getIntProperty(node, "end_column"));
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;

        SourcePositionRange that = (SourcePositionRange) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        int result = start.hashCode();
        result = 31 * result + end.hashCode();
        return result;
    }

    @Override
    public int compareTo(SourcePositionRange other) {
        int compare = this.start.compareTo(other.start);
        if (compare != 0)
            return compare;
        return this.end.compareTo(other.end);
    }

    public String toShortString() {
        if (!this.isValid())
            return "";
        if (this.start.line == this.end.line)
            return "#" + this.start.line;
        else
            return "#" + this.start.line + "-" + this.end.line;
    }
}
