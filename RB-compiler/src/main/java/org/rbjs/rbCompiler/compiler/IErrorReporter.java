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

package org.rbjs.rbCompiler.compiler;

import org.rbjs.rbCompiler.compiler.errors.SourcePositionRange;

/** Interface implemented by classes that collect errors and warnings. */
public interface IErrorReporter {
    /**
     * Report an error or warning.
     * @param range        Position in source where problem is located.
     * @param warning      True if this is a warning.
     * @param errorType    A short string that categorizes the error type.
     * @param message      Error message.
     */
    void reportProblem(SourcePositionRange range, boolean warning, String errorType, String message);

    default void reportError(SourcePositionRange range, String errorType, String message) {
        this.reportProblem(range, false, errorType, message);
    }

    default void reportWarning(SourcePositionRange range, String errorType, String message) {
        this.reportProblem(range, true, errorType, message);
    }

    /** True if any error (but not a warning) has been reported. */
    boolean hasErrors();
}
