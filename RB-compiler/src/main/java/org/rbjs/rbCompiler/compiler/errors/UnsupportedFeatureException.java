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

import org.rbjs.rbCompiler.compiler.EsLevel;
import org.rbjs.rbCompiler.compiler.IHasSourcePositionRange;

/** Exception thrown when a rewrite needs a target feature that the
 * compilation options do not enable.  The construct is legal, and it
 * would compile with a different target level. */
public class UnsupportedFeatureException extends BaseCompilerException {
    public static final String KIND = "Unsupported feature";

    public UnsupportedFeatureException(String message, IHasSourcePositionRange node) {
        super(message, node.getPositionRange());
    }

    public UnsupportedFeatureException(String feature, EsLevel required, EsLevel actual,
                                       IHasSourcePositionRange node) {
        this(feature + " requires target " + required + " but the target is " + actual, node);
    }

    @Override
    public String getErrorKind() {
        return KIND;
    }
}
