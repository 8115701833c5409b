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

import javax.annotation.Nullable;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The kind of a {@link Node}.  Tags form an open enumeration: the kinds
 * produced by the parser are predeclared here, and stages may declare
 * additional synthetic kinds at any time.  Tags are interned, so they can be
 * compared by identity.
 *
 * <p>A synthetic tag may name a parent tag.  When no handler is registered for
 * a tag, handler lookup continues with its parent; this is how target-only
 * kinds such as {@code csend} or {@code autoreturn} reach the handlers written
 * for {@code send} and {@code return}.
 */
public final class Tag {
    private static final Map<String, Tag> TAGS = new ConcurrentHashMap<>();

    public final String name;
    @Nullable
    public final Tag parent;
    /** True for kinds that only exist in the output language. */
    public final boolean synthetic;

    private Tag(String name, @Nullable Tag parent, boolean synthetic) {
        this.name = name;
        this.parent = parent;
        this.synthetic = synthetic;
    }

    /** The tag with the specified name; a new parsed tag without parent is created if necessary. */
    public static Tag of(String name) {
        return TAGS.computeIfAbsent(name, n -> new Tag(n, null, false));
    }

    /** Declare a synthetic tag.  Declaring the same tag twice
     * with the same parent returns the existing tag. */
    public static Tag synthetic(String name, @Nullable Tag parent) {
        Tag result = TAGS.computeIfAbsent(name, n -> new Tag(n, parent, true));
        if (result.parent != parent || !result.synthetic)
            throw new IllegalArgumentException("Tag " + name + " already declared differently");
        return result;
    }

    /** True if this tag is the specified one, or one of its ancestors is. */
    public boolean isA(Tag other) {
        for (Tag t = this; t != null; t = t.parent)
            if (t == other)
                return true;
        return false;
    }

    @Override
    public String toString() {
        return this.name;
    }

    // Literals
    public static final Tag NIL = of("nil");
    public static final Tag TRUE = of("true");
    public static final Tag FALSE = of("false");
    public static final Tag SELF = of("self");
    public static final Tag INT = of("int");
    public static final Tag FLOAT = of("float");
    public static final Tag STR = of("str");
    public static final Tag DSTR = of("dstr");
    public static final Tag SYM = of("sym");
    public static final Tag REGEXP = of("regexp");
    public static final Tag IRANGE = of("irange");
    public static final Tag ERANGE = of("erange");
    public static final Tag ARRAY = of("array");
    public static final Tag HASH = of("hash");
    public static final Tag PAIR = of("pair");
    public static final Tag SPLAT = of("splat");

    // Variables and assignments
    public static final Tag LVAR = of("lvar");
    public static final Tag IVAR = of("ivar");
    public static final Tag CVAR = of("cvar");
    public static final Tag GVAR = of("gvar");
    public static final Tag CONST = of("const");
    public static final Tag LVASGN = of("lvasgn");
    public static final Tag IVASGN = of("ivasgn");
    public static final Tag CVASGN = of("cvasgn");
    public static final Tag GVASGN = of("gvasgn");
    public static final Tag CASGN = of("casgn");
    public static final Tag OP_ASGN = of("op_asgn");
    public static final Tag OR_ASGN = of("or_asgn");
    public static final Tag AND_ASGN = of("and_asgn");
    public static final Tag MASGN = of("masgn");

    // Invocations
    public static final Tag SEND = of("send");
    public static final Tag BLOCK = of("block");
    public static final Tag BLOCK_PASS = of("block_pass");
    public static final Tag YIELD = of("yield");
    public static final Tag SUPER = of("super");

    // Control flow
    public static final Tag BEGIN = of("begin");
    public static final Tag IF = of("if");
    public static final Tag CASE = of("case");
    public static final Tag WHEN = of("when");
    public static final Tag WHILE = of("while");
    public static final Tag UNTIL = of("until");
    public static final Tag FOR = of("for");
    public static final Tag AND = of("and");
    public static final Tag OR = of("or");
    public static final Tag NOT = of("not");
    public static final Tag RETURN = of("return");
    public static final Tag BREAK = of("break");
    public static final Tag NEXT = of("next");

    // Definitions
    public static final Tag ARGS = of("args");
    public static final Tag ARG = of("arg");
    public static final Tag OPTARG = of("optarg");
    public static final Tag RESTARG = of("restarg");
    public static final Tag KWARG = of("kwarg");
    public static final Tag KWOPTARG = of("kwoptarg");
    public static final Tag BLOCKARG = of("blockarg");
    public static final Tag DEF = of("def");
    public static final Tag DEFS = of("defs");
    public static final Tag CLASS = of("class");
    public static final Tag MODULE = of("module");

    // Synthetic kinds of the output language
    public static final Tag CSEND = synthetic("csend", SEND);
    public static final Tag ATTR = synthetic("attr", SEND);
    public static final Tag CALL = synthetic("call", SEND);
    public static final Tag CCALL = synthetic("ccall", CALL);
    public static final Tag AWAIT = synthetic("await", SEND);
    public static final Tag SEND_BANG = synthetic("send!", SEND);
    public static final Tag IN = synthetic("in?", SEND);
    public static final Tag KWBEGIN = synthetic("kwbegin", BEGIN);
    /** Statements executed with a class prototype as the receiver. */
    public static final Tag PROTOTYPE = synthetic("prototype", BEGIN);
    public static final Tag ASYNC = synthetic("async", DEF);
    public static final Tag DEFF = synthetic("deff", DEF);
    public static final Tag DEFM = synthetic("defm", DEF);
    public static final Tag AUTORETURN = synthetic("autoreturn", RETURN);
    public static final Tag FOR_OF = synthetic("for_of", FOR);
    public static final Tag NULLISH_OR = synthetic("nullish_or", OR);
    public static final Tag IMPORT = synthetic("import", null);
    public static final Tag EXPORT = synthetic("export", null);
    /** Parameters received as a single destructured object. */
    public static final Tag DESTRUCTURE = synthetic("destructure", null);
}
