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

import org.rbjs.rbCompiler.compiler.context.CompileContext;
import org.rbjs.rbCompiler.compiler.errors.InternalCompilerError;
import org.rbjs.rbCompiler.ir.Node;
import org.rbjs.rbCompiler.ir.Nodes;
import org.rbjs.rbCompiler.ir.Tag;
import org.rbjs.util.IWritesLogs;
import org.rbjs.util.Linq;
import org.rbjs.util.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * An ordered list of stages applied to one program.
 * Applying the pipeline initializes every stage, processes the tree,
 * invokes the finish hook of every stage, and finally prepends the
 * hoisted declarations to the program.
 */
public class Pipeline implements IRTransform, IWritesLogs {
    public final CompileContext context;
    public final List<Stage> stages;
    final Dispatcher dispatcher;
    private boolean used;

    public Pipeline(CompileContext context, List<Stage> stages) {
        this.context = context;
        this.stages = new ArrayList<>(stages);
        this.dispatcher = new Dispatcher(this.stages);
        this.used = false;
        for (Stage stage: this.stages)
            stage.attach(this.dispatcher, context);
    }

    public Pipeline(CompileContext context, Stage... stages) {
        this(context, Linq.list(stages));
    }

    public Dispatcher getDispatcher() {
        return this.dispatcher;
    }

    @Override
    public Node apply(Node program) {
        if (this.used)
            throw new InternalCompilerError("Pipeline " + this + " applied twice");
        this.used = true;
        for (Stage stage: this.stages) {
            Logger.INSTANCE.belowLevel(this, 1)
                    .append("Initializing ")
                    .appendSupplier(stage::toString)
                    .newline();
            stage.initialize(this.context);
        }
        Node result = this.dispatcher.process(program);
        for (Stage stage: this.stages) {
            Logger.INSTANCE.belowLevel(this, 1)
                    .append("Finishing ")
                    .appendSupplier(stage::toString)
                    .newline();
            result = stage.finish(result);
        }
        result = this.prependHoisted(result);
        final Node after = result;
        Logger.INSTANCE.belowLevel(this, 3)
                .append("After ")
                .appendSupplier(this::toString)
                .newline()
                .appendSupplier(after::toString)
                .newline();
        return result;
    }

    /** The declarations to emit before the program. */
    public List<Node> prelude() {
        if (this.context.options.languageOptions.disableAutoimports)
            return this.context.hoisted.setup();
        return this.context.hoisted.all();
    }

    Node prependHoisted(Node program) {
        List<Node> prelude = this.prelude();
        if (prelude.isEmpty())
            return program;
        List<Object> statements = new ArrayList<>(prelude);
        if (program.is(Tag.BEGIN)) {
            statements.addAll(program.children());
            return program.withChildren(statements);
        }
        statements.add(program);
        return Nodes.begin(statements).withPosition(program.getPositionRange());
    }

    @Override
    public String toString() {
        return "Pipeline" + Linq.map(this.stages, s -> s.name);
    }
}
