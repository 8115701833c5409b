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

import com.fasterxml.jackson.core.JsonProcessingException;
import org.rbjs.rbCompiler.compiler.backend.JsonDecoder;
import org.rbjs.rbCompiler.compiler.context.CommentTable;
import org.rbjs.rbCompiler.compiler.context.CompileContext;
import org.rbjs.rbCompiler.compiler.errors.BaseCompilerException;
import org.rbjs.rbCompiler.compiler.errors.CompilationError;
import org.rbjs.rbCompiler.compiler.errors.CompilerMessages;
import org.rbjs.rbCompiler.compiler.errors.SourcePositionRange;
import org.rbjs.rbCompiler.compiler.visitors.Pipeline;
import org.rbjs.rbCompiler.compiler.visitors.Stage;
import org.rbjs.rbCompiler.compiler.visitors.stages.StageFactory;
import org.rbjs.rbCompiler.ir.Node;
import org.rbjs.util.IWritesLogs;
import org.rbjs.util.Logger;

import javax.annotation.Nullable;
import java.io.PrintStream;
import java.util.List;

/**
 * This class compiles a parsed program.
 * Every call to {@link #compile} builds a fresh {@link CompileContext} and a
 * fresh {@link Pipeline}, so no state is shared between compilations.
 * Errors are collected in {@link #messages}; if the option throwOnError is
 * set the first error also throws.
 */
public class RBCompiler implements IWritesLogs, ICompilerComponent, IErrorReporter {
    public final CompilerOptions options;
    public final CompilerMessages messages;
    final StageFactory stageFactory;

    public RBCompiler(CompilerOptions options) {
        this.options = options;
        this.messages = new CompilerMessages(this);
        this.stageFactory = new StageFactory();
    }

    @Override
    public RBCompiler compiler() {
        return this;
    }

    /**
     * Report an error or warning during compilation.
     * @param range      Position in source where error is located.
     * @param warning    True if this is a warning.
     * @param errorType  A short string that categorizes the error type.
     * @param message    Error message.
     */
    @Override
    public void reportProblem(SourcePositionRange range, boolean warning,
                              String errorType, String message) {
        this.messages.reportProblem(range, warning, errorType, message);
        if (!warning && this.options.languageOptions.throwOnError) {
            System.err.println(this.messages);
            throw new CompilationError("Error during compilation");
        }
    }

    @Override
    public boolean hasErrors() {
        return this.messages.exitCode != 0;
    }

    /** Build the pipeline named by the options for one compilation. */
    public Pipeline createPipeline(CompileContext context) {
        List<Stage> stages = this.stageFactory.create(this.options.languageOptions.filters);
        return new Pipeline(context, stages);
    }

    /**
     * Compile a program.
     * @param program   Tree produced by the parser.
     * @param comments  Comments attached to nodes of the tree.  The table is
     *                  updated in place as nodes are rewritten.
     * @return          The result, or null if errors occurred.
     */
    @Nullable
    public CompileResult compile(Node program, CommentTable comments) {
        try {
            long start = System.currentTimeMillis();
            CompileContext context = new CompileContext(this.options, comments);
            Pipeline pipeline = this.createPipeline(context);
            Node result = pipeline.apply(program);
            Logger.INSTANCE.belowLevel(this, 1)
                    .append("Compilation time ")
                    .append(System.currentTimeMillis() - start)
                    .append("ms")
                    .newline();
            return new CompileResult(result, comments, pipeline.prelude());
        } catch (BaseCompilerException e) {
            this.messages.reportError(e);
            this.rethrow(e);
        } catch (RuntimeException e) {
            this.messages.reportError(e);
            this.rethrow(e);
        }
        return null;
    }

    @Nullable
    public CompileResult compile(Node program) {
        return this.compile(program, new CommentTable());
    }

    /** Compile a program serialized in the format read by {@link JsonDecoder}. */
    @Nullable
    public CompileResult compileJson(String json) {
        JsonDecoder.Input input;
        try {
            input = new JsonDecoder().decode(json);
        } catch (JsonProcessingException e) {
            this.reportError(SourcePositionRange.INVALID, "Malformed input", e.getOriginalMessage());
            return null;
        } catch (BaseCompilerException e) {
            this.messages.reportError(e);
            this.rethrow(e);
            return null;
        }
        return this.compile(input.ast(), input.comments());
    }

    void rethrow(RuntimeException e) {
        if (this.options.languageOptions.throwOnError) {
            System.err.println(this.messages);
            throw e;
        }
    }

    public void showErrors(PrintStream stream) {
        this.messages.show(stream);
    }

    /** Throw if any error has been encountered.
     * Displays the errors on stderr as well. */
    public void throwIfErrorsOccurred() {
        if (this.hasErrors()) {
            this.showErrors(System.err);
            throw new CompilationError("Error during compilation");
        }
    }
}
