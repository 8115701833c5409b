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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.rbjs.rbCompiler.compiler.IHasSourcePositionRange;
import org.rbjs.rbCompiler.compiler.RBCompiler;
import org.rbjs.util.Utilities;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/** Errors and warnings produced during a compilation. */
public class CompilerMessages {
    public static class Message implements IHasSourcePositionRange {
        public final SourcePositionRange range;
        public final boolean warning;
        public final String errorType;
        public final String message;

        protected Message(IHasSourcePositionRange range, boolean warning,
                          String errorType, String message) {
            this.range = range.getPositionRange();
            this.warning = warning;
            this.errorType = errorType;
            this.message = message;
        }

        Message(Throwable e) {
            this(SourcePositionRange.INVALID, false,
                    "This is a bug in the compiler (please report it to the developers)",
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        Message(BaseCompilerException e) {
            this(e.getPositionRange(), false, e.getErrorKind(), e.getMessage());
        }

        public void format(String sourceFile, StringBuilder output) {
            SourcePositionRange range = this.range;
            if (range.isValid()) {
                output.append(sourceFile)
                        .append(":")
                        .append(range.start)
                        .append(": ");
            }
            if (this.warning)
                output.append("warning:");
            else
                output.append("error:");
            output.append(" ")
                    .append(this.errorType)
                    .append(": ")
                    .append(this.message)
                    .append(System.lineSeparator());
        }

        public JsonNode toJson(ObjectMapper mapper) {
            ObjectNode result = mapper.createObjectNode();
            this.range.appendAsJson(result);
            result.put("warning", this.warning);
            result.put("error_type", this.errorType);
            result.put("message", this.message);
            return result;
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder();
            this.format("", builder);
            return builder.toString();
        }

        @Override
        public SourcePositionRange getPositionRange() {
            return this.range;
        }
    }

    public final RBCompiler compiler;
    public final List<Message> messages;
    public int exitCode = 0;

    public CompilerMessages(RBCompiler compiler) {
        this.compiler = compiler;
        this.messages = new ArrayList<>();
    }

    public void clear() {
        this.messages.clear();
        this.exitCode = 0;
    }

    public void setExitCode(int exitCode) {
        this.exitCode = exitCode;
    }

    void reportError(Message message) {
        this.messages.add(message);
        if (!message.warning) {
            this.setExitCode(1);
        }
    }

    public void reportProblem(IHasSourcePositionRange range, boolean warning,
                              String errorType, String message) {
        this.reportError(new Message(range, warning, errorType, message));
    }

    public void reportError(BaseCompilerException e) {
        this.reportError(new Message(e));
    }

    public void reportError(Throwable e) {
        this.reportError(new Message(e));
    }

    public int errorCount() {
        return (int)this.messages.stream().filter(m -> !m.warning).count();
    }

    public int warningCount() {
        return (int)this.messages.stream().filter(m -> m.warning).count();
    }

    public Message getError(int ct) {
        return this.messages.get(ct);
    }

    public void show(PrintStream stream) {
        if (this.errorCount() +
                (this.compiler.options.ioOptions.quiet ? 0 : this.warningCount()) > 0)
            stream.println(this);
    }

    String sourceFileName() {
        String input = this.compiler.options.ioOptions.inputFile;
        return input == null ? "(stdin)" : input;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        if (this.compiler.options.ioOptions.emitJsonErrors) {
            JsonNode node = this.toJson();
            builder.append(node.toPrettyString());
        } else {
            String file = this.sourceFileName();
            for (Message message: this.messages) {
                if (this.compiler.options.ioOptions.quiet && message.warning)
                    continue;
                message.format(file, builder);
            }
        }
        return builder.toString();
    }

    public boolean isEmpty() {
        return this.messages.isEmpty();
    }

    public JsonNode toJson() {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        ArrayNode result = mapper.createArrayNode();
        for (Message message: this.messages) {
            JsonNode node = message.toJson(mapper);
            result.add(node);
        }
        return result;
    }
}
