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

package org.rbjs.rbCompiler;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import org.rbjs.rbCompiler.compiler.CompileResult;
import org.rbjs.rbCompiler.compiler.CompilerOptions;
import org.rbjs.rbCompiler.compiler.RBCompiler;
import org.rbjs.rbCompiler.compiler.backend.JsonEncoder;
import org.rbjs.rbCompiler.compiler.errors.CompilationError;
import org.rbjs.rbCompiler.compiler.errors.CompilerMessages;
import org.rbjs.rbCompiler.compiler.errors.SourcePositionRange;
import org.rbjs.util.Logger;
import org.rbjs.util.Utilities;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

/** Main entry point of the compiler.  Reads a parsed program as JSON,
 * applies the requested stages, and writes the rewritten program as JSON. */
public class CompilerMain {
    final CompilerOptions options;

    CompilerMain() {
        this.options = new CompilerOptions();
    }

    void usage(JCommander commander) {
        // JCommander mistakenly prints this as default value
        // if it manages to parse it partially.
        this.options.ioOptions.loggingLevel.clear();
        commander.usage();
    }

    int parseOptions(String[] argv) {
        JCommander commander = JCommander.newBuilder()
                .addObject(this.options)
                .build();
        commander.setProgramName("rb-to-js");
        try {
            commander.parse(argv);
        } catch (ParameterException ex) {
            if (ex.getMessage().contains("Only one main parameter allowed")) {
                if (this.options.ioOptions.outputFile.isEmpty()) {
                    System.err.println("Did you forget to specify the output file with -o?");
                }
            }
            System.err.println(ex.getMessage());
            return 1;
        }
        if (this.options.help) {
            this.usage(commander);
            return 1;
        }

        for (Map.Entry<String, String> entry: this.options.ioOptions.loggingLevel.entrySet()) {
            try {
                int level = Integer.parseInt(entry.getValue());
                Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
            } catch (NumberFormatException ex) {
                System.err.println("-T option must be followed by 'class=number'; could not parse " + entry);
                return 1;
            } catch (CompilationError ex) {
                System.err.println(ex.getMessage());
                return 1;
            }
        }
        return 0;
    }

    PrintStream getOutputStream() throws IOException {
        PrintStream outputStream;
        String outputFile = this.options.ioOptions.outputFile;
        if (outputFile.isEmpty()) {
            outputStream = System.out;
        } else {
            outputStream = new PrintStream(Files.newOutputStream(Paths.get(outputFile)),
                    false, StandardCharsets.UTF_8);
        }
        return outputStream;
    }

    InputStream getInputFile(@Nullable String inputFile) throws IOException {
        if (inputFile == null) {
            return System.in;
        } else {
            return Files.newInputStream(Paths.get(inputFile));
        }
    }

    /** Run compiler, return the messages produced. */
    CompilerMessages run() {
        RBCompiler compiler = new RBCompiler(this.options);
        if (!this.options.validate(compiler))
            return compiler.messages;

        String json;
        try (InputStream input = this.getInputFile(this.options.ioOptions.inputFile)) {
            json = new String(input.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            compiler.reportError(SourcePositionRange.INVALID,
                    "Error reading file",
                    Utilities.singleQuote(this.options.ioOptions.inputFile) + " " + e.getMessage());
            return compiler.messages;
        }
        if (this.options.ioOptions.verbosity >= 1)
            System.out.println(this.options);

        CompileResult result = compiler.compileJson(json);
        if (compiler.hasErrors() || result == null)
            return compiler.messages;

        try {
            PrintStream stream = this.getOutputStream();
            stream.println(new JsonEncoder().toJsonString(result));
            if (stream != System.out)
                stream.close();
            else
                stream.flush();
        } catch (IOException e) {
            compiler.reportError(SourcePositionRange.INVALID,
                    "Error writing to output file", e.getMessage());
        }
        return compiler.messages;
    }

    public static CompilerMessages execute(String... argv) {
        CompilerMain main = new CompilerMain();
        int exitCode = main.parseOptions(argv);
        if (exitCode != 0) {
            // return empty messages
            CompilerMessages result = new CompilerMessages(new RBCompiler(new CompilerOptions()));
            result.setExitCode(exitCode);
            return result;
        }
        return main.run();
    }

    public static void main(String[] argv) {
        CompilerMessages messages = execute(argv);
        messages.show(System.err);
        System.exit(messages.exitCode);
    }
}
