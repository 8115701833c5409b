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

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;
import org.rbjs.rbCompiler.compiler.errors.SourcePositionRange;
import org.rbjs.rbCompiler.compiler.visitors.stages.StageFactory;
import org.rbjs.util.IValidate;
import org.rbjs.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Command-line options for the compiler */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class CompilerOptions implements IValidate {
    /** Options related to the language compiled. */
    @SuppressWarnings("CanBeFinal")
    public static class Language implements IValidate {
        @Parameter(names = "--es", converter = EsLevel.Converter.class,
                description = "Target level of the generated program (2015 to 2025, or 5)")
        public EsLevel esLevel = EsLevel.ES2020;
        @Parameter(names = {"--filter", "-f"},
                description = "Comma-separated list of stages to apply, in order")
        public List<String> filters = new ArrayList<>();
        @Parameter(names = "--include",
                description = "Comma-separated list of method names that stages may rewrite")
        public List<String> include = new ArrayList<>();
        @Parameter(names = "--exclude",
                description = "Comma-separated list of method names that stages must leave alone")
        public List<String> exclude = new ArrayList<>();
        @Nullable
        @Parameter(names = "--include-only",
                description = "Comma-separated list of the only method names that stages may rewrite")
        public List<String> includeOnly = null;
        @Parameter(names = "--include-all",
                description = "Allow stages to rewrite every method, including the ones excluded by default")
        public boolean includeAll = false;
        @Parameter(names = "--disable-autoimports",
                description = "Do not emit the imports synthesized by stages")
        public boolean disableAutoimports = false;
        @Parameter(names = "--buffer",
                description = "Additional names of template output buffer variables")
        public List<String> buffers = new ArrayList<>();
        /** Useful for development */
        public boolean throwOnError = false;

        @Override
        public boolean validate(IErrorReporter reporter) {
            boolean valid = true;
            for (String filter: this.filters) {
                if (!StageFactory.isKnown(filter)) {
                    reporter.reportError(SourcePositionRange.INVALID, "Invalid options",
                            "Unknown filter " + Utilities.singleQuote(filter) +
                                    "; known filters are " + StageFactory.names());
                    valid = false;
                }
            }
            return valid;
        }

        @Override
        public String toString() {
            return "Language{" +
                    "\n\tesLevel=" + this.esLevel +
                    ",\n\tfilters=" + this.filters +
                    ",\n\tinclude=" + this.include +
                    ",\n\texclude=" + this.exclude +
                    ",\n\tincludeOnly=" + this.includeOnly +
                    ",\n\tincludeAll=" + this.includeAll +
                    ",\n\tdisableAutoimports=" + this.disableAutoimports +
                    ",\n\tbuffers=" + this.buffers +
                    ",\n\tthrowOnError=" + this.throwOnError +
                    '}';
        }
    }

    /** Options related to input and output. */
    @SuppressWarnings("CanBeFinal")
    public static class IO implements IValidate {
        @DynamicParameter(names = "-T",
                description = "Specify logging level for a class (can be repeated)")
        public Map<String, String> loggingLevel = new HashMap<>();
        @Parameter(names = "-o", description = "Output file; stdout if not specified")
        public String outputFile = "";
        @Parameter(names = {"--je", "-je"}, description = "Emit error messages as a JSON array to the error output")
        public boolean emitJsonErrors = false;
        @Parameter(names = "-q", description = "Quiet: do not print warnings")
        public boolean quiet = false;
        @Parameter(description = "Input file containing the parsed tree as JSON; stdin if not specified")
        @Nullable
        public String inputFile = null;
        @Parameter(names = "-v", description = "Output verbosity")
        public int verbosity = 0;

        @Override
        public boolean validate(IErrorReporter reporter) {
            return true;
        }

        @Override
        public String toString() {
            return "IO{" +
                    "\n\toutputFile=" + Utilities.singleQuote(this.outputFile) +
                    ",\n\temitJsonErrors=" + this.emitJsonErrors +
                    ",\n\tinputFile=" + Utilities.singleQuote(this.inputFile) +
                    ",\n\tverbosity=" + this.verbosity +
                    ",\n\tquiet=" + this.quiet +
                    '}';
        }
    }

    @Parameter(names = {"-h", "--help", "-?"}, help = true, description = "Show this message and exit")
    public boolean help;
    @ParametersDelegate
    public IO ioOptions = new IO();
    @ParametersDelegate
    public Language languageOptions = new Language();

    public CompilerOptions() {}

    public static CompilerOptions getDefault() {
        return new CompilerOptions();
    }

    @Override
    public String toString() {
        return "CompilerOptions{" +
                "\nhelp=" + this.help +
                ",\nioOptions=" + this.ioOptions +
                ",\nlanguageOptions=" + this.languageOptions +
                "\n}";
    }

    @Override
    public boolean validate(IErrorReporter reporter) {
        return this.ioOptions.validate(reporter) &&
                this.languageOptions.validate(reporter);
    }
}
