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

package org.dgflux.otCompiler.compiler;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.ParametersDelegate;
import org.dgflux.otCompiler.compiler.errors.CompilationError;
import org.dgflux.util.IDiff;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/** Options for the operator template compiler.
 * They can be set directly, or parsed from command-line style arguments
 * supplied by the program which embeds the compiler. */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class CompilerOptions implements IDiff<CompilerOptions> {
    /** Options related to the semantics of the passes. */
    @SuppressWarnings("CanBeFinal")
    public static class Language implements IDiff<Language> {
        @Parameter(names = "--throw", description = "Throw compilation errors instead of reporting them")
        public boolean throwOnError = false;
        /** Only diagnostics tooling should turn this off: it allows
         * inspecting the partial types of a template that does not type-check. */
        @Parameter(names = "--noFinalCheck", description = "Do not require all inferred types to be final",
                arity = 0)
        public boolean noFinalCheck = false;
        @Parameter(names = "--noFluxSimplify", description = "Do not fold zeros in rewritten flux kernels")
        public boolean noFluxSimplify = false;

        public boolean checkFinalTypes() {
            return !this.noFinalCheck;
        }

        public boolean simplifyFluxes() {
            return !this.noFluxSimplify;
        }

        public boolean same(Language language) {
            return this.throwOnError == language.throwOnError &&
                    this.noFinalCheck == language.noFinalCheck &&
                    this.noFluxSimplify == language.noFluxSimplify;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || this.getClass() != o.getClass()) return false;
            return this.same((Language) o);
        }

        @Override
        public int hashCode() {
            return Objects.hash(this.throwOnError, this.noFinalCheck, this.noFluxSimplify);
        }

        @Override
        public String toString() {
            return "Language{" +
                    "\n\tthrowOnError=" + this.throwOnError +
                    ",\n\tcheckFinalTypes=" + this.checkFinalTypes() +
                    ",\n\tsimplifyFluxes=" + this.simplifyFluxes() +
                    '}';
        }

        @Override
        public String diff(Language other) {
            if (this.same(other))
                return "";
            StringBuilder result = new StringBuilder();
            result.append("Language{");
            if (this.throwOnError != other.throwOnError)
                result.append("throwOnError=")
                        .append(this.throwOnError)
                        .append("!=")
                        .append(other.throwOnError)
                        .append(System.lineSeparator());
            if (this.noFinalCheck != other.noFinalCheck)
                result.append(", checkFinalTypes=")
                        .append(this.checkFinalTypes())
                        .append("!=")
                        .append(other.checkFinalTypes())
                        .append(System.lineSeparator());
            if (this.noFluxSimplify != other.noFluxSimplify)
                result.append(", simplifyFluxes=")
                        .append(this.simplifyFluxes())
                        .append("!=")
                        .append(other.simplifyFluxes())
                        .append(System.lineSeparator());
            result.append("}")
                    .append(System.lineSeparator());
            return result.toString();
        }
    }

    /** Options related to diagnostics and logging. */
    @SuppressWarnings("CanBeFinal")
    public static class IO implements IDiff<IO> {
        @DynamicParameter(names = "-T",
                description = "Specify logging level for a class (can be repeated)")
        public Map<String, String> loggingLevel = new HashMap<>();
        @Parameter(names = {"--je", "-je"}, description = "Emit error messages as a JSON array")
        public boolean emitJsonErrors = false;
        @Parameter(names = "-q", description = "Quiet: do not print warnings")
        public boolean quiet = false;

        public boolean same(IO other) {
            return this.emitJsonErrors == other.emitJsonErrors &&
                    this.quiet == other.quiet &&
                    this.loggingLevel.equals(other.loggingLevel);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || this.getClass() != o.getClass()) return false;
            return this.same((IO) o);
        }

        @Override
        public int hashCode() {
            return Objects.hash(this.loggingLevel, this.emitJsonErrors, this.quiet);
        }

        @Override
        public String toString() {
            return "IO{" +
                    "\n\tloggingLevel=" + this.loggingLevel +
                    ",\n\temitJsonErrors=" + this.emitJsonErrors +
                    ",\n\tquiet=" + this.quiet +
                    '}';
        }

        @Override
        public String diff(IO other) {
            if (this.same(other))
                return "";
            return "IO{" +
                    (this.emitJsonErrors != other.emitJsonErrors ? ".emitJsonErrors=" +
                            this.emitJsonErrors + "!=" + other.emitJsonErrors : "")
                    + (this.quiet != other.quiet ? ".quiet=" +
                            this.quiet + "!=" + other.quiet : "")
                    + (!this.loggingLevel.equals(other.loggingLevel) ? ".loggingLevel=" +
                            this.loggingLevel + "!=" + other.loggingLevel : "") +
                    "}";
        }
    }

    @ParametersDelegate
    public IO ioOptions = new IO();
    @ParametersDelegate
    public Language languageOptions = new Language();

    public CompilerOptions() {}

    public static CompilerOptions getDefault() {
        return new CompilerOptions();
    }

    /** Build options from command-line style arguments.
     * @throws CompilationError if the arguments cannot be parsed. */
    public static CompilerOptions parse(String... args) {
        CompilerOptions result = new CompilerOptions();
        JCommander commander = JCommander.newBuilder()
                .addObject(result)
                .programName("ot-compiler")
                .build();
        try {
            commander.parse(args);
        } catch (ParameterException ex) {
            throw new CompilationError("Cannot parse compiler options: " + ex.getMessage());
        }
        return result;
    }

    public boolean same(CompilerOptions other) {
        if (!this.ioOptions.same(other.ioOptions)) return false;
        return this.languageOptions.same(other.languageOptions);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || this.getClass() != o.getClass()) return false;
        return this.same((CompilerOptions) o);
    }

    @Override
    public int hashCode() {
        return 31 * this.ioOptions.hashCode() + this.languageOptions.hashCode();
    }

    @Override
    public String diff(CompilerOptions other) {
        return this.languageOptions.diff(other.languageOptions) +
                this.ioOptions.diff(other.ioOptions);
    }

    @Override
    public String toString() {
        return "CompilerOptions{" +
                "\nioOptions=" + this.ioOptions +
                ",\nlanguageOptions=" + this.languageOptions +
                "\n}";
    }
}
