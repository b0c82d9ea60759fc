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

import com.fasterxml.jackson.databind.JsonNode;
import org.dgflux.otCompiler.compiler.errors.BaseCompilerException;
import org.dgflux.otCompiler.compiler.errors.CompilationError;
import org.dgflux.otCompiler.compiler.errors.CompilerMessages;
import org.dgflux.otCompiler.compiler.visitors.inner.BoundaryToFlux;
import org.dgflux.otCompiler.compiler.visitors.inner.ToJsonInnerVisitor;
import org.dgflux.otCompiler.compiler.visitors.inner.TypeDict;
import org.dgflux.otCompiler.compiler.visitors.inner.TypeInference;
import org.dgflux.otCompiler.ir.expression.OTExpression;
import org.dgflux.otCompiler.ir.type.TypeInfo;
import org.dgflux.util.IWritesLogs;
import org.dgflux.util.Logger;

import javax.annotation.Nullable;
import java.io.PrintStream;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Entry point for the analyses of operator templates.
 * Errors are recorded in {@link #messages}; the methods which run a pass
 * return null when the pass fails, unless the options ask for errors to be thrown.
 */
public class OTCompiler implements IWritesLogs, ICompilerComponent {
    public final CompilerOptions options;
    public final CompilerMessages messages;

    public OTCompiler(CompilerOptions options) {
        this.options = options;
        this.messages = new CompilerMessages(options);
        for (Map.Entry<String, String> entry: options.ioOptions.loggingLevel.entrySet()) {
            int level;
            try {
                level = Integer.parseInt(entry.getValue());
            } catch (NumberFormatException ex) {
                throw new CompilationError("Illegal logging level for " + entry.getKey() + ": " + entry.getValue());
            }
            Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
        }
    }

    public OTCompiler() {
        this(CompilerOptions.getDefault());
    }

    @Override
    public OTCompiler compiler() {
        return this;
    }

    @Nullable
    <T> T runPass(String pass, Supplier<T> body) {
        try {
            T result = body.get();
            this.log(3)
                    .append(pass)
                    .append(" completed")
                    .newline();
            return result;
        } catch (BaseCompilerException e) {
            this.messages.reportError(e);
            if (this.options.languageOptions.throwOnError) {
                System.err.println(this.messages);
                throw e;
            }
            return null;
        }
    }

    /** Infer the types of all subexpressions of 'template'.
     * @param hints  Types known in advance.
     * @return null if inference fails. */
    @Nullable
    public TypeDict inferTypes(OTExpression template, Map<OTExpression, TypeInfo> hints) {
        return this.runPass("Type inference", () -> new TypeInference(this).infer(template, hints));
    }

    @Nullable
    public TypeDict inferTypes(OTExpression template) {
        return this.inferTypes(template, Map.of());
    }

    /** Rewrite every flux applied to a boundary pair to compute its boundary data in the flux kernel.
     * @return null if the rewrite fails. */
    @Nullable
    public OTExpression rewriteBoundaryFluxes(OTExpression template) {
        return this.runPass("Boundary flux rewriting", () -> new BoundaryToFlux(this).rewrite(template));
    }

    /** A JSON rendering of 'template', for tools that inspect templates. */
    public JsonNode toJson(OTExpression template) {
        return new ToJsonInnerVisitor(this).toJson(template);
    }

    public boolean hasErrors() {
        return this.messages.exitCode != 0;
    }

    public void showErrors(PrintStream stream) {
        this.messages.show(stream);
    }

    /**
     * Throw if any error has been encountered.
     * Displays the errors on stderr as well.
     */
    public void throwIfErrorsOccurred() {
        if (this.hasErrors()) {
            this.showErrors(System.err);
            throw new CompilationError("Error during compilation");
        }
    }
}
