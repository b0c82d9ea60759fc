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

package org.dgflux.util;

import org.dgflux.otCompiler.compiler.errors.CompilationError;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-class debug output for the compiler passes.
 * A class logs at a level if it, or one of its superclasses, was given at least that level.
 * All messages go to a single indented stream, stderr unless redirected.
 */
public class Logger {
    /** Packages searched by {@link #setLoggingLevel(String, int)}, in order. */
    static final List<String> LOGGING_PACKAGES = List.of(
            "org.dgflux.otCompiler.compiler",
            "org.dgflux.otCompiler.compiler.visitors.inner",
            "org.dgflux.otCompiler.ir.flux");

    public static final Logger INSTANCE = new Logger();

    private final Map<Class<?>, Integer> levels;
    private final IndentStream debugStream;
    private final IIndentStream disabled;

    private Logger() {
        this.levels = new HashMap<>();
        this.debugStream = new IndentStream(System.err);
        this.disabled = new NullIndentStream();
    }

    int levelOf(Class<?> clazz) {
        for (Class<?> c = clazz; c != null; c = c.getSuperclass()) {
            Integer level = this.levels.get(c);
            if (level != null)
                return level;
        }
        return 0;
    }

    /** The stream for a message of 'level' written by 'clazz'; discards the message if that
     * class does not log at this level. */
    public IIndentStream belowLevel(Class<?> clazz, int level) {
        return this.levelOf(clazz) >= level ? this.debugStream : this.disabled;
    }

    public IIndentStream belowLevel(IWritesLogs module, int level) {
        return this.belowLevel(module.getClass(), level);
    }

    /** @return The previous level of 'clazz'. */
    public int setLoggingLevel(Class<?> clazz, int level) {
        Integer previous = this.levels.put(clazz, level);
        return previous == null ? 0 : previous;
    }

    /** Set the level of a class given by its simple name, as in -TTypeInference=2. */
    @SuppressWarnings("UnusedReturnValue")
    public int setLoggingLevel(String className, int level) {
        for (String pack: LOGGING_PACKAGES) {
            Class<?> clazz = findClass(pack + "." + className);
            if (clazz != null)
                return this.setLoggingLevel(clazz, level);
        }
        throw new CompilationError("Class " + className + " not found for setting up logging");
    }

    @Nullable
    static Class<?> findClass(String name) {
        try {
            return Class.forName(name);
        } catch (ClassNotFoundException ex) {
            return null;
        }
    }

    /** Redirect the debug output.  The indentation is kept.
     * @return The previous destination. */
    public Appendable setDebugStream(Appendable writer) {
        return this.debugStream.setOutputStream(writer);
    }
}
