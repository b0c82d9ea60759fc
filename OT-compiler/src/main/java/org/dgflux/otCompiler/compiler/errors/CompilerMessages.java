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

package org.dgflux.otCompiler.compiler.errors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dgflux.otCompiler.compiler.CompilerOptions;
import org.dgflux.otCompiler.ir.IOTNode;
import org.dgflux.util.Utilities;

import javax.annotation.Nullable;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/** A list of messages produced while compiling an operator template. */
public class CompilerMessages {
    public static class Message {
        public final boolean warning;
        public final String errorType;
        public final String message;
        /** Printed form of the IR node the message refers to; empty if unknown. */
        public final String node;

        protected Message(boolean warning, String errorType, String message, @Nullable IOTNode node) {
            this.warning = warning;
            this.errorType = errorType;
            this.message = message;
            this.node = node == null ? "" : node.toString();
        }

        Message(BaseCompilerException e) {
            this(false, e.getErrorKind(), e.getMessage(), e.getNode());
        }

        Message(Throwable e) {
            this(false, "This is a bug in the compiler (please report it to the developers)",
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), null);
        }

        public void format(StringBuilder output) {
            if (this.warning)
                output.append("warning:");
            else
                output.append("error:");
            output.append(" ")
                    .append(this.errorType)
                    .append(": ")
                    .append(this.message)
                    .append(System.lineSeparator());
            if (!this.node.isEmpty() && !this.message.contains(this.node)) {
                output.append("    in: ")
                        .append(this.node)
                        .append(System.lineSeparator());
            }
        }

        public JsonNode toJson(ObjectMapper mapper) {
            ObjectNode result = mapper.createObjectNode();
            result.put("warning", this.warning);
            result.put("error_type", this.errorType);
            result.put("message", this.message);
            result.put("node", this.node);
            return result;
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder();
            this.format(builder);
            return builder.toString();
        }
    }

    final CompilerOptions options;
    public final List<Message> messages;
    public int exitCode = 0;

    public CompilerMessages(CompilerOptions options) {
        this.options = options;
        this.messages = new ArrayList<>();
    }

    public void clear() {
        this.messages.clear();
        this.exitCode = 0;
    }

    void reportError(Message message) {
        this.messages.add(message);
        if (!message.warning)
            this.exitCode = 1;
    }

    public void reportProblem(@Nullable IOTNode node, boolean warning, String errorType, String message) {
        this.reportError(new Message(warning, errorType, message, node));
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
                (this.options.ioOptions.quiet ? 0 : this.warningCount()) > 0)
            stream.println(this);
    }

    @Override
    public String toString() {
        if (this.options.ioOptions.emitJsonErrors)
            return this.toJson().toPrettyString();
        StringBuilder builder = new StringBuilder();
        for (Message message: this.messages) {
            if (this.options.ioOptions.quiet && message.warning)
                continue;
            message.format(builder);
        }
        return builder.toString();
    }

    public boolean isEmpty() {
        return this.messages.isEmpty();
    }

    public JsonNode toJson() {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        ArrayNode result = mapper.createArrayNode();
        for (Message message: this.messages)
            result.add(message.toJson(mapper));
        return result;
    }
}
