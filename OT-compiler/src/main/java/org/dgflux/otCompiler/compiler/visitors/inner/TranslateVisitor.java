package org.dgflux.otCompiler.compiler.visitors.inner;

import org.dgflux.otCompiler.compiler.OTCompiler;
import org.dgflux.otCompiler.compiler.errors.InternalCompilerError;
import org.dgflux.otCompiler.ir.IOTInnerNode;
import org.dgflux.otCompiler.ir.expression.OTExpression;
import org.dgflux.util.IndentStream;
import org.dgflux.util.IndentStreamBuilder;
import org.dgflux.util.Utilities;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;

/** A Visitor which computes a translation for each expression.
 * Expressions are compared structurally, so a translation computed for
 * one occurrence of an expression is reused for all equal expressions.
 * The map is cleared at the start of each visit.
 * @param <T> The type of objects produced by the translation. */
public abstract class TranslateVisitor<T> extends InnerVisitor {
    final Map<OTExpression, T> translation;

    protected TranslateVisitor(OTCompiler compiler) {
        super(compiler);
        this.translation = new LinkedHashMap<>();
    }

    protected void set(OTExpression node, T translation) {
        T old = this.translation.get(node);
        if (old != null) {
            if (!old.equals(translation))
                throw new InternalCompilerError("Changing value of " + node + " from " +
                        old + " to " + translation, node);
            return;
        }
        Utilities.putNew(this.translation, node, translation);
    }

    public T get(OTExpression node) {
        return Utilities.getExists(this.translation, node);
    }

    @Nullable
    public T maybeGet(OTExpression node) {
        return this.translation.get(node);
    }

    /** Translate a subexpression, using the cached translation if there is one. */
    protected T analyze(OTExpression node) {
        T result = this.maybeGet(node);
        if (result != null)
            return result;
        node.accept(this);
        return this.get(node);
    }

    @Override
    public void startVisit(IOTInnerNode node) {
        super.startVisit(node);
        this.translation.clear();
    }

    public String translationString() {
        IndentStream stream = new IndentStreamBuilder();
        stream.append("[").increase();
        for (Map.Entry<OTExpression, T> e: this.translation.entrySet()) {
            stream.append(e.getKey())
                    .append(" => ")
                    .append(e.getValue().toString())
                    .newline();
        }
        return stream.decrease().append("]").toString();
    }
}
