package org.dgflux.otCompiler.ir.expression;

import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.util.IIndentStream;

import java.util.Objects;

/** Conditional expression: {@code condition ? then : else}. */
public final class OTIfExpression extends OTExpression {
    public final OTExpression condition;
    public final OTExpression then;
    public final OTExpression otherwise;

    public OTIfExpression(OTExpression condition, OTExpression then, OTExpression otherwise) {
        this.condition = condition;
        this.then = then;
        this.otherwise = otherwise;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.condition.accept(visitor);
        this.then.accept(visitor);
        this.otherwise.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTIfExpression.class, this.condition, this.then, this.otherwise);
    }

    @Override
    protected boolean sameStructure(OTExpression other) {
        OTIfExpression o = (OTIfExpression) other;
        return this.condition.equals(o.condition) &&
                this.then.equals(o.then) &&
                this.otherwise.equals(o.otherwise);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("If")
                .append("(")
                .append(this.condition)
                .append(", ")
                .append(this.then)
                .append(", ")
                .append(this.otherwise)
                .append(")");
    }
}
