package org.dgflux.otCompiler.ir.expression;

import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.util.IIndentStream;

import java.util.Objects;

/** Selects {@code then} where {@code criterion} is positive, {@code else} elsewhere. */
public final class OTIfPositiveExpression extends OTExpression {
    public final OTExpression criterion;
    public final OTExpression then;
    public final OTExpression otherwise;

    public OTIfPositiveExpression(OTExpression criterion, OTExpression then, OTExpression otherwise) {
        this.criterion = criterion;
        this.then = then;
        this.otherwise = otherwise;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.criterion.accept(visitor);
        this.then.accept(visitor);
        this.otherwise.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTIfPositiveExpression.class, this.criterion, this.then, this.otherwise);
    }

    @Override
    protected boolean sameStructure(OTExpression other) {
        OTIfPositiveExpression o = (OTIfPositiveExpression) other;
        return this.criterion.equals(o.criterion) &&
                this.then.equals(o.then) &&
                this.otherwise.equals(o.otherwise);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("if_positive")
                .append("(")
                .append(this.criterion)
                .append(", ")
                .append(this.then)
                .append(", ")
                .append(this.otherwise)
                .append(")");
    }
}
