package org.dgflux.otCompiler.ir.expression;

import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.util.IIndentStream;

import java.util.Objects;

public final class OTQuotientExpression extends OTExpression {
    public final OTExpression numerator;
    public final OTExpression denominator;

    public OTQuotientExpression(OTExpression numerator, OTExpression denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.numerator.accept(visitor);
        this.denominator.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTQuotientExpression.class, this.numerator, this.denominator);
    }

    @Override
    protected boolean sameStructure(OTExpression other) {
        OTQuotientExpression o = (OTQuotientExpression) other;
        return this.numerator.equals(o.numerator) &&
                this.denominator.equals(o.denominator);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .append(this.numerator)
                .append(" / ")
                .append(this.denominator)
                .append(")");
    }
}
