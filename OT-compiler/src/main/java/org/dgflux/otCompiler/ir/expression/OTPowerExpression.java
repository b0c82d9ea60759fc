package org.dgflux.otCompiler.ir.expression;

import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.util.IIndentStream;

import java.util.Objects;

public final class OTPowerExpression extends OTExpression {
    public final OTExpression base;
    public final OTExpression exponent;

    public OTPowerExpression(OTExpression base, OTExpression exponent) {
        this.base = base;
        this.exponent = exponent;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.base.accept(visitor);
        this.exponent.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTPowerExpression.class, this.base, this.exponent);
    }

    @Override
    protected boolean sameStructure(OTExpression other) {
        OTPowerExpression o = (OTPowerExpression) other;
        return this.base.equals(o.base) && this.exponent.equals(o.exponent);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .append(this.base)
                .append(" ** ")
                .append(this.exponent)
                .append(")");
    }
}
