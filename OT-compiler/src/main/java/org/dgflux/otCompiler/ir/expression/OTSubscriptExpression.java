package org.dgflux.otCompiler.ir.expression;

import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.util.IIndentStream;

import java.util.Objects;

/** Component {@code index} of a vector-valued variable. */
public final class OTSubscriptExpression extends OTExpression {
    public final OTVariable aggregate;
    public final int index;

    public OTSubscriptExpression(OTVariable aggregate, int index) {
        this.aggregate = aggregate;
        this.index = index;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.aggregate.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTSubscriptExpression.class, this.aggregate, this.index);
    }

    @Override
    protected boolean sameStructure(OTExpression other) {
        OTSubscriptExpression o = (OTSubscriptExpression) other;
        return this.index == o.index && this.aggregate.equals(o.aggregate);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.aggregate)
                .append("[")
                .append(this.index)
                .append("]");
    }
}
