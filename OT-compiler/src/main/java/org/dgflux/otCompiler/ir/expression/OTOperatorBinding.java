package org.dgflux.otCompiler.ir.expression;

import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.otCompiler.ir.operator.OTOperator;
import org.dgflux.util.IIndentStream;

import java.util.Objects;

/** An operator applied to a field. */
public final class OTOperatorBinding extends OTExpression {
    public final OTOperator operator;
    public final OTExpression field;

    public OTOperatorBinding(OTOperator operator, OTExpression field) {
        this.operator = operator;
        this.field = field;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.field.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTOperatorBinding.class, this.operator, this.field);
    }

    @Override
    protected boolean sameStructure(OTExpression other) {
        OTOperatorBinding o = (OTOperatorBinding) other;
        return this.operator.equals(o.operator) && this.field.equals(o.field);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.operator)
                .append("(")
                .append(this.field)
                .append(")");
    }
}
