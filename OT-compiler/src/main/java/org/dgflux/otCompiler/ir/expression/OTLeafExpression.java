package org.dgflux.otCompiler.ir.expression;

import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;

/** An expression with no children. */
public abstract class OTLeafExpression extends OTExpression {
    protected OTLeafExpression() {
        super();
    }

    /** Dispatch to the visitor's preorder method for this leaf kind. */
    protected abstract VisitDecision preorder(InnerVisitor visitor);

    /** Dispatch to the visitor's postorder method for this leaf kind. */
    protected abstract void postorder(InnerVisitor visitor);

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = this.preorder(visitor);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        this.postorder(visitor);
    }
}
