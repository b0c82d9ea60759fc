package org.dgflux.otCompiler.ir.expression;

import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.util.Linq;

import java.util.List;

public final class OTSumExpression extends OTNaryExpression {
    public OTSumExpression(List<OTExpression> children) {
        super(children);
    }

    public OTSumExpression(OTExpression... children) {
        this(Linq.list(children));
    }

    @Override
    public OTSumExpression replaceChildren(List<OTExpression> children) {
        return new OTSumExpression(children);
    }

    @Override
    String symbol() {
        return "+";
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (OTExpression child: this.children)
            child.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }
}
