package org.dgflux.otCompiler.ir.expression;

import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.util.Linq;

import java.util.List;

public final class OTProductExpression extends OTNaryExpression {
    public OTProductExpression(List<OTExpression> children) {
        super(children);
    }

    public OTProductExpression(OTExpression... children) {
        this(Linq.list(children));
    }

    @Override
    public OTProductExpression replaceChildren(List<OTExpression> children) {
        return new OTProductExpression(children);
    }

    @Override
    String symbol() {
        return "*";
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
