package org.dgflux.otCompiler.ir.expression;

import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.util.IIndentStream;

/** A named field supplied by the user of the operator template. */
public final class OTVariable extends OTLeafExpression {
    public final String name;

    public OTVariable(String name) {
        this.name = name;
    }

    /** The component {@code index} of this variable. */
    public OTSubscriptExpression subscript(int index) {
        return new OTSubscriptExpression(this, index);
    }

    @Override
    protected VisitDecision preorder(InnerVisitor visitor) {
        return visitor.preorder(this);
    }

    @Override
    protected void postorder(InnerVisitor visitor) {
        visitor.postorder(this);
    }

    @Override
    protected int computeHash() {
        return this.name.hashCode();
    }

    @Override
    protected boolean sameStructure(OTExpression other) {
        return this.name.equals(((OTVariable) other).name);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name);
    }
}
