package org.dgflux.otCompiler.ir.expression;

import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.util.IIndentStream;

/** A named scalar, such as a time step or a material constant. */
public final class OTScalarParameter extends OTLeafExpression {
    public final String name;

    public OTScalarParameter(String name) {
        this.name = name;
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
        return 31 * OTScalarParameter.class.hashCode() + this.name.hashCode();
    }

    @Override
    protected boolean sameStructure(OTExpression other) {
        return this.name.equals(((OTScalarParameter) other).name);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("$").append(this.name);
    }
}
