package org.dgflux.otCompiler.ir.expression;

import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.util.IIndentStream;

/** Placeholder for component {@code axis} of the face normal inside a flux.
 * It has no boundary tag, so it cannot appear in boundary terms;
 * use {@link OTBoundaryNormalComponent} there. */
public final class OTNormal extends OTLeafExpression {
    public final int axis;

    public OTNormal(int axis) {
        this.axis = axis;
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
        return 17 * OTNormal.class.hashCode() + this.axis;
    }

    @Override
    protected boolean sameStructure(OTExpression other) {
        return this.axis == ((OTNormal) other).axis;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("normal[").append(this.axis).append("]");
    }
}
