package org.dgflux.otCompiler.ir.expression;

import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.util.IIndentStream;

/** A numeric literal. */
public final class OTConstant extends OTLeafExpression {
    public final double value;

    public OTConstant(double value) {
        // normalize -0.0, so that it compares equal to 0.0
        this.value = value == 0 ? 0.0 : value;
    }

    public static OTConstant zero() {
        return new OTConstant(0);
    }

    @Override
    public boolean isZero() {
        return this.value == 0;
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
        return Double.hashCode(this.value);
    }

    @Override
    protected boolean sameStructure(OTExpression other) {
        return this.value == ((OTConstant) other).value;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.value == Math.rint(this.value) && !Double.isInfinite(this.value))
            return builder.append((long) this.value);
        return builder.append(this.value);
    }
}
