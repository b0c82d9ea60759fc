package org.dgflux.otCompiler.ir.expression;

import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.util.IIndentStream;

import java.util.Objects;

/** A per-element geometric quantity: the jacobian or a metric derivative. */
public final class OTGeometricFactor extends OTLeafExpression {
    public enum Kind {
        JACOBIAN("J"),
        /** d x_xyz / d r_rst */
        FORWARD_METRIC_DERIVATIVE("dx/dr"),
        /** d r_rst / d x_xyz */
        INVERSE_METRIC_DERIVATIVE("dr/dx");

        private final String text;

        Kind(String text) {
            this.text = text;
        }

        @Override
        public String toString() {
            return this.text;
        }
    }

    public final Kind kind;
    /** Physical axis; -1 for the jacobian. */
    public final int xyzAxis;
    /** Reference axis; -1 for the jacobian. */
    public final int rstAxis;

    public OTGeometricFactor(Kind kind, int xyzAxis, int rstAxis) {
        this.kind = kind;
        this.xyzAxis = xyzAxis;
        this.rstAxis = rstAxis;
    }

    public static OTGeometricFactor jacobian() {
        return new OTGeometricFactor(Kind.JACOBIAN, -1, -1);
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
        return Objects.hash(OTGeometricFactor.class, this.kind, this.xyzAxis, this.rstAxis);
    }

    @Override
    protected boolean sameStructure(OTExpression other) {
        OTGeometricFactor o = (OTGeometricFactor) other;
        return this.kind == o.kind &&
                this.xyzAxis == o.xyzAxis &&
                this.rstAxis == o.rstAxis;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.kind.toString());
        if (this.kind != Kind.JACOBIAN)
            builder.append("[")
                    .append(this.xyzAxis)
                    .append(",")
                    .append(this.rstAxis)
                    .append("]");
        return builder;
    }
}
