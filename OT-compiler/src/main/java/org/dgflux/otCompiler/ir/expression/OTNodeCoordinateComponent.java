package org.dgflux.otCompiler.ir.expression;

import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.Objects;

/** Coordinate {@code axis} of the discretization nodes. */
public final class OTNodeCoordinateComponent extends OTLeafExpression {
    public final int axis;
    @Nullable
    public final String quadratureTag;

    public OTNodeCoordinateComponent(int axis, @Nullable String quadratureTag) {
        this.axis = axis;
        this.quadratureTag = quadratureTag;
    }

    public OTNodeCoordinateComponent(int axis) {
        this(axis, null);
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
        return Objects.hash(OTNodeCoordinateComponent.class, this.axis, this.quadratureTag);
    }

    @Override
    protected boolean sameStructure(OTExpression other) {
        OTNodeCoordinateComponent o = (OTNodeCoordinateComponent) other;
        return this.axis == o.axis && Objects.equals(this.quadratureTag, o.quadratureTag);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("x[").append(this.axis).append("]");
        if (this.quadratureTag != null)
            builder.append("@").append(this.quadratureTag);
        return builder;
    }
}
