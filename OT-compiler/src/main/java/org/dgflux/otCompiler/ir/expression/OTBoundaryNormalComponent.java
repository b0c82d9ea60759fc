package org.dgflux.otCompiler.ir.expression;

import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.otCompiler.ir.type.BoundaryTag;
import org.dgflux.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.Objects;

/** Component {@code axis} of the outward normal on the boundary {@code tag}. */
public final class OTBoundaryNormalComponent extends OTLeafExpression {
    public final BoundaryTag tag;
    public final int axis;
    /** Quadrature grid the normal is sampled on; null if not known yet. */
    @Nullable
    public final String quadratureTag;

    public OTBoundaryNormalComponent(BoundaryTag tag, int axis, @Nullable String quadratureTag) {
        this.tag = tag;
        this.axis = axis;
        this.quadratureTag = quadratureTag;
    }

    public OTBoundaryNormalComponent(BoundaryTag tag, int axis) {
        this(tag, axis, null);
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
        return Objects.hash(OTBoundaryNormalComponent.class, this.tag, this.axis, this.quadratureTag);
    }

    @Override
    protected boolean sameStructure(OTExpression other) {
        OTBoundaryNormalComponent o = (OTBoundaryNormalComponent) other;
        return this.axis == o.axis &&
                this.tag.equals(o.tag) &&
                Objects.equals(this.quadratureTag, o.quadratureTag);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("normal(")
                .append(this.tag.toString())
                .append(")[")
                .append(this.axis)
                .append("]");
        if (this.quadratureTag != null)
            builder.append("@").append(this.quadratureTag);
        return builder;
    }
}
