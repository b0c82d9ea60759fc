package org.dgflux.otCompiler.ir.operator;

import org.dgflux.util.IIndentStream;

import java.util.Objects;

/** Transposed stiffness matrix applied to data sampled on a quadrature grid. */
public final class OTQuadratureStiffnessTOperator extends OTOperator implements IHasQuadratureTag {
    public final int axis;
    public final String quadratureTag;

    public OTQuadratureStiffnessTOperator(int axis, String quadratureTag) {
        this.axis = axis;
        this.quadratureTag = quadratureTag;
    }

    @Override
    public String getQuadratureTag() {
        return this.quadratureTag;
    }

    @Override
    public OperatorFamily family() {
        return OperatorFamily.QUADRATURE_VOLUME;
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTQuadratureStiffnessTOperator.class, this.axis, this.quadratureTag);
    }

    @Override
    protected boolean sameStructure(OTOperator other) {
        OTQuadratureStiffnessTOperator o = (OTQuadratureStiffnessTOperator) other;
        return this.axis == o.axis && this.quadratureTag.equals(o.quadratureTag);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("RefQuadStiffT")
                .append(this.axis)
                .append("@")
                .append(this.quadratureTag);
    }
}
