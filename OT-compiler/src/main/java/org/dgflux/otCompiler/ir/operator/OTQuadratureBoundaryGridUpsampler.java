package org.dgflux.otCompiler.ir.operator;

import org.dgflux.otCompiler.ir.type.BoundaryTag;
import org.dgflux.util.IIndentStream;

import java.util.Objects;

/** Interpolates nodal data on boundary {@code boundaryTag} to the quadrature grid. */
public final class OTQuadratureBoundaryGridUpsampler extends OTOperator implements IHasQuadratureTag {
    public final String quadratureTag;
    public final BoundaryTag boundaryTag;

    public OTQuadratureBoundaryGridUpsampler(String quadratureTag, BoundaryTag boundaryTag) {
        this.quadratureTag = quadratureTag;
        this.boundaryTag = boundaryTag;
    }

    @Override
    public String getQuadratureTag() {
        return this.quadratureTag;
    }

    @Override
    public OperatorFamily family() {
        return OperatorFamily.QUADRATURE_BOUNDARY_UPSAMPLER;
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTQuadratureBoundaryGridUpsampler.class, this.quadratureTag, this.boundaryTag);
    }

    @Override
    protected boolean sameStructure(OTOperator other) {
        OTQuadratureBoundaryGridUpsampler o = (OTQuadratureBoundaryGridUpsampler) other;
        return this.quadratureTag.equals(o.quadratureTag) && this.boundaryTag.equals(o.boundaryTag);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("ToBdryQuad@")
                .append(this.quadratureTag)
                .append("<")
                .append(this.boundaryTag.toString())
                .append(">");
    }
}
