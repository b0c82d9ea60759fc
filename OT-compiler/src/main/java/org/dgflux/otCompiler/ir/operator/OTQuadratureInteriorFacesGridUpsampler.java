package org.dgflux.otCompiler.ir.operator;

import org.dgflux.util.IIndentStream;

import java.util.Objects;

/** Interpolates nodal volume data to the interior faces of the quadrature grid. */
public final class OTQuadratureInteriorFacesGridUpsampler extends OTOperator implements IHasQuadratureTag {
    public final String quadratureTag;

    public OTQuadratureInteriorFacesGridUpsampler(String quadratureTag) {
        this.quadratureTag = quadratureTag;
    }

    @Override
    public String getQuadratureTag() {
        return this.quadratureTag;
    }

    @Override
    public OperatorFamily family() {
        return OperatorFamily.QUADRATURE_INTERIOR_FACES_UPSAMPLER;
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTQuadratureInteriorFacesGridUpsampler.class, this.quadratureTag);
    }

    @Override
    protected boolean sameStructure(OTOperator other) {
        return this.quadratureTag.equals(((OTQuadratureInteriorFacesGridUpsampler) other).quadratureTag);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("ToIntFaceQuad@").append(this.quadratureTag);
    }
}
