package org.dgflux.otCompiler.ir.operator;

import org.dgflux.util.IIndentStream;

import java.util.Objects;

/** Interpolates nodal data to the quadrature grid {@code quadratureTag}.
 * The domain of the result is that of the operand. */
public final class OTQuadratureGridUpsampler extends OTOperator implements IHasQuadratureTag {
    public final String quadratureTag;

    public OTQuadratureGridUpsampler(String quadratureTag) {
        this.quadratureTag = quadratureTag;
    }

    @Override
    public String getQuadratureTag() {
        return this.quadratureTag;
    }

    @Override
    public OperatorFamily family() {
        return OperatorFamily.QUADRATURE_UPSAMPLER;
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTQuadratureGridUpsampler.class, this.quadratureTag);
    }

    @Override
    protected boolean sameStructure(OTOperator other) {
        return this.quadratureTag.equals(((OTQuadratureGridUpsampler) other).quadratureTag);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("ToQuad@").append(this.quadratureTag);
    }
}
