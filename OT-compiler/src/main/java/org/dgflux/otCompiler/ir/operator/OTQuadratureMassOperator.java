package org.dgflux.otCompiler.ir.operator;

import org.dgflux.util.IIndentStream;

import java.util.Objects;

/** Mass matrix applied to data sampled on a quadrature grid. */
public final class OTQuadratureMassOperator extends OTOperator implements IHasQuadratureTag {
    public final String quadratureTag;

    public OTQuadratureMassOperator(String quadratureTag) {
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
        return Objects.hash(OTQuadratureMassOperator.class, this.quadratureTag);
    }

    @Override
    protected boolean sameStructure(OTOperator other) {
        return this.quadratureTag.equals(((OTQuadratureMassOperator) other).quadratureTag);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("RefQuadM@").append(this.quadratureTag);
    }
}
