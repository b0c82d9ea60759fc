package org.dgflux.otCompiler.ir.operator;

import org.dgflux.otCompiler.ir.flux.FluxExpression;
import org.dgflux.util.IIndentStream;

import java.util.Objects;

/** A flux evaluated on the face quadrature grid {@code quadratureTag}. */
public final class OTQuadratureFluxOperator extends OTFluxOperatorBase implements IHasQuadratureTag {
    public final String quadratureTag;
    public final boolean isLift;

    public OTQuadratureFluxOperator(FluxExpression flux, String quadratureTag, boolean isLift) {
        super(flux);
        this.quadratureTag = quadratureTag;
        this.isLift = isLift;
    }

    @Override
    public String getQuadratureTag() {
        return this.quadratureTag;
    }

    @Override
    public OTFluxOperatorBase withFlux(FluxExpression flux) {
        return new OTQuadratureFluxOperator(flux, this.quadratureTag, this.isLift);
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTQuadratureFluxOperator.class, this.flux, this.quadratureTag, this.isLift);
    }

    @Override
    protected boolean sameStructure(OTOperator other) {
        OTQuadratureFluxOperator o = (OTQuadratureFluxOperator) other;
        return this.isLift == o.isLift &&
                this.quadratureTag.equals(o.quadratureTag) &&
                this.flux.equals(o.flux);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.isLift ? "QuadLift" : "QuadFlux")
                .append("@")
                .append(this.quadratureTag)
                .append("<")
                .append(this.flux)
                .append(">");
    }
}
