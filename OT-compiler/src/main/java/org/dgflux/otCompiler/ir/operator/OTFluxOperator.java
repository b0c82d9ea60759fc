package org.dgflux.otCompiler.ir.operator;

import org.dgflux.otCompiler.ir.flux.FluxExpression;
import org.dgflux.util.IIndentStream;

import java.util.Objects;

public final class OTFluxOperator extends OTFluxOperatorBase {
    /** True if the flux is lifted to the volume by the inverse mass matrix. */
    public final boolean isLift;

    public OTFluxOperator(FluxExpression flux, boolean isLift) {
        super(flux);
        this.isLift = isLift;
    }

    public OTFluxOperator(FluxExpression flux) {
        this(flux, false);
    }

    @Override
    public OTFluxOperatorBase withFlux(FluxExpression flux) {
        return new OTFluxOperator(flux, this.isLift);
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTFluxOperator.class, this.flux, this.isLift);
    }

    @Override
    protected boolean sameStructure(OTOperator other) {
        OTFluxOperator o = (OTFluxOperator) other;
        return this.isLift == o.isLift && this.flux.equals(o.flux);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.isLift ? "Lift" : "Flux")
                .append("<")
                .append(this.flux)
                .append(">");
    }
}
