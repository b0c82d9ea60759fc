package org.dgflux.otCompiler.ir.operator;

import org.dgflux.otCompiler.ir.flux.FluxExpression;

/** An operator which evaluates a flux kernel on faces.
 * The operand is either a volume field (interior faces)
 * or a boundary pair. */
public abstract class OTFluxOperatorBase extends OTOperator {
    public final FluxExpression flux;

    protected OTFluxOperatorBase(FluxExpression flux) {
        this.flux = flux;
    }

    @Override
    public OperatorFamily family() {
        return OperatorFamily.FLUX;
    }

    /** An operator of the same class with the same parameters, but a different flux kernel. */
    public abstract OTFluxOperatorBase withFlux(FluxExpression flux);
}
