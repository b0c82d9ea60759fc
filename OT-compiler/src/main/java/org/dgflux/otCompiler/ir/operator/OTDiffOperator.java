package org.dgflux.otCompiler.ir.operator;

import org.dgflux.util.IIndentStream;

import java.util.Objects;

/** Differentiation along {@code axis}, in physical or reference coordinates. */
public final class OTDiffOperator extends OTOperator {
    public final int axis;
    /** True if the derivative is taken in reference coordinates. */
    public final boolean reference;

    public OTDiffOperator(int axis, boolean reference) {
        this.axis = axis;
        this.reference = reference;
    }

    public OTDiffOperator(int axis) {
        this(axis, false);
    }

    @Override
    public OperatorFamily family() {
        return OperatorFamily.NODAL_ONLY;
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTDiffOperator.class, this.axis, this.reference);
    }

    @Override
    protected boolean sameStructure(OTOperator other) {
        OTDiffOperator o = (OTDiffOperator) other;
        return this.axis == o.axis && this.reference == o.reference;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.reference ? "RefDiff" : "Diff")
                .append(this.axis);
    }
}
