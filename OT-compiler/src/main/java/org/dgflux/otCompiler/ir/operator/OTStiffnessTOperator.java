package org.dgflux.otCompiler.ir.operator;

import org.dgflux.util.IIndentStream;

import java.util.Objects;

/** Transposed stiffness matrix along {@code axis}. */
public final class OTStiffnessTOperator extends OTOperator {
    public final int axis;
    public final boolean reference;

    public OTStiffnessTOperator(int axis, boolean reference) {
        this.axis = axis;
        this.reference = reference;
    }

    public OTStiffnessTOperator(int axis) {
        this(axis, false);
    }

    @Override
    public OperatorFamily family() {
        return OperatorFamily.SPECIALIZABLE_VOLUME;
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTStiffnessTOperator.class, this.axis, this.reference);
    }

    @Override
    protected boolean sameStructure(OTOperator other) {
        OTStiffnessTOperator o = (OTStiffnessTOperator) other;
        return this.axis == o.axis && this.reference == o.reference;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.reference ? "RefStiffT" : "StiffT")
                .append(this.axis);
    }
}
