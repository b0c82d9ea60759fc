package org.dgflux.otCompiler.ir.operator;

import org.dgflux.util.IIndentStream;

import java.util.Objects;

/** The mass matrix or its inverse. */
public final class OTMassOperator extends OTOperator {
    public enum Kind {
        MASS,
        INVERSE_MASS
    }

    public final Kind kind;
    public final boolean reference;

    public OTMassOperator(Kind kind, boolean reference) {
        this.kind = kind;
        this.reference = reference;
    }

    public OTMassOperator(Kind kind) {
        this(kind, false);
    }

    @Override
    public OperatorFamily family() {
        // Only the mass matrix itself can be specialized to a quadrature grid
        return switch (this.kind) {
            case MASS -> OperatorFamily.SPECIALIZABLE_VOLUME;
            case INVERSE_MASS -> OperatorFamily.NODAL_ONLY;
        };
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTMassOperator.class, this.kind, this.reference);
    }

    @Override
    protected boolean sameStructure(OTOperator other) {
        OTMassOperator o = (OTMassOperator) other;
        return this.kind == o.kind && this.reference == o.reference;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.reference)
            builder.append("Ref");
        return builder.append(this.kind == Kind.MASS ? "M" : "InvM");
    }
}
