package org.dgflux.otCompiler.ir.operator;

import org.dgflux.util.IIndentStream;

import java.util.Objects;

/** Reduces a volume vector to a single number. */
public final class OTNodalReductionOperator extends OTOperator {
    public enum ReductionKind {
        SUM,
        MAX,
        MIN,
        INTEGRAL
    }

    public final ReductionKind kind;

    public OTNodalReductionOperator(ReductionKind kind) {
        this.kind = kind;
    }

    @Override
    public OperatorFamily family() {
        return OperatorFamily.NODAL_REDUCTION;
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTNodalReductionOperator.class, this.kind);
    }

    @Override
    protected boolean sameStructure(OTOperator other) {
        return this.kind == ((OTNodalReductionOperator) other).kind;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("Nodal")
                .append(this.kind.name().charAt(0) + this.kind.name().substring(1).toLowerCase());
    }
}
