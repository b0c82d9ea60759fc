package org.dgflux.otCompiler.ir.operator;

import org.dgflux.otCompiler.ir.type.BoundaryTag;
import org.dgflux.util.IIndentStream;

import java.util.Objects;

/** Sends its operand to partition {@code rank} and yields component
 * {@code index} of the data received back. */
public final class OTFluxExchangeOperator extends OTOperator {
    public final int index;
    public final int rank;

    public OTFluxExchangeOperator(int index, int rank) {
        this.index = index;
        this.rank = rank;
    }

    /** The boundary shared with the neighboring partition. */
    public BoundaryTag getBoundaryTag() {
        return BoundaryTag.forRank(this.rank);
    }

    @Override
    public OperatorFamily family() {
        return OperatorFamily.FLUX_EXCHANGE;
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTFluxExchangeOperator.class, this.index, this.rank);
    }

    @Override
    protected boolean sameStructure(OTOperator other) {
        OTFluxExchangeOperator o = (OTFluxExchangeOperator) other;
        return this.index == o.index && this.rank == o.rank;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("Exchange<")
                .append(this.rank)
                .append(">[")
                .append(this.index)
                .append("]");
    }
}
