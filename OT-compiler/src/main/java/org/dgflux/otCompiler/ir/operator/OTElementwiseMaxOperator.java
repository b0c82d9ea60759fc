package org.dgflux.otCompiler.ir.operator;

import org.dgflux.util.IIndentStream;

/** Replaces each value by the maximum over its element. */
public final class OTElementwiseMaxOperator extends OTOperator {
    @Override
    public OperatorFamily family() {
        return OperatorFamily.ELEMENTWISE_MAX;
    }

    @Override
    protected int computeHash() {
        return OTElementwiseMaxOperator.class.hashCode();
    }

    @Override
    protected boolean sameStructure(OTOperator other) {
        return true;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("ElementwiseMax");
    }
}
