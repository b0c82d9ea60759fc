package org.dgflux.otCompiler.ir.operator;

import org.dgflux.util.IIndentStream;

import java.util.Objects;

/** A linear operator applied separately to each element, e.g., a filter. */
public final class OTElementwiseLinearOperator extends OTOperator {
    public final String name;

    public OTElementwiseLinearOperator(String name) {
        this.name = name;
    }

    @Override
    public OperatorFamily family() {
        return OperatorFamily.ELEMENTWISE_LINEAR;
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTElementwiseLinearOperator.class, this.name);
    }

    @Override
    protected boolean sameStructure(OTOperator other) {
        return this.name.equals(((OTElementwiseLinearOperator) other).name);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name);
    }
}
