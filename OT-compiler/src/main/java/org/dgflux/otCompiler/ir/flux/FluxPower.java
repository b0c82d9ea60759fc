package org.dgflux.otCompiler.ir.flux;

import org.dgflux.util.IIndentStream;

import java.util.Objects;

public final class FluxPower extends FluxExpression {
    public final FluxExpression base;
    public final FluxExpression exponent;

    public FluxPower(FluxExpression base, FluxExpression exponent) {
        this.base = base;
        this.exponent = exponent;
    }

    @Override
    public FluxExpression rewrite(FluxRewriter rewriter) {
        return rewriter.rewrite(this);
    }

    @Override
    protected int computeHash() {
        return Objects.hash(11, this.base, this.exponent);
    }

    @Override
    protected boolean sameStructure(FluxExpression other) {
        FluxPower o = (FluxPower) other;
        return this.base.equals(o.base) && this.exponent.equals(o.exponent);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .append(this.base)
                .append(" ** ")
                .append(this.exponent)
                .append(")");
    }
}
