package org.dgflux.otCompiler.ir.flux;

import org.dgflux.util.IIndentStream;

public final class FluxConstant extends FluxExpression {
    public final double value;

    public FluxConstant(double value) {
        this.value = value == 0 ? 0.0 : value;
    }

    @Override
    public boolean isZero() {
        return this.value == 0;
    }

    @Override
    public FluxExpression rewrite(FluxRewriter rewriter) {
        return rewriter.rewrite(this);
    }

    @Override
    protected int computeHash() {
        return Double.hashCode(this.value);
    }

    @Override
    protected boolean sameStructure(FluxExpression other) {
        return this.value == ((FluxConstant) other).value;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.value == Math.rint(this.value) && !Double.isInfinite(this.value))
            return builder.append((long) this.value);
        return builder.append(this.value);
    }
}
