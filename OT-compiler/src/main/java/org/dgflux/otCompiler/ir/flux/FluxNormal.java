package org.dgflux.otCompiler.ir.flux;

import org.dgflux.util.IIndentStream;

/** Component {@code axis} of the face normal. */
public final class FluxNormal extends FluxExpression {
    public final int axis;

    public FluxNormal(int axis) {
        this.axis = axis;
    }

    @Override
    public FluxExpression rewrite(FluxRewriter rewriter) {
        return rewriter.rewrite(this);
    }

    @Override
    protected int computeHash() {
        return 101 + this.axis;
    }

    @Override
    protected boolean sameStructure(FluxExpression other) {
        return this.axis == ((FluxNormal) other).axis;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("n[").append(this.axis).append("]");
    }
}
