package org.dgflux.otCompiler.ir.flux;

import org.dgflux.util.IIndentStream;

/** Field {@code index} on one side of the face.
 * Interior components index the volume fields of the flux operand,
 * exterior components its boundary (or neighbor) fields. */
public final class FluxFieldComponent extends FluxExpression {
    public final int index;
    public final boolean isInterior;

    public FluxFieldComponent(int index, boolean isInterior) {
        this.index = index;
        this.isInterior = isInterior;
    }

    public static FluxFieldComponent interior(int index) {
        return new FluxFieldComponent(index, true);
    }

    public static FluxFieldComponent exterior(int index) {
        return new FluxFieldComponent(index, false);
    }

    @Override
    public FluxExpression rewrite(FluxRewriter rewriter) {
        return rewriter.rewrite(this);
    }

    @Override
    protected int computeHash() {
        return 2 * this.index + (this.isInterior ? 1 : 0);
    }

    @Override
    protected boolean sameStructure(FluxExpression other) {
        FluxFieldComponent o = (FluxFieldComponent) other;
        return this.index == o.index && this.isInterior == o.isInterior;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.isInterior ? "int" : "ext")
                .append("[")
                .append(this.index)
                .append("]");
    }
}
