package org.dgflux.otCompiler.ir.flux;

import org.dgflux.otCompiler.ir.OTNode;

import javax.annotation.Nullable;

/** Base class for the expressions of a flux kernel.
 * A flux kernel is evaluated on each face, and can only refer to
 * the fields on the two sides of the face and to the face normal.
 * Like operator template expressions, flux expressions are immutable
 * and compared structurally. */
public abstract class FluxExpression extends OTNode {
    private int hash;
    private boolean hashComputed;

    protected FluxExpression() {
        super();
    }

    /** Let {@code rewriter} rebuild this expression. */
    public abstract FluxExpression rewrite(FluxRewriter rewriter);

    protected abstract int computeHash();

    protected abstract boolean sameStructure(FluxExpression other);

    /** True if this is the constant zero. */
    public boolean isZero() {
        return false;
    }

    @Override
    public final int hashCode() {
        if (!this.hashComputed) {
            this.hash = this.computeHash();
            this.hashComputed = true;
        }
        return this.hash;
    }

    @Override
    public final boolean equals(@Nullable Object o) {
        if (this == o)
            return true;
        if (o == null || this.getClass() != o.getClass())
            return false;
        FluxExpression other = (FluxExpression) o;
        if (this.hashCode() != other.hashCode())
            return false;
        return this.sameStructure(other);
    }

    public FluxExpression plus(FluxExpression other) {
        return new FluxSum(this, other);
    }

    public FluxExpression minus(FluxExpression other) {
        return new FluxSum(this, other.negate());
    }

    public FluxExpression times(FluxExpression other) {
        return new FluxProduct(this, other);
    }

    public FluxExpression times(double value) {
        return new FluxProduct(new FluxConstant(value), this);
    }

    public FluxExpression negate() {
        return new FluxProduct(new FluxConstant(-1), this);
    }
}
