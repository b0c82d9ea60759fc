package org.dgflux.otCompiler.ir.flux;

import org.dgflux.util.IIndentStream;

import java.util.Objects;

public final class FluxQuotient extends FluxExpression {
    public final FluxExpression numerator;
    public final FluxExpression denominator;

    public FluxQuotient(FluxExpression numerator, FluxExpression denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    /** Build a quotient; a zero numerator gives zero. */
    public static FluxExpression create(FluxExpression numerator, FluxExpression denominator) {
        if (numerator.isZero())
            return new FluxConstant(0);
        return new FluxQuotient(numerator, denominator);
    }

    @Override
    public FluxExpression rewrite(FluxRewriter rewriter) {
        return rewriter.rewrite(this);
    }

    @Override
    protected int computeHash() {
        return Objects.hash(7, this.numerator, this.denominator);
    }

    @Override
    protected boolean sameStructure(FluxExpression other) {
        FluxQuotient o = (FluxQuotient) other;
        return this.numerator.equals(o.numerator) && this.denominator.equals(o.denominator);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .append(this.numerator)
                .append(" / ")
                .append(this.denominator)
                .append(")");
    }
}
