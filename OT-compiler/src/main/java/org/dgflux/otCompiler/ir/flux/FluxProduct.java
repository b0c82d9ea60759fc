package org.dgflux.otCompiler.ir.flux;

import com.google.common.collect.ImmutableList;
import org.dgflux.util.IIndentStream;
import org.dgflux.util.Linq;
import org.dgflux.util.Utilities;

import java.util.List;

public final class FluxProduct extends FluxExpression {
    public final ImmutableList<FluxExpression> factors;

    public FluxProduct(List<FluxExpression> factors) {
        Utilities.enforce(!factors.isEmpty(), "Product with no factors");
        this.factors = ImmutableList.copyOf(factors);
    }

    public FluxProduct(FluxExpression... factors) {
        this(ImmutableList.copyOf(factors));
    }

    /** Build a product; the result is zero if any factor is zero. */
    public static FluxExpression create(List<FluxExpression> factors) {
        if (Linq.any(factors, FluxExpression::isZero))
            return new FluxConstant(0);
        if (factors.size() == 1)
            return factors.get(0);
        return new FluxProduct(factors);
    }

    @Override
    public FluxExpression rewrite(FluxRewriter rewriter) {
        return rewriter.rewrite(this);
    }

    @Override
    protected int computeHash() {
        return 5 * this.factors.hashCode() + 2;
    }

    @Override
    protected boolean sameStructure(FluxExpression other) {
        return this.factors.equals(((FluxProduct) other).factors);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .joinI(" * ", this.factors)
                .append(")");
    }
}
