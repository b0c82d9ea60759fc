package org.dgflux.otCompiler.ir.flux;

import com.google.common.collect.ImmutableList;
import org.dgflux.util.IIndentStream;
import org.dgflux.util.Linq;
import org.dgflux.util.Utilities;

import java.util.List;

public final class FluxSum extends FluxExpression {
    public final ImmutableList<FluxExpression> terms;

    public FluxSum(List<FluxExpression> terms) {
        Utilities.enforce(!terms.isEmpty(), "Sum with no terms");
        this.terms = ImmutableList.copyOf(terms);
    }

    public FluxSum(FluxExpression... terms) {
        this(ImmutableList.copyOf(terms));
    }

    /** Build a sum, dropping the terms that are zero. */
    public static FluxExpression create(List<FluxExpression> terms) {
        List<FluxExpression> nonZero = Linq.where(terms, t -> !t.isZero());
        if (nonZero.isEmpty())
            return new FluxConstant(0);
        if (nonZero.size() == 1)
            return nonZero.get(0);
        return new FluxSum(nonZero);
    }

    @Override
    public FluxExpression rewrite(FluxRewriter rewriter) {
        return rewriter.rewrite(this);
    }

    @Override
    protected int computeHash() {
        return 3 * this.terms.hashCode() + 1;
    }

    @Override
    protected boolean sameStructure(FluxExpression other) {
        return this.terms.equals(((FluxSum) other).terms);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .joinI(" + ", this.terms)
                .append(")");
    }
}
