package org.dgflux.otCompiler.ir.flux;

import com.google.common.collect.ImmutableList;
import org.dgflux.util.IIndentStream;

import java.util.List;
import java.util.Objects;

/** A pointwise function applied inside the flux kernel. */
public final class FluxCall extends FluxExpression {
    public final String function;
    public final ImmutableList<FluxExpression> parameters;

    public FluxCall(String function, List<FluxExpression> parameters) {
        this.function = function;
        this.parameters = ImmutableList.copyOf(parameters);
    }

    @Override
    public FluxExpression rewrite(FluxRewriter rewriter) {
        return rewriter.rewrite(this);
    }

    @Override
    protected int computeHash() {
        return Objects.hash(13, this.function, this.parameters);
    }

    @Override
    protected boolean sameStructure(FluxExpression other) {
        FluxCall o = (FluxCall) other;
        return this.function.equals(o.function) && this.parameters.equals(o.parameters);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.function)
                .append("(")
                .joinI(", ", this.parameters)
                .append(")");
    }
}
