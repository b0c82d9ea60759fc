package org.dgflux.otCompiler.ir.flux;

import org.dgflux.util.IIndentStream;

public final class FluxScalarParameter extends FluxExpression {
    public final String name;

    public FluxScalarParameter(String name) {
        this.name = name;
    }

    @Override
    public FluxExpression rewrite(FluxRewriter rewriter) {
        return rewriter.rewrite(this);
    }

    @Override
    protected int computeHash() {
        return this.name.hashCode();
    }

    @Override
    protected boolean sameStructure(FluxExpression other) {
        return this.name.equals(((FluxScalarParameter) other).name);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("$").append(this.name);
    }
}
