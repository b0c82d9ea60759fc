package org.dgflux.otCompiler.ir.flux;

import com.google.common.collect.ImmutableList;
import org.dgflux.otCompiler.compiler.errors.InternalCompilerError;
import org.dgflux.util.Logger;

import java.util.List;

/** Replaces every exterior field component {@code ext[i]} with the i-th replacement.
 * Interior components and normals are kept. */
public class FluxSubstitution extends FluxRewriter {
    final ImmutableList<FluxExpression> exterior;

    public FluxSubstitution(List<FluxExpression> exterior, boolean simplify) {
        super(simplify);
        this.exterior = ImmutableList.copyOf(exterior);
    }

    @Override
    public FluxExpression rewrite(FluxFieldComponent expression) {
        if (expression.isInterior)
            return expression;
        if (expression.index >= this.exterior.size())
            throw new InternalCompilerError("Flux refers to exterior field " + expression.index +
                    " but only " + this.exterior.size() + " boundary fields are available", expression);
        FluxExpression result = this.exterior.get(expression.index);
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Substituting ")
                .append(expression)
                .append(" -> ")
                .append(result)
                .newline();
        return result;
    }
}
