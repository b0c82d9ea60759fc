package org.dgflux.otCompiler.ir.expression;

import com.google.common.collect.ImmutableList;
import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.util.IIndentStream;

import java.util.List;
import java.util.Objects;

/** Application of a pointwise function, such as {@code sqrt} or {@code abs}.
 * Functions are assumed not to change the type of their arguments. */
public final class OTCallExpression extends OTExpression {
    public final String function;
    public final ImmutableList<OTExpression> parameters;

    public OTCallExpression(String function, List<OTExpression> parameters) {
        this.function = function;
        this.parameters = ImmutableList.copyOf(parameters);
    }

    public OTCallExpression(String function, OTExpression... parameters) {
        this(function, ImmutableList.copyOf(parameters));
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (OTExpression parameter: this.parameters)
            parameter.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTCallExpression.class, this.function, this.parameters);
    }

    @Override
    protected boolean sameStructure(OTExpression other) {
        OTCallExpression o = (OTCallExpression) other;
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
