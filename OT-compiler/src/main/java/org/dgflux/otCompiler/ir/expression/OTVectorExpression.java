package org.dgflux.otCompiler.ir.expression;

import com.google.common.collect.ImmutableList;
import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.util.IIndentStream;

import java.util.List;

/** An ordered collection of independent expressions, e.g., the components of a vector field.
 * Each component is typed separately; the vector itself has no type. */
public final class OTVectorExpression extends OTExpression {
    public final ImmutableList<OTExpression> components;

    public OTVectorExpression(List<OTExpression> components) {
        this.components = ImmutableList.copyOf(components);
    }

    public OTVectorExpression(OTExpression... components) {
        this(ImmutableList.copyOf(components));
    }

    /** The components of a vector expression, or a singleton list with the expression. */
    public static ImmutableList<OTExpression> flatten(OTExpression expression) {
        if (expression instanceof OTVectorExpression vector)
            return vector.components;
        return ImmutableList.of(expression);
    }

    public int size() {
        return this.components.size();
    }

    public OTExpression get(int index) {
        return this.components.get(index);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (OTExpression component: this.components)
            component.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    protected int computeHash() {
        return 7 * OTVectorExpression.class.hashCode() + this.components.hashCode();
    }

    @Override
    protected boolean sameStructure(OTExpression other) {
        return this.components.equals(((OTVectorExpression) other).components);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("[")
                .joinI(", ", this.components)
                .append("]");
    }
}
