package org.dgflux.otCompiler.ir.expression;

import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.Objects;

/** Marks its child as shared: it is evaluated once, however many times it is referenced.
 * Passes that cache per-node results key them on instances of this class. */
public final class OTCommonSubexpression extends OTExpression {
    public final OTExpression child;
    /** Optional prefix for the name of the generated temporary. */
    @Nullable
    public final String prefix;

    public OTCommonSubexpression(OTExpression child, @Nullable String prefix) {
        this.child = child;
        this.prefix = prefix;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.child.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    /** Same prefix, different child. */
    public OTCommonSubexpression withChild(OTExpression child) {
        if (child == this.child)
            return this;
        return new OTCommonSubexpression(child, this.prefix);
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTCommonSubexpression.class, this.child, this.prefix);
    }

    @Override
    protected boolean sameStructure(OTExpression other) {
        OTCommonSubexpression o = (OTCommonSubexpression) other;
        return Objects.equals(this.prefix, o.prefix) && this.child.equals(o.child);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("cse");
        if (this.prefix != null)
            builder.append("_").append(this.prefix);
        return builder.append("(")
                .append(this.child)
                .append(")");
    }
}
