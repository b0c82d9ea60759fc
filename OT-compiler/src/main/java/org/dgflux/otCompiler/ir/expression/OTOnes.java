package org.dgflux.otCompiler.ir.expression;

import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.Objects;

/** A volume vector with all entries equal to one. */
public final class OTOnes extends OTLeafExpression {
    @Nullable
    public final String quadratureTag;

    public OTOnes(@Nullable String quadratureTag) {
        this.quadratureTag = quadratureTag;
    }

    public OTOnes() {
        this(null);
    }

    @Override
    protected VisitDecision preorder(InnerVisitor visitor) {
        return visitor.preorder(this);
    }

    @Override
    protected void postorder(InnerVisitor visitor) {
        visitor.postorder(this);
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTOnes.class, this.quadratureTag);
    }

    @Override
    protected boolean sameStructure(OTExpression other) {
        return Objects.equals(this.quadratureTag, ((OTOnes) other).quadratureTag);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("ones");
        if (this.quadratureTag != null)
            builder.append("@").append(this.quadratureTag);
        return builder;
    }
}
