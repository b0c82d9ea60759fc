package org.dgflux.otCompiler.ir.expression;

import com.google.common.collect.ImmutableList;
import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.otCompiler.ir.type.BoundaryTag;
import org.dgflux.util.IIndentStream;

import java.util.List;
import java.util.Objects;

/** Component {@code index} of the data received from partition {@code rank}.
 * The data lives on the boundary shared with that partition. */
public final class OTFluxExchange extends OTExpression {
    public final int index;
    public final int rank;
    /** Volume fields sent to the neighbor. */
    public final ImmutableList<OTExpression> argFields;

    public OTFluxExchange(int index, int rank, List<OTExpression> argFields) {
        this.index = index;
        this.rank = rank;
        this.argFields = ImmutableList.copyOf(argFields);
    }

    public BoundaryTag getBoundaryTag() {
        return BoundaryTag.forRank(this.rank);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (OTExpression arg: this.argFields)
            arg.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTFluxExchange.class, this.index, this.rank, this.argFields);
    }

    @Override
    protected boolean sameStructure(OTExpression other) {
        OTFluxExchange o = (OTFluxExchange) other;
        return this.index == o.index &&
                this.rank == o.rank &&
                this.argFields.equals(o.argFields);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("exchange<")
                .append(this.rank)
                .append(">[")
                .append(this.index)
                .append("](")
                .joinI(", ", this.argFields)
                .append(")");
    }
}
