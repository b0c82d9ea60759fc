package org.dgflux.otCompiler.ir.expression;

import com.google.common.collect.ImmutableList;
import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.util.IIndentStream;

import java.util.List;
import java.util.Objects;

/** Several fluxes evaluated together over all faces of the mesh:
 * the interior faces for the {@code interiors} fields, and one
 * boundary for each of the {@code boundaries} pairs. */
public final class OTWholeDomainFlux extends OTExpression {
    public final ImmutableList<OTExpression> interiors;
    public final ImmutableList<OTBoundaryPair> boundaries;
    /** True if the result is lifted to the volume. */
    public final boolean isLift;

    public OTWholeDomainFlux(List<OTExpression> interiors, List<OTBoundaryPair> boundaries, boolean isLift) {
        this.interiors = ImmutableList.copyOf(interiors);
        this.boundaries = ImmutableList.copyOf(boundaries);
        this.isLift = isLift;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (OTExpression interior: this.interiors)
            interior.accept(visitor);
        for (OTBoundaryPair pair: this.boundaries)
            pair.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTWholeDomainFlux.class, this.interiors, this.boundaries, this.isLift);
    }

    @Override
    protected boolean sameStructure(OTExpression other) {
        OTWholeDomainFlux o = (OTWholeDomainFlux) other;
        return this.isLift == o.isLift &&
                this.interiors.equals(o.interiors) &&
                this.boundaries.equals(o.boundaries);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.isLift ? "lift" : "flux")
                .append("_whole_domain(")
                .joinI(", ", this.interiors)
                .append("; ")
                .joinI(", ", this.boundaries)
                .append(")");
    }
}
